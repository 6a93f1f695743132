package com.yieldoracle.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validators/normalizers for EVM contract addresses used in protocol config.
 */
public final class AddressUtil {
    private AddressUtil(){}

    private static final Pattern HEX_40 = Pattern.compile("[0-9a-fA-F]{40}");

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        String a = addr.trim();
        if (!a.startsWith("0x")) throw new IllegalArgumentException("address must start with 0x: " + addr);
        String hex = a.substring(2);
        if (!HEX_40.matcher(hex).matches()) {
            throw new IllegalArgumentException("invalid address (need 40 hex chars): " + addr);
        }
        return "0x" + hex.toLowerCase(Locale.ROOT);
    }
}
