package com.yieldoracle.registry;

import java.util.Locale;

/**
 * How a protocol encodes its on-chain rate.
 */
public enum EncodingKind {
    /** 1e27-scaled per-second rate. */
    RAY,
    /** Annualized, hundredths of a percent. */
    BASIS_POINTS,
    /** 1e18-scaled per-block rate. */
    PER_BLOCK,
    /** Unrecognized encoding; read as basis points. */
    DEFAULT;

    public static EncodingKind parse(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (EncodingKind k : values()) {
            if (k.name().equals(v)) return k;
        }
        return DEFAULT;
    }
}
