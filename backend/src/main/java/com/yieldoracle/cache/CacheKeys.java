package com.yieldoracle.cache;

public final class CacheKeys {
    private CacheKeys() {}

    public static final String LATEST = "yield_data:latest";

    public static String protocol(String protocolId) {
        return "yield_data:" + protocolId;
    }
}
