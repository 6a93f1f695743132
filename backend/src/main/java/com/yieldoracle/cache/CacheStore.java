package com.yieldoracle.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Low-latency key/value cache with per-entry time-to-live.
 */
public interface CacheStore {

    void set(String key, Object value, Duration ttl);

    /**
     * @return the value if present, unexpired and of the requested type
     */
    <T> Optional<T> get(String key, Class<T> type);
}
