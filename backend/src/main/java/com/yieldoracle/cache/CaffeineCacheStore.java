package com.yieldoracle.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed {@link CacheStore}. Every entry carries its own TTL, so
 * snapshots written with different intervals expire independently.
 */
public class CaffeineCacheStore implements CacheStore {

    private record Entry(Object value, long ttlNanos) {}

    private final Cache<String, Entry> cache;

    public CaffeineCacheStore(Ticker ticker, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry e = cache.getIfPresent(key);
        if (e == null || !type.isInstance(e.value())) return Optional.empty();
        return Optional.of(type.cast(e.value()));
    }
}
