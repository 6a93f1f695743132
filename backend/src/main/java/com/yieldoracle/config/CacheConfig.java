package com.yieldoracle.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.yieldoracle.cache.CacheStore;
import com.yieldoracle.cache.CaffeineCacheStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process Caffeine cache for the latest yield snapshot.
 */
@Configuration
public class CacheConfig {

    public static final long MAX_ENTRIES = 1_000;

    @Bean
    public CacheStore cacheStore() {
        return new CaffeineCacheStore(Ticker.systemTicker(), MAX_ENTRIES);
    }
}
