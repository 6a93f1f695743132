package com.yieldoracle.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** What the cache holds under the "latest" key. */
@Value
public class CacheSnapshot {
    AggregateMetrics metrics;
    List<YieldSample> samples;
    Instant cachedAt;
}
