package com.yieldoracle.service;

import com.yieldoracle.model.AggregateMetrics;
import lombok.Value;

import java.util.Map;

/**
 * Published on the application event bus after a cycle has been stored.
 * Carries the aggregate plus each surviving protocol's APY, for rebalancing consumers.
 */
@Value
public class YieldCycleCompletedEvent {
    AggregateMetrics metrics;
    Map<String, Double> apyByProtocol;
}
