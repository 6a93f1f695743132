package com.yieldoracle.service;

import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;
import lombok.Value;

import java.util.List;

/**
 * Latest aggregate plus the samples it was computed from.
 */
@Value
public class LatestYield {

    public enum Source { CACHE, STORE }

    AggregateMetrics metrics;
    List<YieldSample> samples;
    /** Where the answer came from. */
    Source source;
}
