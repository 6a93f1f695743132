package com.yieldoracle.repo;

import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only time series of samples and per-cycle metrics.
 * Implementations never update a row after insertion; the only removal is the
 * rollback of a cycle whose metrics row could not be written.
 */
public interface YieldStore {

    void insertSamples(List<YieldSample> samples);

    void insertMetrics(AggregateMetrics metrics);

    /** Removes the samples of a cycle that never got its metrics row. */
    void deleteSamplesForCycle(String cycleId);

    Optional<AggregateMetrics> queryLatestMetrics();

    List<YieldSample> querySamplesForCycle(String cycleId);

    /** Samples of one protocol with ts >= since, oldest first. */
    List<YieldSample> querySamplesSince(String protocolId, Instant since);

    Optional<YieldSample> queryLatestSample(String protocolId);
}
