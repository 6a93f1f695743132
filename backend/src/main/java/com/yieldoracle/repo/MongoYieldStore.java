package com.yieldoracle.repo;

import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link YieldStore} on MongoDB. Writes go through {@code insert} so an existing
 * document can never be overwritten.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoYieldStore implements YieldStore {

    private final YieldSampleRepo sampleRepo;
    private final AggregateMetricsRepo metricsRepo;

    @Override
    public void insertSamples(List<YieldSample> samples) {
        if (samples.isEmpty()) return;
        sampleRepo.insert(samples);
        log.debug("[store] inserted {} yield samples", samples.size());
    }

    @Override
    public void insertMetrics(AggregateMetrics metrics) {
        metricsRepo.insert(metrics);
        log.debug("[store] inserted metrics cycle={}", metrics.getCycleId());
    }

    @Override
    public void deleteSamplesForCycle(String cycleId) {
        long n = sampleRepo.deleteByCycleId(cycleId);
        log.warn("[store] rolled back {} sample(s) of cycle {}", n, cycleId);
    }

    @Override
    public Optional<AggregateMetrics> queryLatestMetrics() {
        return metricsRepo.findTopByOrderByTsDesc();
    }

    @Override
    public List<YieldSample> querySamplesForCycle(String cycleId) {
        return sampleRepo.findByCycleIdOrderByProtocolIdAsc(cycleId);
    }

    @Override
    public List<YieldSample> querySamplesSince(String protocolId, Instant since) {
        return sampleRepo.findByProtocolIdAndTsGreaterThanEqualOrderByTsAsc(protocolId, since);
    }

    @Override
    public Optional<YieldSample> queryLatestSample(String protocolId) {
        return sampleRepo.findTopByProtocolIdOrderByTsDesc(protocolId);
    }
}
