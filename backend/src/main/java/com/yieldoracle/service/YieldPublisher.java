package com.yieldoracle.service;

import com.yieldoracle.cache.CacheKeys;
import com.yieldoracle.cache.CacheStore;
import com.yieldoracle.config.AppProps;
import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.CacheSnapshot;
import com.yieldoracle.model.YieldSample;
import com.yieldoracle.repo.YieldStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Appends a cycle's samples and metrics to the durable store, then refreshes the cache.
 *
 * Store failures propagate as {@link PublishException} and leave the cache untouched.
 * On a store failure the cycle's samples are deleted again, so no sample outlives a
 * cycle without a metrics row.
 * Cache failures are logged only; the store is the source of truth.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class YieldPublisher {

    private final YieldStore store;
    private final CacheStore cache;
    private final AppProps props;
    private final Clock clock;

    public void publish(List<YieldSample> samples, AggregateMetrics metrics) {
        final String cycleId = metrics.getCycleId();
        try {
            store.insertSamples(samples);
            store.insertMetrics(metrics);
        } catch (RuntimeException e) {
            // a batch insert may have landed partially
            rollbackSamples(cycleId, e);
            throw new PublishException("Durable store write failed for cycle " + cycleId, e);
        }
        log.info("[publisher] stored {} sample(s) and metrics for cycle {}", samples.size(), cycleId);

        if (samples.isEmpty()) {
            // keep serving the previous snapshot until it expires
            log.warn("[publisher] cycle {} has no surviving samples, cache left as is", metrics.getCycleId());
            return;
        }
        refreshCache(samples, metrics);
    }

    private void rollbackSamples(String cycleId, RuntimeException cause) {
        try {
            store.deleteSamplesForCycle(cycleId);
        } catch (RuntimeException rollback) {
            cause.addSuppressed(rollback);
            log.error("[publisher] could not roll back samples of cycle {}: {}", cycleId, rollback.toString());
        }
    }

    private void refreshCache(List<YieldSample> samples, AggregateMetrics metrics) {
        Duration ttl = props.getPolling().getInterval();
        try {
            cache.set(CacheKeys.LATEST, new CacheSnapshot(metrics, List.copyOf(samples), clock.instant()), ttl);
            for (YieldSample s : samples) {
                cache.set(CacheKeys.protocol(s.getProtocolId()), s, ttl);
            }
            log.debug("[publisher] cache refreshed, ttl={}", ttl);
        } catch (RuntimeException e) {
            log.warn("[publisher] cache write failed for cycle {}: {}", metrics.getCycleId(), e.toString());
        }
    }
}
