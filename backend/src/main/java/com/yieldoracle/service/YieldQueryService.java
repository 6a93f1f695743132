package com.yieldoracle.service;

import com.yieldoracle.cache.CacheKeys;
import com.yieldoracle.cache.CacheStore;
import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.CacheSnapshot;
import com.yieldoracle.model.CircuitBreakerState;
import com.yieldoracle.model.YieldSample;
import com.yieldoracle.registry.ProtocolRegistry;
import com.yieldoracle.registry.ProtocolSource;
import com.yieldoracle.repo.YieldStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side: cache first, durable store as fallback. Never writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class YieldQueryService {

    public static final int DEFAULT_WINDOW_HOURS = 24;

    private final CacheStore cache;
    private final YieldStore store;
    private final ProtocolRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final Clock clock;

    /**
     * Latest snapshot. Served from the cache while it is fresh; otherwise the newest
     * metrics row and the samples of the same cycle. Empty when nothing was ever stored.
     */
    public Optional<LatestYield> getLatest() {
        Optional<CacheSnapshot> cached = cache.get(CacheKeys.LATEST, CacheSnapshot.class);
        if (cached.isPresent()) {
            CacheSnapshot snap = cached.get();
            return Optional.of(new LatestYield(snap.getMetrics(), snap.getSamples(), LatestYield.Source.CACHE));
        }

        log.debug("[query] cache miss for {}, falling back to store", CacheKeys.LATEST);
        Optional<AggregateMetrics> metrics = store.queryLatestMetrics();
        return metrics.map(m -> new LatestYield(m, store.querySamplesForCycle(m.getCycleId()), LatestYield.Source.STORE));
    }

    /**
     * Samples of one protocol in the last {@code windowHours}, oldest first. Not cached.
     */
    public List<YieldSample> getProtocolHistory(String protocolId, int windowHours) {
        requireKnown(protocolId);
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be positive: " + windowHours);
        }
        Instant since = clock.instant().minus(Duration.ofHours(windowHours));
        return store.querySamplesSince(protocolId, since);
    }

    public Optional<YieldSample> getProtocolLatest(String protocolId) {
        requireKnown(protocolId);
        Optional<YieldSample> cached = cache.get(CacheKeys.protocol(protocolId), YieldSample.class);
        if (cached.isPresent()) return cached;
        return store.queryLatestSample(protocolId);
    }

    /** Registered protocols with their current breaker state. */
    public List<ProtocolStatus> protocols() {
        return registry.all().stream().map(this::toStatus).toList();
    }

    private ProtocolStatus toStatus(ProtocolSource s) {
        Optional<CircuitBreakerState> st = breakers.state(s.getId());
        return ProtocolStatus.builder()
                .id(s.getId())
                .name(s.getName())
                .address(s.getAddress())
                .encoding(s.getEncoding().name())
                .riskScore(s.getRiskScore())
                .minLiquidity(s.getMinLiquidity())
                .consecutiveFailures(st.map(CircuitBreakerState::getFailures).orElse(0))
                .lastFailure(st.map(CircuitBreakerState::getLastFailure)
                        .filter(t -> !Instant.EPOCH.equals(t))
                        .orElse(null))
                .breakerOpen(breakers.isOpen(s.getId()))
                .build();
    }

    private void requireKnown(String protocolId) {
        if (!registry.contains(protocolId)) throw new UnknownProtocolException(protocolId);
    }
}
