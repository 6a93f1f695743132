package com.yieldoracle.service;

import com.yieldoracle.config.AsyncConfig;
import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;
import com.yieldoracle.registry.ProtocolRegistry;
import com.yieldoracle.registry.ProtocolSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One yield cycle: collect every registered protocol in parallel, aggregate the
 * survivors, publish. Per-protocol failures never fail the cycle; only a store
 * failure in the publisher does.
 */
@Service
@Slf4j
public class YieldCycleService {

    private final ProtocolRegistry registry;
    private final ProtocolCollector collector;
    private final YieldAggregator aggregator;
    private final YieldPublisher publisher;
    private final ApplicationEventPublisher events;
    private final Executor collectorExecutor;
    private final Clock clock;

    // cycles never overlap
    private final ReentrantLock cycleLock = new ReentrantLock();

    public YieldCycleService(ProtocolRegistry registry,
                             ProtocolCollector collector,
                             YieldAggregator aggregator,
                             YieldPublisher publisher,
                             ApplicationEventPublisher events,
                             @Qualifier(AsyncConfig.COLLECTOR_EXECUTOR) Executor collectorExecutor,
                             Clock clock) {
        this.registry = registry;
        this.collector = collector;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.events = events;
        this.collectorExecutor = collectorExecutor;
        this.clock = clock;
    }

    /**
     * Run a full cycle. Blocks while another cycle is in flight.
     *
     * @throws PublishException if the durable store rejects the cycle's rows
     */
    public AggregateMetrics runCycle() {
        cycleLock.lock();
        try {
            return doRunCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    boolean isCycleRunning() {
        return cycleLock.isLocked();
    }

    private AggregateMetrics doRunCycle() {
        final String cycleId = UUID.randomUUID().toString();
        final Instant startedAt = clock.instant();
        final List<ProtocolSource> sources = registry.all();
        log.info("[cycle] {} started for {} protocol(s)", cycleId, sources.size());

        List<YieldSample> samples = collectAll(sources).stream()
                .map(s -> s.withCycleId(cycleId))
                .toList();

        AggregateMetrics metrics = aggregator.aggregate(samples)
                .withCycleId(cycleId)
                .withTs(clock.instant());

        publisher.publish(samples, metrics);

        Map<String, Double> apyByProtocol = new LinkedHashMap<>();
        samples.forEach(s -> apyByProtocol.put(s.getProtocolId(), s.getApy()));
        try {
            events.publishEvent(new YieldCycleCompletedEvent(metrics, Map.copyOf(apyByProtocol)));
        } catch (RuntimeException e) {
            // rows are already stored; a listener fault must not fail the cycle
            log.warn("[cycle] {} listener failed: {}", cycleId, e.toString());
        }

        long tookMs = clock.millis() - startedAt.toEpochMilli();
        log.info("[cycle] {} completed in {}ms: {}/{} protocol(s), weightedApy={}%, volatility={}, sharpe={}",
                cycleId, tookMs, samples.size(), sources.size(),
                String.format("%.4f", metrics.getWeightedApy()),
                String.format("%.4f", metrics.getVolatility()),
                String.format("%.4f", metrics.getSharpe()));
        return metrics;
    }

    /** Fan out and join; a task that fails to run counts as an empty result. */
    private List<YieldSample> collectAll(List<ProtocolSource> sources) {
        List<CompletableFuture<Optional<YieldSample>>> futures = new ArrayList<>(sources.size());
        for (ProtocolSource source : sources) {
            CompletableFuture<Optional<YieldSample>> f;
            try {
                f = CompletableFuture.supplyAsync(() -> collector.collect(source), collectorExecutor);
            } catch (RuntimeException rejected) {
                f = CompletableFuture.failedFuture(rejected);
            }
            futures.add(f.exceptionally(ex -> {
                log.error("[cycle] collector task for {} did not complete: {}", source.getId(), ex.toString());
                return Optional.empty();
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<YieldSample> out = new ArrayList<>(futures.size());
        for (CompletableFuture<Optional<YieldSample>> f : futures) {
            f.join().ifPresent(out::add);
        }
        return out;
    }
}
