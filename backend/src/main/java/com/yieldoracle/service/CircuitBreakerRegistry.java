package com.yieldoracle.service;

import com.yieldoracle.config.AppProps;
import com.yieldoracle.model.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-protocol circuit breakers. A breaker is open while the protocol has at least
 * {@code failureThreshold} consecutive failures and the last one is younger than
 * {@code cooldown}. Any success closes it.
 */
@Component
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    @Autowired
    public CircuitBreakerRegistry(AppProps props, Clock clock) {
        this(props.getBreaker().getFailureThreshold(), props.getBreaker().getCooldown(), clock);
    }

    public CircuitBreakerRegistry(int failureThreshold, Duration cooldown, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public void recordResult(String protocolId, boolean success) {
        Instant now = clock.instant();
        CircuitBreakerState next = states.compute(protocolId, (id, cur) -> {
            CircuitBreakerState base = cur == null ? CircuitBreakerState.initial(id) : cur;
            return success ? base.onSuccess() : base.onFailure(now);
        });
        if (!success && next.getFailures() == failureThreshold) {
            log.warn("[breaker] {} opened after {} consecutive failures, cooling down for {}",
                    protocolId, next.getFailures(), cooldown);
        }
    }

    public boolean isOpen(String protocolId) {
        CircuitBreakerState s = states.get(protocolId);
        if (s == null) return false;
        return s.getFailures() >= failureThreshold
                && Duration.between(s.getLastFailure(), clock.instant()).compareTo(cooldown) < 0;
    }

    public Optional<CircuitBreakerState> state(String protocolId) {
        return Optional.ofNullable(states.get(protocolId));
    }

    public int failureCount(String protocolId) {
        return state(protocolId).map(CircuitBreakerState::getFailures).orElse(0);
    }
}
