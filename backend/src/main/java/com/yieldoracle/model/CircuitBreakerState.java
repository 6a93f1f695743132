package com.yieldoracle.model;

import lombok.Value;

import java.time.Instant;

/**
 * Consecutive-failure bookkeeping for one protocol. Replaced, not mutated, on every result.
 */
@Value
public class CircuitBreakerState {
    String protocolId;
    int failures;
    Instant lastFailure;

    public static CircuitBreakerState initial(String protocolId) {
        return new CircuitBreakerState(protocolId, 0, Instant.EPOCH);
    }

    public CircuitBreakerState onSuccess() {
        return new CircuitBreakerState(protocolId, 0, lastFailure);
    }

    public CircuitBreakerState onFailure(Instant at) {
        return new CircuitBreakerState(protocolId, failures + 1, at);
    }
}
