package com.yieldoracle.service;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Registry entry plus live breaker state.
 */
@Data
@Builder
public class ProtocolStatus {
    private String id;
    private String name;
    private String address;
    private String encoding;
    private int riskScore;
    private BigInteger minLiquidity;

    private int consecutiveFailures;
    private Instant lastFailure;   // null if never failed
    private boolean breakerOpen;
}
