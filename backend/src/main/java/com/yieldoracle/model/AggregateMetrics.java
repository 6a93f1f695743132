package com.yieldoracle.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Cross-protocol metrics of one cycle. One new row per cycle; never updated.
 */
@Value
@Builder
@AllArgsConstructor
@Document("aggregate_metrics")
public class AggregateMetrics {

    @Id
    @With
    String id;

    @Indexed
    @With
    String cycleId;

    @Indexed(direction = IndexDirection.DESCENDING)
    @With
    Instant ts;

    /** TVL-weighted mean APY, percent. */
    double weightedApy;

    /** Population standard deviation of the sample APYs. */
    double volatility;

    /** (weightedApy - risk free) / volatility; 0 when volatility is 0. */
    double sharpe;

    BigInteger totalTvl;

    /** Number of samples that survived the cycle. */
    int protocolCount;
}
