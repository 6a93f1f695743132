package com.yieldoracle.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Normalized reading of one protocol in one cycle. Rows are only ever inserted.
 */
@Value
@Builder
@AllArgsConstructor
@Document("yield_samples")
@CompoundIndex(name = "by_protocol_ts", def = "{'protocolId':1,'ts':1}")
public class YieldSample {

    @Id
    @With
    String id;

    /** Cycle that produced this sample; shared with the cycle's metrics row. */
    @Indexed
    @With
    String cycleId;

    String protocolId;

    /** Annualized yield in percent, 0..100. */
    double apy;

    /** Smallest units of the underlying token. */
    BigInteger liquidity;
    BigInteger tvl;

    /** Copied from the protocol source. */
    int riskScore;

    /** When the chain reads were issued. */
    Instant ts;
}
