package com.yieldoracle.model;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/** Undecoded values as returned by the chain, before normalization. */
@Value
public class RawReading {
    String protocolId;
    BigInteger rawApy;
    BigInteger rawTvl;
    BigInteger rawLiquidity;
    Instant ts;
}
