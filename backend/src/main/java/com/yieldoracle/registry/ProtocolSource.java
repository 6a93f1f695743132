package com.yieldoracle.registry;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Immutable description of one yield source, built once at startup.
 */
@Value
@Builder
public class ProtocolSource {
    String id;
    String name;
    /** Normalized contract address (0x + 40 lowercase hex). */
    String address;
    ContractCall apyCall;
    ContractCall tvlCall;
    ContractCall liquidityCall;
    EncodingKind encoding;
    /** Lower = safer. */
    int riskScore;
    BigInteger minLiquidity;
    int tokenDecimals;
    double blockTimeSeconds;

    /** 10^decimals: one whole token in smallest units. */
    public BigInteger unitScale() {
        return BigInteger.TEN.pow(tokenDecimals);
    }
}
