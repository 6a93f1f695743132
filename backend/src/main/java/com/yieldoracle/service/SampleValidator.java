package com.yieldoracle.service;

import com.yieldoracle.registry.ProtocolSource;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Plausibility checks on a normalized reading.
 */
@Component
public class SampleValidator {

    public static final double MAX_APY_PCT = 100.0;

    /** Upper TVL bound in whole tokens; scaled by the source's decimals. */
    public static final BigInteger MAX_TVL_TOKENS = BigInteger.valueOf(1_000_000_000L);

    /**
     * @return the rejection reason, or empty if the reading is acceptable
     */
    public Optional<String> check(ProtocolSource source, double apyPct, BigInteger tvl, BigInteger liquidity) {
        if (Double.isNaN(apyPct) || apyPct < 0 || apyPct > MAX_APY_PCT) {
            return Optional.of("APY " + apyPct + "% outside [0, " + MAX_APY_PCT + "]");
        }
        if (liquidity == null || liquidity.compareTo(source.getMinLiquidity()) < 0) {
            return Optional.of("liquidity " + liquidity + " below floor " + source.getMinLiquidity());
        }
        BigInteger maxTvl = MAX_TVL_TOKENS.multiply(source.unitScale());
        if (tvl == null || tvl.signum() < 0 || tvl.compareTo(maxTvl) > 0) {
            return Optional.of("TVL " + tvl + " outside [0, " + maxTvl + "]");
        }
        return Optional.empty();
    }
}
