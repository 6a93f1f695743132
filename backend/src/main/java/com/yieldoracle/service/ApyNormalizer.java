package com.yieldoracle.service;

import com.yieldoracle.registry.EncodingKind;
import com.yieldoracle.registry.ProtocolSource;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Converts a protocol's raw on-chain rate into an annualized percentage.
 */
@Component
public class ApyNormalizer {

    public static final double SECONDS_PER_YEAR = 31_536_000d;

    private static final BigDecimal RAY = BigDecimal.TEN.pow(27);
    private static final BigDecimal WAD = BigDecimal.TEN.pow(18);
    private static final BigDecimal BPS = BigDecimal.valueOf(100);

    public double toPercent(ProtocolSource source, BigInteger raw) {
        return toPercent(source.getEncoding(), raw, source.getBlockTimeSeconds());
    }

    /**
     * @param blockTimeSeconds assumed block time, only read for {@link EncodingKind#PER_BLOCK}
     */
    public double toPercent(EncodingKind encoding, BigInteger raw, double blockTimeSeconds) {
        if (raw == null) throw new IllegalArgumentException("raw rate is null");
        BigDecimal r = new BigDecimal(raw);
        switch (encoding == null ? EncodingKind.DEFAULT : encoding) {
            case RAY:
                // per-second rate, scaled by 1e27
                return r.divide(RAY, MathContext.DECIMAL128).doubleValue() * SECONDS_PER_YEAR * 100;
            case PER_BLOCK: {
                if (!(blockTimeSeconds > 0)) {
                    throw new IllegalArgumentException("block time must be positive: " + blockTimeSeconds);
                }
                double blocksPerYear = SECONDS_PER_YEAR / blockTimeSeconds;
                return r.divide(WAD, MathContext.DECIMAL128).doubleValue() * blocksPerYear * 100;
            }
            case BASIS_POINTS:
            case DEFAULT:
            default:
                return r.divide(BPS, MathContext.DECIMAL128).doubleValue();
        }
    }
}
