package com.yieldoracle.service;

import com.yieldoracle.model.AggregateMetrics;
import com.yieldoracle.model.YieldSample;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Cross-sectional statistics over one cycle's samples.
 *
 * Volatility and Sharpe are computed over the protocols of a single cycle, not over
 * time: the Sharpe figure is a dispersion-adjusted yield score rather than a true
 * Sharpe ratio. Samples are summed in protocol-id order so the result does not depend
 * on the order in which collectors finished.
 */
@Component
public class YieldAggregator {

    public static final double RISK_FREE_RATE_PCT = 2.0;

    /**
     * @return metrics without id, cycle id or timestamp; the caller stamps those
     */
    public AggregateMetrics aggregate(List<YieldSample> samples) {
        List<YieldSample> ordered = samples.stream()
                .sorted(Comparator.comparing(YieldSample::getProtocolId))
                .toList();

        BigInteger totalTvl = BigInteger.ZERO;
        double weightedSum = 0;
        for (YieldSample s : ordered) {
            totalTvl = totalTvl.add(s.getTvl());
            weightedSum += s.getApy() * s.getTvl().doubleValue();
        }
        double weightedApy = totalTvl.signum() > 0 ? weightedSum / totalTvl.doubleValue() : 0;

        double volatility = populationStdDev(ordered);
        double sharpe = volatility > 0 ? (weightedApy - RISK_FREE_RATE_PCT) / volatility : 0;

        return AggregateMetrics.builder()
                .weightedApy(weightedApy)
                .volatility(volatility)
                .sharpe(sharpe)
                .totalTvl(totalTvl)
                .protocolCount(ordered.size())
                .build();
    }

    static double populationStdDev(List<YieldSample> samples) {
        int n = samples.size();
        if (n < 2) return 0;
        double sum = 0;
        for (YieldSample s : samples) sum += s.getApy();
        double mean = sum / n;
        double sq = 0;
        for (YieldSample s : samples) {
            double d = s.getApy() - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / n);
    }
}
