package com.yieldoracle.service;

import com.yieldoracle.model.RawReading;
import com.yieldoracle.model.YieldSample;
import com.yieldoracle.registry.ProtocolSource;
import com.yieldoracle.web3.ChainClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Reads APY, TVL and liquidity for one protocol and turns them into a {@link YieldSample}.
 *
 * Never throws: every failure (RPC error, timeout, bad data) is recorded on the
 * protocol's breaker and reported as an empty result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolCollector {

    private final ChainClient chainClient;
    private final ApyNormalizer normalizer;
    private final SampleValidator validator;
    private final CircuitBreakerRegistry breakers;
    private final Clock clock;

    public Optional<YieldSample> collect(ProtocolSource source) {
        final String id = source.getId();

        if (breakers.isOpen(id)) {
            log.warn("[collector] circuit breaker open for {}, skipping", id);
            return Optional.empty();
        }

        try {
            RawReading raw = read(source);

            double apy = normalizer.toPercent(source, raw.getRawApy());
            Optional<String> rejection = validator.check(source, apy, raw.getRawTvl(), raw.getRawLiquidity());
            if (rejection.isPresent()) {
                log.warn("[collector] invalid yield data for {}: {}", id, rejection.get());
                breakers.recordResult(id, false);
                return Optional.empty();
            }

            breakers.recordResult(id, true);
            YieldSample sample = YieldSample.builder()
                    .protocolId(id)
                    .apy(apy)
                    .liquidity(raw.getRawLiquidity())
                    .tvl(raw.getRawTvl())
                    .riskScore(source.getRiskScore())
                    .ts(raw.getTs())
                    .build();
            log.debug("[collector] {} apy={}% tvl={} liquidity={}", id, apy, sample.getTvl(), sample.getLiquidity());
            return Optional.of(sample);
        } catch (Exception e) {
            log.warn("[collector] failed to collect {}: {}", id, e.toString());
            breakers.recordResult(id, false);
            return Optional.empty();
        }
    }

    private RawReading read(ProtocolSource source) {
        var ts = clock.instant();
        var apy = chainClient.call(source.getAddress(), source.getApyCall());
        var tvl = chainClient.call(source.getAddress(), source.getTvlCall());
        var liquidity = chainClient.call(source.getAddress(), source.getLiquidityCall());
        return new RawReading(source.getId(), apy, tvl, liquidity, ts);
    }
}
