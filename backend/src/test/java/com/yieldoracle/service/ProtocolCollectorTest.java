package com.yieldoracle.service;

import com.yieldoracle.model.YieldSample;
import com.yieldoracle.registry.ProtocolSource;
import com.yieldoracle.support.MutableClock;
import com.yieldoracle.support.TestSources;
import com.yieldoracle.web3.ChainClient;
import com.yieldoracle.web3.exception.RetryableRpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProtocolCollectorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    ChainClient chainClient;

    private MutableClock clock;
    private CircuitBreakerRegistry breakers;
    private ProtocolCollector collector;
    private ProtocolSource source;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        breakers = new CircuitBreakerRegistry(5, Duration.ofMinutes(30), clock);
        collector = new ProtocolCollector(chainClient, new ApyNormalizer(), new SampleValidator(), breakers, clock);
        source = TestSources.bps("klayswap", TestSources.address(7));
    }

    private void answer(long apyBps, long tvl, long liquidity) {
        when(chainClient.call(source.getAddress(), source.getApyCall())).thenReturn(BigInteger.valueOf(apyBps));
        when(chainClient.call(source.getAddress(), source.getTvlCall())).thenReturn(BigInteger.valueOf(tvl));
        when(chainClient.call(source.getAddress(), source.getLiquidityCall())).thenReturn(BigInteger.valueOf(liquidity));
    }

    @Test
    void collect_buildsNormalizedSample() {
        answer(850, 2_000_000, 1_500_000);

        Optional<YieldSample> out = collector.collect(source);

        assertThat(out).hasValueSatisfying(s -> {
            assertThat(s.getProtocolId()).isEqualTo("klayswap");
            assertThat(s.getApy()).isEqualTo(8.5);
            assertThat(s.getTvl()).isEqualTo(BigInteger.valueOf(2_000_000));
            assertThat(s.getLiquidity()).isEqualTo(BigInteger.valueOf(1_500_000));
            assertThat(s.getRiskScore()).isEqualTo(300);
            assertThat(s.getTs()).isEqualTo(T0);
            assertThat(s.getId()).isNull();
        });
        assertThat(breakers.failureCount("klayswap")).isZero();
    }

    @Test
    @DisplayName("an implausible APY is rejected and counts as a failure")
    void collect_rejectsInvalidApy() {
        answer(15_000, 2_000_000, 1_500_000);

        assertThat(collector.collect(source)).isEmpty();
        assertThat(breakers.failureCount("klayswap")).isEqualTo(1);
    }

    @Test
    void collect_isolatesChainErrors() {
        when(chainClient.call(anyString(), any())).thenThrow(new RetryableRpcException("connection refused"));

        assertThat(collector.collect(source)).isEmpty();
        assertThat(breakers.failureCount("klayswap")).isEqualTo(1);
    }

    @Test
    @DisplayName("open breaker skips the protocol without touching the chain")
    void collect_skipsWhenBreakerOpen() {
        for (int i = 0; i < 5; i++) breakers.recordResult("klayswap", false);

        assertThat(collector.collect(source)).isEmpty();

        verifyNoInteractions(chainClient);
        assertThat(breakers.failureCount("klayswap")).isEqualTo(5);
    }

    @Test
    void collect_retriesAfterCooldownAndSuccessCloses() {
        for (int i = 0; i < 5; i++) breakers.recordResult("klayswap", false);
        clock.advance(Duration.ofMinutes(31));
        answer(500, 1_000_000, 1_000_000);

        assertThat(collector.collect(source)).isPresent();

        verify(chainClient, times(1)).call(eq(source.getAddress()), eq(source.getApyCall()));
        assertThat(breakers.failureCount("klayswap")).isZero();
        assertThat(breakers.isOpen("klayswap")).isFalse();
    }

    @Test
    void collect_fiveFailuresOpenTheBreaker() {
        when(chainClient.call(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        for (int i = 0; i < 5; i++) collector.collect(source);
        assertThat(breakers.isOpen("klayswap")).isTrue();

        collector.collect(source);
        // only the first call of each of the five attempts reached the chain
        verify(chainClient, times(5)).call(anyString(), any());
    }
}
