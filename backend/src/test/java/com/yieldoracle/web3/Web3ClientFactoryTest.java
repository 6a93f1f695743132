package com.yieldoracle.web3;

import com.yieldoracle.config.AppProps;
import com.yieldoracle.support.MutableClock;
import com.yieldoracle.web3.exception.ChainCallException;
import com.yieldoracle.web3.exception.RetryableRpcException;
import com.yieldoracle.web3.exception.RpcTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.Web3j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class Web3ClientFactoryTest {

    private Web3j first;
    private Web3j second;
    private MutableClock clock;
    private Web3ClientFactory factory;

    @BeforeEach
    void setUp() {
        first = mock(Web3j.class);
        second = mock(Web3j.class);
        Map<String, Web3j> byUrl = Map.of("https://rpc-1", first, "https://rpc-2", second);

        AppProps.Chain chain = new AppProps.Chain();
        chain.setRpcUrls(List.of("https://rpc-1", "https://rpc-2"));
        chain.setBaseBackoff(Duration.ZERO);
        chain.setFailoverPenalty(Duration.ofMinutes(1));
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        factory = new Web3ClientFactory(chain, byUrl::get, clock);
    }

    @Test
    @DisplayName("retryable error on the first endpoint fails over to the second")
    void failsOverOnRetryable() {
        List<Web3j> seen = new ArrayList<>();

        String out = factory.executeWithFailover(w -> {
            seen.add(w);
            if (w == first) throw new RetryableRpcException("429 too many requests");
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(seen).containsExactly(first, second);
    }

    @Test
    void penalizedEndpointIsSkippedOnNextCall() {
        factory.executeWithFailover(w -> {
            if (w == first) throw new RetryableRpcException("connection refused");
            return 1;
        });
        List<Web3j> seen = new ArrayList<>();

        factory.executeWithFailover(w -> {
            seen.add(w);
            return 2;
        });

        assertThat(seen).containsExactly(second);
    }

    @Test
    @DisplayName("a benched endpoint is tried again once its penalty has passed")
    void penaltyExpires() {
        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            throw new RetryableRpcException("rate limit");
        })).isInstanceOf(RetryableRpcException.class);

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        String back = factory.executeWithFailover(w -> "back");
        assertThat(back).isEqualTo("back");
    }

    @Test
    void transportMessagesCountAsRetryable() {
        String out = factory.executeWithFailover(w -> {
            if (w == first) throw new IllegalStateException("Read timed out");
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
    }

    @Test
    @DisplayName("contract-level failures are not retried on other endpoints")
    void chainCallExceptionIsNotRetried() {
        List<Web3j> seen = new ArrayList<>();

        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            seen.add(w);
            throw new ChainCallException("execution reverted");
        })).isInstanceOf(ChainCallException.class);

        assertThat(seen).hasSize(1);
    }

    @Test
    void unknownNonTransportErrorPropagates() {
        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            throw new UnsupportedOperationException("bad abi");
        })).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void allEndpointsFailing() {
        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            throw new RetryableRpcException("rate limit");
        })).isInstanceOf(RetryableRpcException.class);
    }

    @Test
    @DisplayName("with every endpoint benched, the one released first is still tried")
    void allBenchedStillTriesSoonestReleased() {
        factory.executeWithFailover(w -> {
            if (w == first) throw new RetryableRpcException("rate limit");
            return 1;
        });
        clock.advance(Duration.ofSeconds(10));
        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            throw new RetryableRpcException("rate limit");
        })).isInstanceOf(RetryableRpcException.class);
        List<Web3j> seen = new ArrayList<>();

        String out = factory.executeWithFailover(w -> {
            seen.add(w);
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(seen).containsExactly(first);
    }

    @Test
    @DisplayName("a call timeout moves on without benching the endpoint")
    void timeoutDoesNotBench() {
        List<Web3j> seen = new ArrayList<>();
        assertThatThrownBy(() -> factory.executeWithFailover(w -> {
            seen.add(w);
            throw new RpcTimeoutException("getPoolAPY timed out after 200ms", null);
        })).isInstanceOf(RpcTimeoutException.class);
        assertThat(seen).containsExactly(first, second);
        seen.clear();

        String out = factory.executeWithFailover(w -> {
            seen.add(w);
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(seen).containsExactly(first);
    }

    @Test
    void noEndpointsConfigured() {
        Web3ClientFactory empty = new Web3ClientFactory(new AppProps.Chain(), url -> first, clock);

        assertThatThrownBy(() -> empty.executeWithFailover(w -> "x")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void retryableTransportHeuristics() {
        assertThat(Web3ClientFactory.isRetryable(new IllegalStateException("HTTP 429"))).isTrue();
        assertThat(Web3ClientFactory.isRetryable(new IllegalStateException("Connection reset"))).isTrue();
        assertThat(Web3ClientFactory.isRetryable(new IllegalStateException())).isTrue();
        assertThat(Web3ClientFactory.isRetryable(new RetryableRpcException("anything"))).isTrue();
        assertThat(Web3ClientFactory.isRetryable(new IllegalStateException("invalid opcode"))).isFalse();
    }
}
