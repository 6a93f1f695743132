package com.yieldoracle.web3;

import com.yieldoracle.config.AppProps;
import com.yieldoracle.web3.exception.ChainCallException;
import com.yieldoracle.web3.exception.RetryableRpcException;
import com.yieldoracle.web3.exception.RpcTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * One Web3j client per configured RPC URL, tried in ring order starting from the
 * endpoint that last answered. An endpoint that fails with a rate-limit or transport
 * error sits out for {@code app.chain.failover-penalty}; a call timeout does not bench it.
 */
@Component
@Slf4j
public class Web3ClientFactory {

    private static final List<String> TRANSPORT_HINTS = List.of(
            "429", "rate limit", "over rate",
            "1015",                 // Cloudflare code used by some public RPCs
            "timeout", "timed out",
            "connection", "refused", "unexpected end of stream");

    private static final class Endpoint {
        private final String url;
        private final Web3j client;
        private volatile Instant benchedUntil = Instant.EPOCH;

        private Endpoint(String url, Web3j client) {
            this.url = url;
            this.client = client;
        }
    }

    private final List<Endpoint> endpoints;
    private final AtomicInteger preferred = new AtomicInteger();
    private final AppProps.Chain chain;
    private final Clock clock;

    @Autowired
    public Web3ClientFactory(AppProps props, Clock clock) {
        this(props.getChain(), url -> Web3j.build(new HttpService(url)), clock);
    }

    Web3ClientFactory(AppProps.Chain chain, Function<String, Web3j> clientBuilder, Clock clock) {
        List<String> urls = chain.getRpcUrls() == null ? List.of() : chain.getRpcUrls();
        this.endpoints = urls.stream().map(u -> new Endpoint(u, clientBuilder.apply(u))).toList();
        this.chain = chain;
        this.clock = clock;
        log.info("[rpc] {} endpoint(s) configured: {}", endpoints.size(), urls);
    }

    /**
     * Run {@code fn} against the endpoints that are not benched, in ring order, moving on
     * to the next one on retryable errors. When every endpoint is benched, the one whose
     * penalty ends first is tried anyway.
     *
     * @throws ChainCallException   as thrown by {@code fn}; never retried
     * @throws RetryableRpcException when every tried endpoint failed
     */
    public <T> T executeWithFailover(Function<Web3j, T> fn) {
        if (endpoints.isEmpty()) throw new IllegalStateException("No RPC URLs configured (app.chain.rpc-urls)");

        RuntimeException lastRetryable = null;
        int attempts = 0;

        for (int idx : candidates()) {
            Endpoint ep = endpoints.get(idx);
            if (attempts++ > 0) pause(attempts - 1);

            try {
                T result = fn.apply(ep.client);
                preferred.set(idx);
                return result;
            } catch (ChainCallException e) {
                throw e;
            } catch (RpcTimeoutException e) {
                // slow call, not a sick endpoint
                log.warn("[rpc] {} timed out, trying next endpoint: {}", ep.url, e.getMessage());
                lastRetryable = e;
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    log.error("[rpc] non-retryable error on {}: {}", ep.url, e.toString());
                    throw e;
                }
                log.warn("[rpc] {} failed, benching for {}: {}", ep.url, chain.getFailoverPenalty(), e.getMessage());
                ep.benchedUntil = clock.instant().plus(chain.getFailoverPenalty());
                lastRetryable = e;
            }
        }

        if (lastRetryable instanceof RetryableRpcException r) throw r;
        throw new RetryableRpcException("All RPC endpoints failed: " + lastRetryable.getMessage(), lastRetryable);
    }

    /** Available endpoints from the preferred one on; else the one released soonest. */
    private List<Integer> candidates() {
        final int size = endpoints.size();
        final int first = preferred.get();
        final Instant now = clock.instant();
        List<Integer> out = new ArrayList<>(size);
        int soonest = first;
        for (int i = 0; i < size; i++) {
            int idx = (first + i) % size;
            Endpoint ep = endpoints.get(idx);
            if (!now.isBefore(ep.benchedUntil)) {
                out.add(idx);
            } else if (ep.benchedUntil.isBefore(endpoints.get(soonest).benchedUntil)) {
                soonest = idx;
            }
        }
        if (out.isEmpty()) {
            log.debug("[rpc] all endpoints benched, trying {}", endpoints.get(soonest).url);
            out.add(soonest);
        }
        return out;
    }

    /** base * 2^(n-1), capped. */
    private void pause(int retry) {
        long millis = Math.min(
                chain.getBaseBackoff().toMillis() << Math.min(retry - 1, 4),
                chain.getMaxBackoff().toMillis());
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainCallException("interrupted during RPC failover", e);
        }
    }

    static boolean isRetryable(RuntimeException e) {
        if (e instanceof RetryableRpcException) return true;
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return msg.isEmpty() || TRANSPORT_HINTS.stream().anyMatch(msg::contains);
    }
}
