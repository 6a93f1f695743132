package com.yieldoracle.support;

import com.yieldoracle.registry.ContractCall;
import com.yieldoracle.web3.ChainClient;
import com.yieldoracle.web3.exception.RetryableRpcException;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers view calls from a table keyed by (address, function). Addresses can be marked unreachable.
 */
public class FakeChainClient implements ChainClient {

    private final Map<String, BigInteger> values = new ConcurrentHashMap<>();
    private final Set<String> down = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    public FakeChainClient answer(String address, String function, BigInteger value) {
        values.put(address + "#" + function, value);
        return this;
    }

    public FakeChainClient answer(String address, String function, long value) {
        return answer(address, function, BigInteger.valueOf(value));
    }

    public void setDown(String address, boolean isDown) {
        if (isDown) down.add(address); else down.remove(address);
    }

    public int callCount(String address) {
        AtomicInteger c = calls.get(address);
        return c == null ? 0 : c.get();
    }

    @Override
    public BigInteger call(String address, ContractCall call) {
        calls.computeIfAbsent(address, a -> new AtomicInteger()).incrementAndGet();
        if (down.contains(address)) {
            throw new RetryableRpcException("connection refused: " + address);
        }
        BigInteger v = values.get(address + "#" + call.getFunction());
        if (v == null) throw new IllegalStateException("no fixture for " + address + "#" + call.getFunction());
        return v;
    }
}
