package com.yieldoracle.web3;

import com.yieldoracle.config.AppProps;
import com.yieldoracle.registry.ContractCall;
import com.yieldoracle.web3.exception.ChainCallException;
import com.yieldoracle.web3.exception.RetryableRpcException;
import com.yieldoracle.web3.exception.RpcTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ChainClient} over web3j {@code eth_call}.
 *
 * Every call runs inside {@link Web3ClientFactory#executeWithFailover} so rate-limit and
 * transport errors move on to the next RPC endpoint. Each request is bounded by
 * {@code app.chain.call-timeout}.
 */
@Component
@Slf4j
public class Web3jChainClient implements ChainClient {

    private final Web3ClientFactory factory;
    private final Duration callTimeout;

    @Autowired
    public Web3jChainClient(Web3ClientFactory factory, AppProps props) {
        this(factory, props.getChain().getCallTimeout());
    }

    Web3jChainClient(Web3ClientFactory factory, Duration callTimeout) {
        this.factory = factory;
        this.callTimeout = callTimeout;
    }

    @Override
    public BigInteger call(String address, ContractCall call) {
        Function fn = toFunction(call);
        String data = FunctionEncoder.encode(fn);

        return factory.executeWithFailover(web3 -> {
            EthCall res = send(web3, address, data, call.getFunction());

            if (res.hasError()) {
                String msg = res.getError().getMessage();
                if (isRateLimited(msg)) {
                    throw new RetryableRpcException("rate-limited on " + call.getFunction() + ": " + msg);
                }
                throw new ChainCallException(call.getFunction() + " failed on " + address + ": " + msg);
            }
            if (res.isReverted()) {
                throw new ChainCallException(call.getFunction() + " reverted on " + address + ": " + res.getRevertReason());
            }

            List<Type> out = FunctionReturnDecoder.decode(res.getValue(), fn.getOutputParameters());
            if (out.size() <= call.getOutputIndex()) {
                throw new ChainCallException("unexpected result for " + call.getFunction() + " on " + address
                        + ": " + out.size() + " word(s), need index " + call.getOutputIndex());
            }
            BigInteger value = (BigInteger) out.get(call.getOutputIndex()).getValue();
            log.debug("[chain] {}.{} -> {}", address, call.getFunction(), value);
            return value;
        });
    }

    private EthCall send(Web3j web3, String address, String data, String function) {
        try {
            return web3.ethCall(
                            Transaction.createEthCallTransaction(null, address, data),
                            DefaultBlockParameterName.LATEST)
                    .sendAsync()
                    .get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RpcTimeoutException(function + " timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RetryableRpcException(function + " transport error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainCallException(function + " interrupted", e);
        }
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static Function toFunction(ContractCall call) {
        List<Type> inputs = new ArrayList<>(call.getArgs().size());
        for (String a : call.getArgs()) inputs.add(new Address(a));
        List<TypeReference<?>> outputs = new ArrayList<>(call.getOutputs());
        for (int i = 0; i < call.getOutputs(); i++) outputs.add(new TypeReference<Uint256>() {});
        return new Function(call.getFunction(), inputs, outputs);
    }

    /**
     * Heuristics to detect RPC rate-limit responses (public RPCs vary in messages).
     */
    private static boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") ||
                m.contains("rate limit") ||
                m.contains("over rate") ||
                m.contains("1015") ||
                m.contains("too many requests");
    }
}
