package com.yieldoracle.web3;

import com.yieldoracle.registry.ContractCall;

import java.math.BigInteger;

/**
 * Read-only access to protocol contracts.
 */
public interface ChainClient {

    /**
     * Execute a view call against {@code address} and return the selected uint256 output.
     *
     * @throws com.yieldoracle.web3.exception.ChainCallException    on revert or bad result
     * @throws com.yieldoracle.web3.exception.RetryableRpcException when every endpoint failed or timed out
     */
    BigInteger call(String address, ContractCall call);
}
