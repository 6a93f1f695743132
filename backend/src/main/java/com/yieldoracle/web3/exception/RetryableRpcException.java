package com.yieldoracle.web3.exception;

/** The call may succeed on another RPC endpoint (rate limit, transport error, timeout). */
public class RetryableRpcException extends RuntimeException {
    public RetryableRpcException(String message) { super(message); }
    public RetryableRpcException(String message, Throwable cause) { super(message, cause); }
}
