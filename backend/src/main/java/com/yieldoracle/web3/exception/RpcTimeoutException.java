package com.yieldoracle.web3.exception;

/** A single call outlived the call timeout. Says nothing about the endpoint's health. */
public class RpcTimeoutException extends RetryableRpcException {
    public RpcTimeoutException(String message, Throwable cause) { super(message, cause); }
}
