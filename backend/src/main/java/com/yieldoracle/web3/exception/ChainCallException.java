package com.yieldoracle.web3.exception;

/** A read call that no other endpoint would answer differently: revert, empty or undecodable result. */
public class ChainCallException extends RuntimeException {
    public ChainCallException(String message) { super(message); }
    public ChainCallException(String message, Throwable cause) { super(message, cause); }
}
