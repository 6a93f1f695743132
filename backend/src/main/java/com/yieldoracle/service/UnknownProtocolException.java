package com.yieldoracle.service;

public class UnknownProtocolException extends RuntimeException {
    public UnknownProtocolException(String protocolId) {
        super("Unknown protocol: " + protocolId);
    }
}
