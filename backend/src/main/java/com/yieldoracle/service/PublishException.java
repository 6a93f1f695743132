package com.yieldoracle.service;

/**
 * The durable store rejected a cycle's rows. Fatal for that cycle only.
 */
public class PublishException extends RuntimeException {
    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
