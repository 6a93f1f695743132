package com.yieldoracle.api.dto;

import java.time.Instant;

/**
 * Error response: code, message, timestamp.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
