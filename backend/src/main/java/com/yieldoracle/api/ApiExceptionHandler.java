package com.yieldoracle.api;

import com.yieldoracle.api.dto.ErrorBody;
import com.yieldoracle.service.PublishException;
import com.yieldoracle.service.UnknownProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownProtocolException.class)
    public ResponseEntity<ErrorBody> unknownProtocol(UnknownProtocolException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("UNKNOWN_PROTOCOL", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorBody> badRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<ErrorBody> publishFailed(PublishException ex) {
        log.error("[api] manual cycle failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", ex.getMessage()));
    }
}
