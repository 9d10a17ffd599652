package com.sentinel.api.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps moderation failures onto HTTP responses with a {code, message} body.
 */
@RestControllerAdvice
public class ModerationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ModerationExceptionHandler.class);

    @ExceptionHandler(ModerationException.class)
    public ResponseEntity<ErrorResponse> handleModeration(ModerationException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Moderation request failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(codeFor(e.getKind()), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MOD_001", e.getMessage()));
    }

    public static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case POLICY_BLOCKED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case TRANSIENT_IO -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    public static String codeFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "MOD_001";
            case POLICY_BLOCKED -> "MOD_002";
            case NOT_FOUND -> "MOD_003";
            case CONCURRENCY_CONFLICT -> "MOD_004";
            case TRANSIENT_IO -> "MOD_005";
        };
    }

    public record ErrorResponse(String code, String message) {}
}
