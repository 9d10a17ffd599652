package com.sentinel.api.error;

public class ConcurrencyConflictException extends ModerationException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
