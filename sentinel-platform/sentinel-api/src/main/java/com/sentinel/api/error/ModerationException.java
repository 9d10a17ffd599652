package com.sentinel.api.error;

/**
 * Base class for moderation failures. The kind decides how callers react.
 */
public abstract class ModerationException extends RuntimeException {

    private final ErrorKind kind;

    protected ModerationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ModerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
