package com.sentinel.api.error;

/**
 * Raised when the violation and its enforcement records could not be persisted,
 * even after the synchronous retry. Never swallowed: a dropped violation is a safety gap.
 */
public class EnforcementWriteException extends ModerationException {

    public EnforcementWriteException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_IO, message, cause);
    }
}
