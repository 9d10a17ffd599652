package com.sentinel.api.error;

public class ModerationValidationException extends ModerationException {

    public ModerationValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
