package com.sentinel.api.error;

public class ResourceNotFoundException extends ModerationException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
