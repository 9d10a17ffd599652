package com.sentinel.api.error;

public class TransientIoException extends ModerationException {

    public TransientIoException(String message) {
        super(ErrorKind.TRANSIENT_IO, message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_IO, message, cause);
    }
}
