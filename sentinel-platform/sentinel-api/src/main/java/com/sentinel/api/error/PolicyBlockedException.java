package com.sentinel.api.error;

public class PolicyBlockedException extends ModerationException {

    public PolicyBlockedException(String message) {
        super(ErrorKind.POLICY_BLOCKED, message);
    }
}
