package com.sentinel.api.escalation;

public enum ModeratorDecision {
    APPROVE,
    REJECT,
    TIMEOUT,
    ESCALATE
}
