package com.sentinel.core.domain;

/**
 * Graduated enforcement actions, ordered by severity.
 */
public enum ModerationAction {
    ALLOW(0),
    FLAG(1),
    HIDE(2),
    ESCALATE(3),
    TIMEOUT(4),
    BLOCK(5);

    private final int severity;

    ModerationAction(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean hidesContent() {
        return severity >= HIDE.severity;
    }

    public boolean notifiesUser() {
        return this != ALLOW && this != FLAG;
    }

    public boolean isAtLeast(ModerationAction other) {
        return severity >= other.severity;
    }
}
