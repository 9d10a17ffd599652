package com.sentinel.api.notification;

/**
 * Notification types. Moderation types count against the per-user push rate limit and
 * honour the moderation alert opt-out; critical types are pushed even during quiet hours.
 */
public enum NotificationType {
    MODERATION_WARNING(true, false),
    TIMEOUT_APPLIED(true, true),
    BAN_APPLIED(true, true),
    BAN_EXPIRED(true, false),
    SAFETY_REMINDER(true, false),
    APPEAL_RECEIVED(false, false),
    APPEAL_APPROVED(false, true),
    APPEAL_DENIED(false, true),
    CONTENT_RESTORED(false, false),
    REPORT_RECEIVED(false, false),
    STREAM_LOCKDOWN(false, false),
    REVIEW_LOCK(false, false),
    SYSTEM_WARNING(false, false);

    private final boolean moderation;
    private final boolean critical;

    NotificationType(boolean moderation, boolean critical) {
        this.moderation = moderation;
        this.critical = critical;
    }

    public boolean isModeration() {
        return moderation;
    }

    public boolean isCritical() {
        return critical;
    }
}
