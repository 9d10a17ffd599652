package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per notification decision, whether or not a push went out.
 */
@Entity
@Table(name = "push_notifications_log", indexes = {
    @Index(name = "idx_push_log_user", columnList = "user_id, created_at")
})
public class PushNotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(name = "notification_type", nullable = false)
    private String notificationType;

    @Column(length = 500)
    private String title;

    @Column(length = 2000)
    private String body;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Outcome outcome;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected PushNotificationLog() {}

    public static PushNotificationLog record(
            UUID userId, String notificationType, String title, String body, Outcome outcome, Instant now) {
        var entry = new PushNotificationLog();
        entry.userId = userId;
        entry.notificationType = notificationType;
        entry.title = title;
        entry.body = body;
        entry.outcome = outcome;
        entry.createdAt = now;
        return entry;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public String getNotificationType() { return notificationType; }
    public String getTitle() { return title; }
    public String getBody() { return body; }
    public Outcome getOutcome() { return outcome; }
    public Instant getCreatedAt() { return createdAt; }

    public enum Outcome {
        DELIVERED,
        UNREACHABLE,
        FAILED,
        INBOX_ONLY_QUIET_HOURS,
        INBOX_ONLY_PREFERENCE,
        INBOX_ONLY_RATE_LIMITED,
        SUMMARY_DELIVERED
    }
}
