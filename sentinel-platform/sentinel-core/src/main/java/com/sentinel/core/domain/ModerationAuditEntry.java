package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only history of enforcement, moderator, admin and appeal actions.
 */
@Entity
@Table(name = "moderation_audit_log", indexes = {
    @Index(name = "idx_mod_audit_subject", columnList = "subject_user_id"),
    @Index(name = "idx_mod_audit_resource", columnList = "resource_id"),
    @Index(name = "idx_mod_audit_timestamp", columnList = "timestamp"),
    @Index(name = "idx_mod_audit_event_type", columnList = "event_type")
})
public class ModerationAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @NotNull
    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "actor_id")
    private UUID actorId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false)
    private ActorType actorType;

    @Column(name = "subject_user_id")
    private UUID subjectUserId;

    @NotNull
    @Column(name = "resource_id", nullable = false)
    private UUID resourceId;

    @NotNull
    @Column(name = "resource_type", nullable = false)
    private String resourceType;

    @Column(length = 2000)
    private String details;

    protected ModerationAuditEntry() {}

    public static ModerationAuditEntry create(
            EventType eventType,
            UUID actorId,
            ActorType actorType,
            UUID subjectUserId,
            UUID resourceId,
            String resourceType,
            String details,
            Instant timestamp) {

        var entry = new ModerationAuditEntry();
        entry.eventType = eventType;
        entry.timestamp = timestamp;
        entry.actorId = actorId;
        entry.actorType = actorType;
        entry.subjectUserId = subjectUserId;
        entry.resourceId = resourceId;
        entry.resourceType = resourceType;
        entry.details = details != null && details.length() > 2000 ? details.substring(0, 2000) : details;
        return entry;
    }

    // Getters
    public UUID getId() { return id; }
    public EventType getEventType() { return eventType; }
    public Instant getTimestamp() { return timestamp; }
    public UUID getActorId() { return actorId; }
    public ActorType getActorType() { return actorType; }
    public UUID getSubjectUserId() { return subjectUserId; }
    public UUID getResourceId() { return resourceId; }
    public String getResourceType() { return resourceType; }
    public String getDetails() { return details; }

    public enum EventType {
        VIOLATION_RECORDED,
        VIOLATION_DELETED,
        STRIKE_ISSUED,
        STRIKE_REVOKED,
        RESTRICTION_APPLIED,
        RESTRICTION_LIFTED,
        REVIEW_ENQUEUED,
        REVIEW_APPROVED,
        REVIEW_REJECTED,
        REVIEW_ESCALATED,
        PENALTY_APPLIED,
        PENALTY_EXPIRED,
        PENALTY_DEACTIVATED,
        APPEAL_SUBMITTED,
        APPEAL_APPROVED,
        APPEAL_DENIED,
        REPORT_FILED,
        LOCKDOWN_TRIGGERED,
        LOCKDOWN_ACKNOWLEDGED,
        REVIEW_LOCK_APPLIED,
        REVIEW_LOCK_RELEASED
    }

    public enum ActorType {
        SYSTEM,
        USER,
        MODERATOR,
        ADMIN
    }
}
