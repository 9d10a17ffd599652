package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's appeal against a penalty, strike or violation.
 * PENDING moves to APPROVED or DENIED once; both are terminal.
 */
@Entity
@Table(name = "appeals", indexes = {
    @Index(name = "idx_appeal_user", columnList = "user_id"),
    @Index(name = "idx_appeal_target_status", columnList = "target_id, status")
})
public class Appeal {

    public static final int MIN_REASON_LENGTH = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false)
    private TargetType targetType;

    @NotNull
    @Column(name = "target_id", nullable = false)
    private UUID targetId;

    /** Equals targetId while pending, null once resolved; unique so a target has one open appeal. */
    @Column(name = "pending_target_id", unique = true)
    private UUID pendingTargetId;

    @Column(name = "penalty_id")
    private UUID penaltyId;

    @Column(name = "strike_id")
    private UUID strikeId;

    @Column(name = "violation_id")
    private UUID violationId;

    @NotNull
    @Column(name = "appeal_reason", nullable = false, length = 4000)
    private String reason;

    @Column(name = "evidence_url")
    private String evidenceUrl;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AppealStatus status;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "resolution_message", length = 4000)
    private String resolutionMessage;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    private Long version;

    protected Appeal() {}

    /**
     * Creates a pending appeal. Linked penalty, strike and violation ids are optional
     * beyond the target itself.
     */
    public static Appeal create(
            UUID userId,
            TargetType targetType,
            UUID targetId,
            UUID penaltyId,
            UUID strikeId,
            UUID violationId,
            String reason,
            String evidenceUrl,
            Instant now) {

        var appeal = new Appeal();
        appeal.userId = userId;
        appeal.targetType = targetType;
        appeal.targetId = targetId;
        appeal.pendingTargetId = targetId;
        appeal.penaltyId = penaltyId;
        appeal.strikeId = strikeId;
        appeal.violationId = violationId;
        appeal.reason = reason;
        appeal.evidenceUrl = evidenceUrl;
        appeal.status = AppealStatus.PENDING;
        appeal.createdAt = now;
        return appeal;
    }

    public void resolve(AppealStatus outcome, UUID reviewerId, String message, Instant now) {
        if (status != AppealStatus.PENDING) {
            throw new IllegalStateException("Appeal " + id + " is already " + status);
        }
        if (outcome == AppealStatus.PENDING) {
            throw new IllegalArgumentException("Appeal outcome must be APPROVED or DENIED");
        }
        this.status = outcome;
        this.pendingTargetId = null;
        this.reviewedBy = reviewerId;
        this.resolutionMessage = message;
        this.resolvedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public TargetType getTargetType() { return targetType; }
    public UUID getTargetId() { return targetId; }
    public UUID getPenaltyId() { return penaltyId; }
    public UUID getStrikeId() { return strikeId; }
    public UUID getViolationId() { return violationId; }
    public String getReason() { return reason; }
    public String getEvidenceUrl() { return evidenceUrl; }
    public AppealStatus getStatus() { return status; }
    public UUID getReviewedBy() { return reviewedBy; }
    public String getResolutionMessage() { return resolutionMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getResolvedAt() { return resolvedAt; }
    public Long getVersion() { return version; }

    public enum TargetType {
        ADMIN_PENALTY,
        STRIKE,
        VIOLATION
    }

    public enum AppealStatus {
        PENDING,
        APPROVED,
        DENIED
    }
}
