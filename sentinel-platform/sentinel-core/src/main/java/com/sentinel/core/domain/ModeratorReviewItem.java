package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry in the human review queue.
 * PENDING moves to APPROVED, REJECTED or ESCALATED exactly once.
 */
@Entity
@Table(name = "moderator_review_queue",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_review_violation", columnNames = "violation_id")
    },
    indexes = {
        @Index(name = "idx_review_status", columnList = "status"),
        @Index(name = "idx_review_user", columnList = "user_id")
    })
public class ModeratorReviewItem {

    public static final int MAX_PREVIEW_LENGTH = 280;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "violation_id")
    private UUID violationId;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "scope_id")
    private UUID scopeId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private SourceType sourceType;

    @Column(name = "reported_by_ai", nullable = false)
    private boolean reportedByAi;

    @Column(name = "content_preview", length = MAX_PREVIEW_LENGTH)
    private String contentPreview;

    @Column(name = "risk_score", nullable = false)
    private double riskScore;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PolicyCategory category;

    @Column(name = "assigned_moderator_id")
    private UUID assignedModeratorId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewStatus status;

    @Column(name = "moderator_notes", length = 2000)
    private String moderatorNotes;

    @Column(name = "escalation_reason", length = 2000)
    private String escalationReason;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected ModeratorReviewItem() {}

    public static ModeratorReviewItem create(
            UUID violationId,
            UUID userId,
            UUID scopeId,
            SourceType sourceType,
            boolean reportedByAi,
            String preview,
            double riskScore,
            PolicyCategory category,
            Instant now) {

        var item = new ModeratorReviewItem();
        item.violationId = violationId;
        item.userId = userId;
        item.scopeId = scopeId;
        item.sourceType = sourceType;
        item.reportedByAi = reportedByAi;
        item.contentPreview = preview == null || preview.length() <= MAX_PREVIEW_LENGTH
                ? preview : preview.substring(0, MAX_PREVIEW_LENGTH);
        item.riskScore = riskScore;
        item.category = category;
        item.status = ReviewStatus.PENDING;
        item.createdAt = now;
        return item;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    public void assignTo(UUID moderatorId) {
        requirePending();
        this.assignedModeratorId = moderatorId;
    }

    /**
     * Moves a pending item to a moderator outcome.
     *
     * @throws IllegalStateException if the item is no longer pending
     */
    public void resolve(ReviewStatus outcome, UUID moderatorId, String notes, Instant now) {
        requirePending();
        if (outcome == ReviewStatus.PENDING || outcome == ReviewStatus.ESCALATED) {
            throw new IllegalArgumentException("Not a moderator outcome: " + outcome);
        }
        this.status = outcome;
        this.resolvedBy = moderatorId;
        this.moderatorNotes = notes;
        this.resolvedAt = now;
    }

    public void escalate(UUID moderatorId, String reason, Instant now) {
        requirePending();
        this.status = ReviewStatus.ESCALATED;
        this.resolvedBy = moderatorId;
        this.escalationReason = reason;
        this.resolvedAt = now;
    }

    private void requirePending() {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item " + id + " is already " + status);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getViolationId() { return violationId; }
    public UUID getUserId() { return userId; }
    public UUID getScopeId() { return scopeId; }
    public SourceType getSourceType() { return sourceType; }
    public boolean isReportedByAi() { return reportedByAi; }
    public String getContentPreview() { return contentPreview; }
    public double getRiskScore() { return riskScore; }
    public PolicyCategory getCategory() { return category; }
    public UUID getAssignedModeratorId() { return assignedModeratorId; }
    public ReviewStatus getStatus() { return status; }
    public String getModeratorNotes() { return moderatorNotes; }
    public String getEscalationReason() { return escalationReason; }
    public UUID getResolvedBy() { return resolvedBy; }
    public Instant getResolvedAt() { return resolvedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Long getVersion() { return version; }

    public enum ReviewStatus {
        PENDING,
        APPROVED,
        REJECTED,
        ESCALATED
    }

    public enum SourceType {
        CHAT_MESSAGE,
        POST,
        STORY,
        DIRECT_MESSAGE,
        PROFILE,
        USER_REPORT,
        BEHAVIOR_PATTERN
    }
}
