package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Penalty applied by an admin, either directly or from an escalated review item.
 * Deactivated by the expiry sweep or an approved appeal.
 */
@Entity
@Table(name = "admin_penalties", indexes = {
    @Index(name = "idx_penalty_user", columnList = "user_id"),
    @Index(name = "idx_penalty_active_expires", columnList = "active, expires_at")
})
public class AdminPenalty {

    public static final Set<Integer> ALLOWED_TEMPORARY_HOURS = Set.of(24, 168, 720);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(name = "admin_id", nullable = false)
    private UUID adminId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PolicyCategory category;

    @NotNull
    @Column(nullable = false, length = 2000)
    private String reason;

    @Column(name = "duration_hours")
    private Integer durationHours;

    @Column(name = "evidence_link")
    private String evidenceLink;

    @Column(name = "policy_reference")
    private String policyReference;

    @Column(name = "review_item_id")
    private UUID reviewItemId;

    @Column(name = "violation_id")
    private UUID violationId;

    @Column(name = "strike_id")
    private UUID strikeId;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "deactivation_reason")
    private String deactivationReason;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected AdminPenalty() {}

    public static AdminPenalty create(
            UUID userId,
            UUID adminId,
            Severity severity,
            PolicyCategory category,
            String reason,
            Integer durationHours,
            String evidenceLink,
            String policyReference,
            UUID reviewItemId,
            UUID violationId,
            UUID strikeId,
            Instant now) {

        if (severity == Severity.TEMPORARY
                && (durationHours == null || !ALLOWED_TEMPORARY_HOURS.contains(durationHours))) {
            throw new IllegalArgumentException("Temporary penalties must last 24, 168 or 720 hours");
        }
        var penalty = new AdminPenalty();
        penalty.userId = userId;
        penalty.adminId = adminId;
        penalty.severity = severity;
        penalty.category = category;
        penalty.reason = reason;
        penalty.durationHours = severity == Severity.TEMPORARY ? durationHours : null;
        penalty.evidenceLink = evidenceLink;
        penalty.policyReference = policyReference;
        penalty.reviewItemId = reviewItemId;
        penalty.violationId = violationId;
        penalty.strikeId = strikeId;
        penalty.active = true;
        penalty.expiresAt = severity == Severity.TEMPORARY
                ? now.plus(Duration.ofHours(durationHours)) : null;
        penalty.createdAt = now;
        return penalty;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public void deactivate(String reason, Instant now) {
        if (active) {
            this.active = false;
            this.deactivatedAt = now;
            this.deactivationReason = reason;
        }
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public UUID getAdminId() { return adminId; }
    public Severity getSeverity() { return severity; }
    public PolicyCategory getCategory() { return category; }
    public String getReason() { return reason; }
    public Integer getDurationHours() { return durationHours; }
    public String getEvidenceLink() { return evidenceLink; }
    public String getPolicyReference() { return policyReference; }
    public UUID getReviewItemId() { return reviewItemId; }
    public UUID getViolationId() { return violationId; }
    public UUID getStrikeId() { return strikeId; }
    public boolean isActive() { return active; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getDeactivatedAt() { return deactivatedAt; }
    public String getDeactivationReason() { return deactivationReason; }
    public Instant getCreatedAt() { return createdAt; }

    public enum Severity {
        TEMPORARY,
        PERMANENT
    }
}
