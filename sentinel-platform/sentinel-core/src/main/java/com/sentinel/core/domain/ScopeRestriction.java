package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Timeout or block of a user within one scope.
 * A null {@code endsAt} means the restriction holds until lifted.
 */
@Entity
@Table(name = "scope_restrictions", indexes = {
    @Index(name = "idx_restriction_user_scope", columnList = "user_id, scope_id"),
    @Index(name = "idx_restriction_ends", columnList = "ends_at"),
    @Index(name = "idx_restriction_violation", columnList = "violation_id")
})
public class ScopeRestriction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(name = "scope_id", nullable = false)
    private UUID scopeId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RestrictionKind kind;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RestrictionSource source;

    @Column(length = 1000)
    private String reason;

    @NotNull
    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "violation_id")
    private UUID violationId;

    @Column(name = "strike_id")
    private UUID strikeId;

    @Column(name = "lifted_at")
    private Instant liftedAt;

    @Column(name = "lifted_reason")
    private String liftedReason;

    protected ScopeRestriction() {}

    public static ScopeRestriction create(
            UUID userId,
            UUID scopeId,
            RestrictionKind kind,
            RestrictionSource source,
            String reason,
            Instant startsAt,
            Instant endsAt,
            UUID violationId,
            UUID strikeId) {

        if (endsAt != null && !endsAt.isAfter(startsAt)) {
            throw new IllegalArgumentException("Restriction must end after it starts");
        }
        var restriction = new ScopeRestriction();
        restriction.userId = userId;
        restriction.scopeId = scopeId;
        restriction.kind = kind;
        restriction.source = source;
        restriction.reason = reason;
        restriction.startsAt = startsAt;
        restriction.endsAt = endsAt;
        restriction.active = true;
        restriction.violationId = violationId;
        restriction.strikeId = strikeId;
        return restriction;
    }

    public boolean isInForce(Instant now) {
        return active && !startsAt.isAfter(now) && (endsAt == null || endsAt.isAfter(now));
    }

    public void lift(String reason, Instant now) {
        if (active) {
            this.active = false;
            this.liftedAt = now;
            this.liftedReason = reason;
        }
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public UUID getScopeId() { return scopeId; }
    public RestrictionKind getKind() { return kind; }
    public RestrictionSource getSource() { return source; }
    public String getReason() { return reason; }
    public Instant getStartsAt() { return startsAt; }
    public Instant getEndsAt() { return endsAt; }
    public boolean isActive() { return active; }
    public UUID getViolationId() { return violationId; }
    public UUID getStrikeId() { return strikeId; }
    public Instant getLiftedAt() { return liftedAt; }
    public String getLiftedReason() { return liftedReason; }

    public enum RestrictionKind {
        TIMEOUT,
        BLOCK
    }

    public enum RestrictionSource {
        AI_POLICY,
        SPAM_DETECTOR,
        STRIKE_LEDGER,
        MODERATOR,
        HARASSMENT_REPORTS
    }
}
