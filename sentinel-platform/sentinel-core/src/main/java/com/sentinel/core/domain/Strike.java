package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Scoped strike against a user. Strikes in one scope never affect another scope.
 *
 * Levels 1-2 decay after 30 days, level 3 is a 24-hour scope ban and level 4
 * is permanent (no expiry).
 */
@Entity
@Table(name = "ai_strikes", indexes = {
    @Index(name = "idx_strike_user_scope", columnList = "user_id, scope_id"),
    @Index(name = "idx_strike_expires", columnList = "expires_at")
})
public class Strike {

    public static final int MAX_LEVEL = 4;
    public static final Duration DECAY = Duration.ofDays(30);
    public static final Duration SCOPE_BAN = Duration.ofHours(24);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(name = "scope_id", nullable = false)
    private UUID scopeId;

    @Column(name = "strike_level", nullable = false)
    private int level;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "strike_type", nullable = false)
    private PolicyCategory type;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Column(name = "issued_by_ai", nullable = false)
    private boolean issuedByAi;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "violation_id")
    private UUID violationId;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_reason")
    private String revokedReason;

    @Column(name = "ban_end_notified_at")
    private Instant banEndNotifiedAt;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Strike() {}

    public static Strike create(
            UUID userId,
            UUID scopeId,
            int level,
            PolicyCategory type,
            String reason,
            boolean issuedByAi,
            UUID violationId,
            Instant now) {

        if (level < 1 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Strike level must be between 1 and 4: " + level);
        }
        var strike = new Strike();
        strike.userId = userId;
        strike.scopeId = scopeId;
        strike.level = level;
        strike.type = type;
        strike.reason = reason;
        strike.issuedByAi = issuedByAi;
        strike.violationId = violationId;
        strike.expiresAt = expiryFor(level, now);
        strike.active = true;
        strike.createdAt = now;
        return strike;
    }

    /**
     * Expiry for a strike of the given level issued at {@code now}; null for level 4.
     */
    public static Instant expiryFor(int level, Instant now) {
        return switch (level) {
            case 1, 2 -> now.plus(DECAY);
            case 3 -> now.plus(SCOPE_BAN);
            default -> null;
        };
    }

    public boolean isPermanent() {
        return level == MAX_LEVEL;
    }

    public boolean isInForce(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    /**
     * Whether this strike bans the user from its scope at {@code now}.
     */
    public boolean isBanning(Instant now) {
        if (!active) {
            return false;
        }
        return level == MAX_LEVEL || (level == 3 && expiresAt != null && expiresAt.isAfter(now));
    }

    public void revoke(String reason, Instant now) {
        if (!active) {
            throw new IllegalStateException("Strike already revoked: " + id);
        }
        this.active = false;
        this.revokedAt = now;
        this.revokedReason = reason;
    }

    public void markBanEndNotified(Instant now) {
        this.banEndNotifiedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public UUID getScopeId() { return scopeId; }
    public int getLevel() { return level; }
    public PolicyCategory getType() { return type; }
    public String getReason() { return reason; }
    public boolean isIssuedByAi() { return issuedByAi; }
    public Instant getExpiresAt() { return expiresAt; }
    public UUID getViolationId() { return violationId; }
    public boolean isActive() { return active; }
    public Instant getRevokedAt() { return revokedAt; }
    public String getRevokedReason() { return revokedReason; }
    public Instant getBanEndNotifiedAt() { return banEndNotifiedAt; }
    public Instant getCreatedAt() { return createdAt; }
}
