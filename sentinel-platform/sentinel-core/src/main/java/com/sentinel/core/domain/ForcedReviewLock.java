package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Account-wide review lock applied after a burst of reports against a user.
 */
@Entity
@Table(name = "forced_review_locks", indexes = {
    @Index(name = "idx_review_lock_user", columnList = "user_id, active")
})
public class ForcedReviewLock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    private boolean active;

    @Column(length = 1000)
    private String reason;

    @Column(name = "report_count", nullable = false)
    private int reportCount;

    @NotNull
    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    @Column(name = "unlocked_at")
    private Instant unlockedAt;

    @Column(name = "unlocked_by")
    private UUID unlockedBy;

    protected ForcedReviewLock() {}

    public static ForcedReviewLock create(UUID userId, String reason, int reportCount, Instant now) {
        var lock = new ForcedReviewLock();
        lock.userId = userId;
        lock.active = true;
        lock.reason = reason;
        lock.reportCount = reportCount;
        lock.lockedAt = now;
        return lock;
    }

    public void unlock(UUID adminId, Instant now) {
        if (!active) {
            throw new IllegalStateException("Review lock already released: " + id);
        }
        this.active = false;
        this.unlockedBy = adminId;
        this.unlockedAt = now;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public boolean isActive() { return active; }
    public String getReason() { return reason; }
    public int getReportCount() { return reportCount; }
    public Instant getLockedAt() { return lockedAt; }
    public Instant getUnlockedAt() { return unlockedAt; }
    public UUID getUnlockedBy() { return unlockedBy; }
}
