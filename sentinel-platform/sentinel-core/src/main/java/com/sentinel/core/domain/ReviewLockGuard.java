package com.sentinel.core.domain;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-user row that forced review evaluation locks, so a user collects at most
 * one active review lock however many reports arrive at once.
 */
@Entity
@Table(name = "review_lock_guards")
public class ReviewLockGuard implements Persistable<UUID> {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "last_locked_at")
    private Instant lastLockedAt;

    @Transient
    private boolean fresh = true;

    protected ReviewLockGuard() {}

    public static ReviewLockGuard create(UUID userId) {
        var guard = new ReviewLockGuard();
        guard.userId = userId;
        return guard;
    }

    public void recordLock(Instant now) {
        this.lastLockedAt = now;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public UUID getId() { return userId; }

    @Override
    public boolean isNew() { return fresh; }

    public UUID getUserId() { return userId; }
    public Instant getLastLockedAt() { return lastLockedAt; }
}
