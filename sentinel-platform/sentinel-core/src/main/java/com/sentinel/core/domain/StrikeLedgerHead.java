package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per (user, scope). Strike writers lock this row before counting, so
 * two concurrent strikes for the same pair cannot both observe the same count.
 */
@Entity
@Table(name = "strike_ledger_heads", uniqueConstraints = {
    @UniqueConstraint(name = "uk_ledger_user_scope", columnNames = {"user_id", "scope_id"})
})
public class StrikeLedgerHead {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(name = "scope_id", nullable = false)
    private UUID scopeId;

    @Column(name = "strikes_issued", nullable = false)
    private long strikesIssued;

    @Column(name = "last_strike_at")
    private Instant lastStrikeAt;

    protected StrikeLedgerHead() {}

    public static StrikeLedgerHead create(UUID userId, UUID scopeId) {
        var head = new StrikeLedgerHead();
        head.userId = userId;
        head.scopeId = scopeId;
        head.strikesIssued = 0;
        return head;
    }

    public void recordStrike(Instant now) {
        this.strikesIssued++;
        this.lastStrikeAt = now;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public UUID getScopeId() { return scopeId; }
    public long getStrikesIssued() { return strikesIssued; }
    public Instant getLastStrikeAt() { return lastStrikeAt; }
}
