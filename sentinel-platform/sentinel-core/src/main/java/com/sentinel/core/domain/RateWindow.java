package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Fixed, non-overlapping counting window for one subject key.
 * Rows are only ever changed through single-statement conditional updates.
 * New instances always persist (never merge), so a lost first-insert race fails
 * on the primary key instead of overwriting the winner's count.
 */
@Entity
@Table(name = "rate_windows")
public class RateWindow implements Persistable<String> {

    @Id
    @Column(name = "subject_key", length = 200)
    private String subjectKey;

    @NotNull
    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "hit_count", nullable = false)
    private int hitCount;

    @Transient
    private boolean fresh = true;

    protected RateWindow() {}

    public static RateWindow open(String subjectKey, Instant now) {
        var window = new RateWindow();
        window.subjectKey = subjectKey;
        window.windowStart = now;
        window.hitCount = 1;
        return window;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public String getId() { return subjectKey; }

    @Override
    public boolean isNew() { return fresh; }

    public String getSubjectKey() { return subjectKey; }
    public Instant getWindowStart() { return windowStart; }
    public int getHitCount() { return hitCount; }
}
