package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Cumulative set of unique reporters for a (reported user, stream) pair.
 * {@code autoTimeoutApplied} makes the automatic timeout fire at most once.
 */
@Entity
@Table(name = "harassment_report_trackers", uniqueConstraints = {
    @UniqueConstraint(name = "uk_harassment_user_stream", columnNames = {"reported_user_id", "stream_id"})
})
public class HarassmentReportTracker {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "reported_user_id", nullable = false)
    private UUID reportedUserId;

    @NotNull
    @Column(name = "stream_id", nullable = false)
    private UUID streamId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "harassment_tracker_reporters", joinColumns = @JoinColumn(name = "tracker_id"))
    @Column(name = "reporter_id", nullable = false)
    private Set<UUID> reporterIds = new HashSet<>();

    @Column(name = "auto_timeout_applied", nullable = false)
    private boolean autoTimeoutApplied;

    @Column(name = "auto_timeout_at")
    private Instant autoTimeoutAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected HarassmentReportTracker() {}

    public static HarassmentReportTracker create(UUID reportedUserId, UUID streamId) {
        var tracker = new HarassmentReportTracker();
        tracker.reportedUserId = reportedUserId;
        tracker.streamId = streamId;
        tracker.autoTimeoutApplied = false;
        return tracker;
    }

    /**
     * Adds a reporter and returns the number of unique reporters so far.
     */
    public int addReporter(UUID reporterId, Instant now) {
        reporterIds.add(reporterId);
        this.updatedAt = now;
        return reporterIds.size();
    }

    public void markAutoTimeoutApplied(Instant now) {
        this.autoTimeoutApplied = true;
        this.autoTimeoutAt = now;
    }

    public UUID getId() { return id; }
    public UUID getReportedUserId() { return reportedUserId; }
    public UUID getStreamId() { return streamId; }
    public Set<UUID> getReporterIds() { return Set.copyOf(reporterIds); }
    public int getUniqueReporterCount() { return reporterIds.size(); }
    public boolean isAutoTimeoutApplied() { return autoTimeoutApplied; }
    public Instant getAutoTimeoutAt() { return autoTimeoutAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
