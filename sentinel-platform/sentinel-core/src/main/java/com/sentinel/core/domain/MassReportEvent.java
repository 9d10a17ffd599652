package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Chat lockdown raised when a stream receives a burst of unique reporters.
 * Stays unresolved until the stream creator acknowledges it.
 */
@Entity
@Table(name = "mass_report_events", indexes = {
    @Index(name = "idx_mass_report_stream", columnList = "stream_id")
})
public class MassReportEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "stream_id", nullable = false)
    private UUID streamId;

    @Column(name = "report_count", nullable = false)
    private int reportCount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mass_report_event_reporters", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "reporter_id", nullable = false)
    private Set<UUID> uniqueReporterIds = new HashSet<>();

    @NotNull
    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "creator_acknowledged", nullable = false)
    private boolean creatorAcknowledged;

    @Column(name = "acknowledged_by")
    private UUID acknowledgedBy;

    protected MassReportEvent() {}

    public static MassReportEvent create(UUID streamId, Set<UUID> reporterIds, int reportCount, Instant now) {
        var event = new MassReportEvent();
        event.streamId = streamId;
        event.uniqueReporterIds = new HashSet<>(reporterIds);
        event.reportCount = reportCount;
        event.triggeredAt = now;
        event.creatorAcknowledged = false;
        return event;
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public void acknowledge(UUID creatorId, Instant now) {
        if (isResolved()) {
            throw new IllegalStateException("Mass report event already resolved: " + id);
        }
        this.creatorAcknowledged = true;
        this.acknowledgedBy = creatorId;
        this.resolvedAt = now;
    }

    public UUID getId() { return id; }
    public UUID getStreamId() { return streamId; }
    public int getReportCount() { return reportCount; }
    public Set<UUID> getUniqueReporterIds() { return Set.copyOf(uniqueReporterIds); }
    public Instant getTriggeredAt() { return triggeredAt; }
    public Instant getResolvedAt() { return resolvedAt; }
    public boolean isCreatorAcknowledged() { return creatorAcknowledged; }
    public UUID getAcknowledgedBy() { return acknowledgedBy; }
}
