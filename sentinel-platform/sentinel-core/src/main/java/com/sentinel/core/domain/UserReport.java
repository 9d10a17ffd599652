package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * A report filed by one user against another, optionally from inside a stream.
 */
@Entity
@Table(name = "user_reports", indexes = {
    @Index(name = "idx_report_reported", columnList = "reported_user_id, created_at"),
    @Index(name = "idx_report_stream", columnList = "stream_id, created_at")
})
public class UserReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "reporter_id", nullable = false)
    private UUID reporterId;

    @NotNull
    @Column(name = "reported_user_id", nullable = false)
    private UUID reportedUserId;

    @Column(name = "stream_id")
    private UUID streamId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PolicyCategory category;

    @Column(length = 2000)
    private String notes;

    @Column(nullable = false)
    private int severity;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected UserReport() {}

    public static UserReport create(
            UUID reporterId,
            UUID reportedUserId,
            UUID streamId,
            PolicyCategory category,
            String notes,
            Instant now) {

        var report = new UserReport();
        report.reporterId = reporterId;
        report.reportedUserId = reportedUserId;
        report.streamId = streamId;
        report.category = category;
        report.notes = notes;
        report.severity = category.reportSeverity();
        report.createdAt = now;
        return report;
    }

    public UUID getId() { return id; }
    public UUID getReporterId() { return reporterId; }
    public UUID getReportedUserId() { return reportedUserId; }
    public UUID getStreamId() { return streamId; }
    public PolicyCategory getCategory() { return category; }
    public String getNotes() { return notes; }
    public int getSeverity() { return severity; }
    public Instant getCreatedAt() { return createdAt; }
}
