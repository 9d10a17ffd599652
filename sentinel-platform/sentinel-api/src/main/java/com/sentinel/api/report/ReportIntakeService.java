package com.sentinel.api.report;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.api.report.MassReportLockdownService.LockdownStatus;
import com.sentinel.core.domain.ForcedReviewLock;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.UserReport;
import com.sentinel.core.repository.UserReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for user reports. The report is committed first, then each detector
 * runs in its own transaction so one detector failing leaves the others' results.
 */
@Service
public class ReportIntakeService {

    private static final Logger log = LoggerFactory.getLogger(ReportIntakeService.class);

    public static final int MAX_NOTES_LENGTH = 1000;

    private final UserReportRepository reportRepository;
    private final MassReportLockdownService lockdownService;
    private final HarassmentReportService harassmentReportService;
    private final ForcedReviewService forcedReviewService;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public ReportIntakeService(
            UserReportRepository reportRepository,
            MassReportLockdownService lockdownService,
            HarassmentReportService harassmentReportService,
            ForcedReviewService forcedReviewService,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.reportRepository = reportRepository;
        this.lockdownService = lockdownService;
        this.harassmentReportService = harassmentReportService;
        this.forcedReviewService = forcedReviewService;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    public ReportOutcome submitReport(ReportRequest request) {
        validate(request);

        UserReport report = reportRepository.save(UserReport.create(
                request.reporterId(),
                request.reportedUserId(),
                request.streamId(),
                request.category(),
                request.notes(),
                clock.instant()));
        auditService.record(EventType.REPORT_FILED, request.reporterId(), ActorType.USER,
                request.reportedUserId(), report.getId(), "UserReport",
                request.category() + " severity " + report.getSeverity());
        notificationPublisher.publish(new NotificationIntent(request.reportedUserId(), NotificationType.REPORT_RECEIVED,
                "Your activity was reported",
                "Someone reported your activity. Our team may review it against the community guidelines.",
                Map.of("reportId", report.getId().toString())));

        LockdownStatus lockdown = null;
        ScopeRestriction harassmentTimeout = null;
        if (request.streamId() != null) {
            lockdown = runDetector("mass report", report,
                    () -> lockdownService.checkMassReportLockdown(request.streamId()));
            if (request.category() == PolicyCategory.HARASSMENT) {
                harassmentTimeout = runDetector("harassment", report,
                        () -> harassmentReportService.recordReport(
                                request.reportedUserId(), request.streamId(), request.reporterId()));
            }
        }
        ForcedReviewLock reviewLock = runDetector("review lock", report,
                () -> forcedReviewService.evaluate(request.reportedUserId(), request.category()).orElse(null));

        log.info("Report {} filed by {} against {} ({}, severity {})", report.getId(), request.reporterId(),
                request.reportedUserId(), request.category(), report.getSeverity());
        return new ReportOutcome(report, lockdown, harassmentTimeout, reviewLock);
    }

    public List<UserReport> getReportsAgainst(UUID userId) {
        return reportRepository.findByReportedUserIdOrderByCreatedAtDesc(userId);
    }

    private <T> T runDetector(String name, UserReport report, Supplier<T> detector) {
        try {
            return detector.get();
        } catch (RuntimeException e) {
            log.error("{} detector failed for report {}", name, report.getId(), e);
            return null;
        }
    }

    private static void validate(ReportRequest request) {
        if (request.reporterId() == null || request.reportedUserId() == null) {
            throw new ModerationValidationException("Reporter and reported user are required");
        }
        if (request.reporterId().equals(request.reportedUserId())) {
            throw new ModerationValidationException("Users cannot report themselves");
        }
        if (request.category() == null) {
            throw new ModerationValidationException("A report category is required");
        }
        if (request.notes() != null && request.notes().length() > MAX_NOTES_LENGTH) {
            throw new ModerationValidationException("Report notes are limited to " + MAX_NOTES_LENGTH + " characters");
        }
    }

    // DTOs
    public record ReportRequest(
            UUID reporterId,
            UUID reportedUserId,
            UUID streamId,
            PolicyCategory category,
            String notes
    ) {}

    /**
     * @param lockdown          null for reports outside a stream or when the check failed
     * @param harassmentTimeout timeout applied because of this report, if any
     * @param reviewLock        review lock created because of this report, if any
     */
    public record ReportOutcome(
            UserReport report,
            LockdownStatus lockdown,
            ScopeRestriction harassmentTimeout,
            ForcedReviewLock reviewLock
    ) {}
}
