package com.sentinel.api.report;

import com.sentinel.api.report.MassReportLockdownService.LockdownStatus;
import com.sentinel.api.report.ReportIntakeService.ReportOutcome;
import com.sentinel.api.report.ReportIntakeService.ReportRequest;
import com.sentinel.core.domain.ForcedReviewLock;
import com.sentinel.core.domain.MassReportEvent;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.StreamChatState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for user reports, stream lockdowns and review locks.
 */
@RestController
@RequestMapping("/api/v1/moderation")
public class ReportController {

    private final ReportIntakeService reportIntakeService;
    private final MassReportLockdownService lockdownService;
    private final ForcedReviewService forcedReviewService;

    public ReportController(
            ReportIntakeService reportIntakeService,
            MassReportLockdownService lockdownService,
            ForcedReviewService forcedReviewService) {
        this.reportIntakeService = reportIntakeService;
        this.lockdownService = lockdownService;
        this.forcedReviewService = forcedReviewService;
    }

    /**
     * POST /api/v1/moderation/reports
     */
    @PostMapping("/reports")
    public ResponseEntity<ReportResponse> submitReport(
            @RequestHeader("X-Actor-ID") UUID reporterId,
            @RequestBody SubmitReportRequest request) {
        ReportOutcome outcome = reportIntakeService.submitReport(new ReportRequest(
                reporterId, request.reportedUserId(), request.streamId(), request.category(), request.notes()));
        return ResponseEntity.status(HttpStatus.CREATED).body(new ReportResponse(
                outcome.report().getId(),
                outcome.report().getSeverity(),
                outcome.lockdown() != null && outcome.lockdown().triggered(),
                outcome.harassmentTimeout() != null,
                outcome.reviewLock() != null));
    }

    /**
     * POST /api/v1/moderation/streams/{streamId}
     */
    @PostMapping("/streams/{streamId}")
    public ResponseEntity<StreamChatState> registerStream(
            @PathVariable UUID streamId,
            @RequestHeader("X-Actor-ID") UUID creatorId) {
        return ResponseEntity.ok(lockdownService.registerStream(streamId, creatorId));
    }

    /**
     * GET /api/v1/moderation/streams/{streamId}/lockdown
     */
    @GetMapping("/streams/{streamId}/lockdown")
    public ResponseEntity<LockdownStatus> checkLockdown(@PathVariable UUID streamId) {
        return ResponseEntity.ok(lockdownService.checkMassReportLockdown(streamId));
    }

    @GetMapping("/streams/{streamId}/lockdowns")
    public ResponseEntity<List<MassReportEvent>> getLockdownHistory(@PathVariable UUID streamId) {
        return ResponseEntity.ok(lockdownService.getLockdownHistory(streamId));
    }

    /**
     * POST /api/v1/moderation/lockdowns/{eventId}/acknowledge
     */
    @PostMapping("/lockdowns/{eventId}/acknowledge")
    public ResponseEntity<MassReportEvent> acknowledgeLockdown(
            @PathVariable UUID eventId,
            @RequestHeader("X-Actor-ID") UUID creatorId) {
        return ResponseEntity.ok(lockdownService.acknowledge(eventId, creatorId));
    }

    @GetMapping("/review-locks")
    public ResponseEntity<List<ForcedReviewLock>> getReviewLocks() {
        return ResponseEntity.ok(forcedReviewService.getActiveLocks());
    }

    @DeleteMapping("/review-locks/{userId}")
    public ResponseEntity<ForcedReviewLock> unlock(
            @PathVariable UUID userId,
            @RequestHeader("X-Actor-ID") UUID adminId) {
        return ResponseEntity.ok(forcedReviewService.unlock(userId, adminId));
    }

    // Request/Response DTOs
    public record SubmitReportRequest(UUID reportedUserId, UUID streamId, PolicyCategory category, String notes) {}

    public record ReportResponse(
            UUID reportId,
            int severity,
            boolean lockdownActive,
            boolean harassmentTimeoutApplied,
            boolean reviewLockApplied
    ) {}
}
