package com.sentinel.api.escalation;

import com.sentinel.api.escalation.AdminPenaltyService.PenaltyRequest;
import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.AdminPenalty.Severity;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import com.sentinel.core.domain.PolicyCategory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for moderators and admins working the review queue.
 */
@RestController
@RequestMapping("/api/v1/moderation")
public class ReviewQueueController {

    private final EscalationQueueService escalationQueueService;
    private final AdminPenaltyService adminPenaltyService;

    public ReviewQueueController(
            EscalationQueueService escalationQueueService,
            AdminPenaltyService adminPenaltyService) {
        this.escalationQueueService = escalationQueueService;
        this.adminPenaltyService = adminPenaltyService;
    }

    /**
     * GET /api/v1/moderation/queue?status=PENDING
     */
    @GetMapping("/queue")
    public ResponseEntity<List<ModeratorReviewItem>> getQueue(
            @RequestParam(required = false) ReviewStatus status) {
        return ResponseEntity.ok(escalationQueueService.getEscalationQueue(status));
    }

    @GetMapping("/queue/admin")
    public ResponseEntity<List<ModeratorReviewItem>> getAdminQueue() {
        return ResponseEntity.ok(escalationQueueService.getAdminEscalationQueue());
    }

    @GetMapping("/queue/{id}")
    public ResponseEntity<ModeratorReviewItem> getItem(@PathVariable UUID id) {
        return ResponseEntity.ok(escalationQueueService.getItem(id));
    }

    @PostMapping("/queue/{id}/assign")
    public ResponseEntity<ModeratorReviewItem> assign(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID moderatorId) {
        return ResponseEntity.ok(escalationQueueService.assign(id, moderatorId));
    }

    /**
     * Approve, reject, time out or escalate an item.
     * POST /api/v1/moderation/queue/{id}/decisions
     */
    @PostMapping("/queue/{id}/decisions")
    public ResponseEntity<ModeratorReviewItem> decide(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID moderatorId,
            @RequestBody DecisionRequest request) {
        ModeratorReviewItem item = escalationQueueService
                .moderatorDecide(id, request.decision(), moderatorId, request.notes(), request.timeoutMinutes())
                .orElseThrow();
        return ResponseEntity.ok(item);
    }

    /**
     * POST /api/v1/moderation/penalties
     */
    @PostMapping("/penalties")
    public ResponseEntity<AdminPenalty> applyPenalty(
            @RequestHeader("X-Actor-ID") UUID adminId,
            @RequestBody ApplyPenaltyRequest request) {
        AdminPenalty penalty = adminPenaltyService.applyPenalty(new PenaltyRequest(
                request.reviewItemId(),
                request.userId(),
                adminId,
                request.severity(),
                request.category(),
                request.reason(),
                request.durationHours(),
                request.evidenceLink(),
                request.policyReference(),
                request.strikeId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(penalty);
    }

    @DeleteMapping("/penalties/{id}")
    public ResponseEntity<AdminPenalty> deactivatePenalty(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID adminId,
            @RequestParam String reason) {
        return ResponseEntity.ok(adminPenaltyService.deactivatePenalty(id, adminId, reason));
    }

    @GetMapping("/penalties")
    public ResponseEntity<List<AdminPenalty>> getActivePenalties(@RequestParam UUID userId) {
        return ResponseEntity.ok(adminPenaltyService.getActivePenalties(userId));
    }

    // Request DTOs
    public record DecisionRequest(ModeratorDecision decision, String notes, Integer timeoutMinutes) {}

    public record ApplyPenaltyRequest(
            UUID reviewItemId,
            UUID userId,
            Severity severity,
            PolicyCategory category,
            String reason,
            Integer durationHours,
            String evidenceLink,
            String policyReference,
            UUID strikeId
    ) {}
}
