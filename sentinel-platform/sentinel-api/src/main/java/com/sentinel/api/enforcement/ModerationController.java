package com.sentinel.api.enforcement;

import com.sentinel.api.classifier.ClassificationService;
import com.sentinel.api.classifier.ClassificationService.ClassificationOutcome;
import com.sentinel.api.enforcement.ModerationService.AccessCheck;
import com.sentinel.api.enforcement.ModerationService.UpcomingExpiration;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeType;
import com.sentinel.core.domain.Violation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST API for content moderation.
 */
@RestController
@RequestMapping("/api/v1/moderation")
public class ModerationController {

    private final ModerationService moderationService;
    private final ClassificationService classificationService;
    private final RestrictionService restrictionService;

    public ModerationController(
            ModerationService moderationService,
            ClassificationService classificationService,
            RestrictionService restrictionService) {
        this.moderationService = moderationService;
        this.classificationService = classificationService;
        this.restrictionService = restrictionService;
    }

    /**
     * Classify and enforce one piece of content.
     * POST /api/v1/moderation/events
     */
    @PostMapping("/events")
    public ResponseEntity<EnforcementResponse> moderate(@RequestBody ModerationEventRequest request) {
        ScopeType scopeType = request.scopeType() == null ? ScopeType.STREAM : request.scopeType();
        EnforcementResult result = moderationService.classifyAndEnforce(request.userId(), request.text(),
                new ScopeContext(scopeType, request.scopeId(), request.contentId()));
        return ResponseEntity.ok(EnforcementResponse.from(result));
    }

    /**
     * Score text without enforcing anything.
     * POST /api/v1/moderation/classify
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassificationOutcome> classify(@RequestBody ClassifyRequest request) {
        return ResponseEntity.ok(classificationService.classify(request.text()));
    }

    /**
     * GET /api/v1/moderation/access?userId=&scopeId=
     */
    @GetMapping("/access")
    public ResponseEntity<AccessCheck> checkAccess(@RequestParam UUID userId, @RequestParam UUID scopeId) {
        return ResponseEntity.ok(moderationService.checkAccess(userId, scopeId));
    }

    @GetMapping("/restrictions")
    public ResponseEntity<List<ScopeRestriction>> getRestrictions(
            @RequestParam UUID userId, @RequestParam UUID scopeId) {
        return ResponseEntity.ok(restrictionService.getActiveRestrictions(userId, scopeId));
    }

    @GetMapping("/users/{userId}/violations")
    public ResponseEntity<List<Violation>> getViolations(@PathVariable UUID userId) {
        return ResponseEntity.ok(moderationService.getViolations(userId));
    }

    /**
     * Admin soft delete.
     * DELETE /api/v1/moderation/violations/{id}
     */
    @DeleteMapping("/violations/{id}")
    public ResponseEntity<Violation> deleteViolation(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID adminId,
            @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(moderationService.deleteViolation(id, adminId, reason));
    }

    @GetMapping("/users/{userId}/expirations")
    public ResponseEntity<List<UpcomingExpiration>> getUpcomingExpirations(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "24") long withinHours) {
        return ResponseEntity.ok(moderationService.getUpcomingExpirations(userId, Duration.ofHours(withinHours)));
    }

    // Request/Response DTOs
    public record ModerationEventRequest(
            UUID userId,
            String text,
            ScopeType scopeType,
            UUID scopeId,
            UUID contentId
    ) {}

    public record ClassifyRequest(String text) {}

    public record EnforcementResponse(
            boolean allowed,
            ModerationAction action,
            double overallScore,
            UUID violationId,
            Integer strikeLevel,
            UUID restrictionId,
            boolean escalationQueued,
            boolean notified,
            boolean degraded,
            String reason
    ) {
        static EnforcementResponse from(EnforcementResult result) {
            return new EnforcementResponse(
                    result.allowed(),
                    result.action(),
                    result.scores().overall(),
                    result.violationId(),
                    result.strike() == null ? null : result.strike().getLevel(),
                    result.restriction() == null ? null : result.restriction().getId(),
                    result.escalationQueued(),
                    result.notified(),
                    result.degraded(),
                    result.reason());
        }
    }
}
