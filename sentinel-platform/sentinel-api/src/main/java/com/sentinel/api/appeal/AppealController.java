package com.sentinel.api.appeal;

import com.sentinel.api.appeal.AppealService.AppealRequest;
import com.sentinel.core.domain.Appeal;
import com.sentinel.core.domain.Appeal.AppealStatus;
import com.sentinel.core.domain.Appeal.TargetType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for appeals.
 */
@RestController
@RequestMapping("/api/v1/moderation/appeals")
public class AppealController {

    private final AppealService appealService;

    public AppealController(AppealService appealService) {
        this.appealService = appealService;
    }

    /**
     * POST /api/v1/moderation/appeals
     */
    @PostMapping
    public ResponseEntity<Appeal> submit(
            @RequestHeader("X-Actor-ID") UUID userId,
            @RequestBody SubmitAppealRequest request) {
        TargetType targetType = request.targetType() == null ? TargetType.ADMIN_PENALTY : request.targetType();
        Appeal appeal = appealService.submitAppeal(new AppealRequest(
                userId, targetType, request.targetId(), request.reason(), request.evidenceUrl()))
                .orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(appeal);
    }

    /**
     * POST /api/v1/moderation/appeals/{id}/resolution
     */
    @PostMapping("/{id}/resolution")
    public ResponseEntity<Appeal> resolve(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID adminId,
            @RequestBody ResolveAppealRequest request) {
        return ResponseEntity.ok(
                appealService.resolveAppeal(id, request.decision(), adminId, request.message()).orElseThrow());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Appeal> getAppeal(@PathVariable UUID id) {
        return ResponseEntity.ok(appealService.getAppeal(id));
    }

    @GetMapping
    public ResponseEntity<List<Appeal>> getAppeals(@RequestParam(required = false) UUID userId) {
        return ResponseEntity.ok(userId == null
                ? appealService.getPendingAppeals()
                : appealService.getAppealsForUser(userId));
    }

    // Request DTOs
    public record SubmitAppealRequest(TargetType targetType, UUID targetId, String reason, String evidenceUrl) {}

    public record ResolveAppealRequest(AppealStatus decision, String message) {}
}
