package com.sentinel.api.strike;

import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Strike;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the strike ledger.
 */
@RestController
@RequestMapping("/api/v1/moderation/strikes")
public class StrikeController {

    private final StrikeLedgerService strikeLedgerService;

    public StrikeController(StrikeLedgerService strikeLedgerService) {
        this.strikeLedgerService = strikeLedgerService;
    }

    /**
     * Issue a manual strike.
     * POST /api/v1/moderation/strikes
     */
    @PostMapping
    public ResponseEntity<Strike> applyStrike(@RequestBody StrikeRequest request) {
        Strike strike = strikeLedgerService.applyStrike(
                request.userId(), request.scopeId(), request.type(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(strike);
    }

    /**
     * DELETE /api/v1/moderation/strikes/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Strike> revokeStrike(
            @PathVariable UUID id,
            @RequestHeader("X-Actor-ID") UUID adminId,
            @RequestParam String reason) {
        return ResponseEntity.ok(strikeLedgerService.revokeStrike(id, adminId, ActorType.ADMIN, reason));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Strike> getStrike(@PathVariable UUID id) {
        return ResponseEntity.ok(strikeLedgerService.getStrike(id));
    }

    @GetMapping
    public ResponseEntity<List<Strike>> getStrikes(
            @RequestParam UUID userId,
            @RequestParam(required = false) UUID scopeId) {
        return ResponseEntity.ok(scopeId == null
                ? strikeLedgerService.getStrikeHistory(userId)
                : strikeLedgerService.getActiveStrikes(userId, scopeId));
    }

    /**
     * GET /api/v1/moderation/strikes/ban-status?userId=&scopeId=
     */
    @GetMapping("/ban-status")
    public ResponseEntity<BanStatusResponse> isBanned(@RequestParam UUID userId, @RequestParam UUID scopeId) {
        return ResponseEntity.ok(new BanStatusResponse(userId, scopeId, strikeLedgerService.isBanned(userId, scopeId)));
    }

    // Request/Response DTOs
    public record StrikeRequest(UUID userId, UUID scopeId, PolicyCategory type, String reason) {}

    public record BanStatusResponse(UUID userId, UUID scopeId, boolean banned) {}
}
