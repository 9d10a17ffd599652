package com.sentinel.api.audit;

import com.sentinel.core.domain.ModerationAuditEntry;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the moderation audit trail.
 */
@RestController
@RequestMapping("/api/v1/moderation/audit")
public class AuditController {

    private final ModerationAuditService auditService;

    public AuditController(ModerationAuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<Page<ModerationAuditEntry>> getUserHistory(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(auditService.getHistoryForUser(userId, PageRequest.of(page, Math.min(size, 200))));
    }

    @GetMapping("/resources/{resourceId}")
    public ResponseEntity<List<ModerationAuditEntry>> getResourceHistory(@PathVariable UUID resourceId) {
        return ResponseEntity.ok(auditService.getHistoryForResource(resourceId));
    }

    @GetMapping("/events/{eventType}")
    public ResponseEntity<Page<ModerationAuditEntry>> getByEventType(
            @PathVariable EventType eventType,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(auditService.getByEventType(eventType, PageRequest.of(page, Math.min(size, 200))));
    }
}
