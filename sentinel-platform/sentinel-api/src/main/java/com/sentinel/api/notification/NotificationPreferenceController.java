package com.sentinel.api.notification;

import com.sentinel.core.domain.InboxMessage;
import com.sentinel.core.domain.NotificationPreference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * REST API for notification preferences and the moderation inbox.
 */
@RestController
@RequestMapping("/api/v1/moderation/notifications")
public class NotificationPreferenceController {

    private final NotificationPreferenceService preferenceService;

    public NotificationPreferenceController(NotificationPreferenceService preferenceService) {
        this.preferenceService = preferenceService;
    }

    @GetMapping("/preferences")
    public ResponseEntity<NotificationPreference> getPreferences(@RequestHeader("X-Actor-ID") UUID userId) {
        return ResponseEntity.ok(preferenceService.getPreferences(userId));
    }

    /**
     * PUT /api/v1/moderation/notifications/preferences/quiet-hours
     */
    @PutMapping("/preferences/quiet-hours")
    public ResponseEntity<NotificationPreference> updateQuietHours(
            @RequestHeader("X-Actor-ID") UUID userId,
            @RequestBody QuietHoursRequest request) {
        return ResponseEntity.ok(preferenceService.updateQuietHours(
                userId, request.enabled(), request.start(), request.end(), request.timeZone()));
    }

    @PutMapping("/preferences/moderation-alerts")
    public ResponseEntity<NotificationPreference> setModerationAlerts(
            @RequestHeader("X-Actor-ID") UUID userId,
            @RequestParam boolean enabled) {
        return ResponseEntity.ok(preferenceService.setModerationAlertsEnabled(userId, enabled));
    }

    @GetMapping("/inbox")
    public ResponseEntity<List<InboxMessage>> getInbox(@RequestHeader("X-Actor-ID") UUID userId) {
        return ResponseEntity.ok(preferenceService.getInbox(userId));
    }

    // Request DTOs
    public record QuietHoursRequest(boolean enabled, LocalTime start, LocalTime end, String timeZone) {}
}
