package com.sentinel.core.domain;

import jakarta.persistence.*;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Per-user delivery preferences. Quiet hours may wrap midnight (22:00-07:00).
 */
@Entity
@Table(name = "notification_preferences")
public class NotificationPreference {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "quiet_hours_enabled", nullable = false)
    private boolean quietHoursEnabled;

    @Column(name = "quiet_hours_start")
    private LocalTime quietHoursStart;

    @Column(name = "quiet_hours_end")
    private LocalTime quietHoursEnd;

    @Column(name = "time_zone", nullable = false)
    private String timeZone;

    @Column(name = "moderation_alerts_enabled", nullable = false)
    private boolean moderationAlertsEnabled;

    protected NotificationPreference() {}

    public static NotificationPreference defaults(UUID userId) {
        var preference = new NotificationPreference();
        preference.userId = userId;
        preference.quietHoursEnabled = false;
        preference.timeZone = "UTC";
        preference.moderationAlertsEnabled = true;
        return preference;
    }

    public void updateQuietHours(boolean enabled, LocalTime start, LocalTime end, String zone) {
        if (enabled && (start == null || end == null)) {
            throw new IllegalArgumentException("Quiet hours need both a start and an end");
        }
        if (zone != null) {
            ZoneId.of(zone);
            this.timeZone = zone;
        }
        this.quietHoursEnabled = enabled;
        this.quietHoursStart = start;
        this.quietHoursEnd = end;
    }

    public void setModerationAlertsEnabled(boolean enabled) {
        this.moderationAlertsEnabled = enabled;
    }

    public UUID getUserId() { return userId; }
    public boolean isQuietHoursEnabled() { return quietHoursEnabled; }
    public LocalTime getQuietHoursStart() { return quietHoursStart; }
    public LocalTime getQuietHoursEnd() { return quietHoursEnd; }
    public String getTimeZone() { return timeZone; }
    public ZoneId getZoneId() { return ZoneId.of(timeZone); }
    public boolean isModerationAlertsEnabled() { return moderationAlertsEnabled; }
}
