package com.sentinel.api.notification;

import com.sentinel.core.domain.NotificationPreference;

import java.time.Instant;
import java.time.LocalTime;

/**
 * Quiet hours arithmetic. A window whose start is after its end wraps midnight,
 * e.g. 22:00-07:00 covers 23:30 and 06:59 but not 07:00. Start is inclusive, end exclusive.
 */
public final class QuietHours {

    private QuietHours() {}

    public static boolean contains(LocalTime start, LocalTime end, LocalTime time) {
        if (start == null || end == null || start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public static boolean isActive(NotificationPreference preference, Instant now) {
        if (preference == null || !preference.isQuietHoursEnabled()) {
            return false;
        }
        LocalTime local = LocalTime.ofInstant(now, preference.getZoneId());
        return contains(preference.getQuietHoursStart(), preference.getQuietHoursEnd(), local);
    }
}
