package com.sentinel.api.notification;

import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.core.domain.InboxMessage;
import com.sentinel.core.domain.NotificationPreference;
import com.sentinel.core.repository.InboxMessageRepository;
import com.sentinel.core.repository.NotificationPreferenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

@Service
public class NotificationPreferenceService {

    private final NotificationPreferenceRepository preferenceRepository;
    private final InboxMessageRepository inboxRepository;

    public NotificationPreferenceService(
            NotificationPreferenceRepository preferenceRepository,
            InboxMessageRepository inboxRepository) {
        this.preferenceRepository = preferenceRepository;
        this.inboxRepository = inboxRepository;
    }

    public NotificationPreference getPreferences(UUID userId) {
        return preferenceRepository.findById(userId).orElseGet(() -> NotificationPreference.defaults(userId));
    }

    /**
     * Quiet hours may wrap past midnight (22:00 to 07:00). Start and end must differ.
     */
    @Transactional
    public NotificationPreference updateQuietHours(
            UUID userId, boolean enabled, LocalTime start, LocalTime end, String timeZone) {
        if (enabled && (start == null || end == null || start.equals(end))) {
            throw new ModerationValidationException("Quiet hours need distinct start and end times");
        }
        String zone = timeZone == null ? "UTC" : timeZone;
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ModerationValidationException("Unknown time zone: " + zone);
        }
        NotificationPreference preference = getPreferences(userId);
        preference.updateQuietHours(enabled, start, end, zone);
        return preferenceRepository.save(preference);
    }

    @Transactional
    public NotificationPreference setModerationAlertsEnabled(UUID userId, boolean enabled) {
        NotificationPreference preference = getPreferences(userId);
        preference.setModerationAlertsEnabled(enabled);
        return preferenceRepository.save(preference);
    }

    public List<InboxMessage> getInbox(UUID userId) {
        return inboxRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public long countUnread(UUID userId) {
        return inboxRepository.countByUserIdAndReadFalse(userId);
    }
}
