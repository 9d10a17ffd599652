package com.sentinel.api.notification;

import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.RecordingNotificationSender;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.core.domain.PushNotificationLog.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Push delivery rules: every notification reaches the inbox; moderation pushes are
 * capped per 30 minutes with one summary; quiet hours hold back non-critical pushes.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class NotificationDispatcherPropertyTest {

    @Autowired
    private NotificationDispatcher dispatcher;

    @Autowired
    private NotificationPreferenceService preferenceService;

    @Autowired
    private RecordingNotificationSender sender;

    @Autowired
    private MutableClock clock;

    private UUID userId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        userId = UUID.randomUUID();
    }

    // ==================== Moderation rate limit ====================

    @Test
    void sixthModerationPushBecomesSummaryThenInboxOnly() {
        List<Outcome> outcomes = new ArrayList<>();
        for (int n = 0; n < 8; n++) {
            outcomes.add(dispatcher.dispatch(
                    NotificationIntent.of(userId, NotificationType.MODERATION_WARNING, "Warning " + n, "body")).outcome());
        }

        assertThat(outcomes).isEqualTo(List.of(
                Outcome.DELIVERED, Outcome.DELIVERED, Outcome.DELIVERED, Outcome.DELIVERED, Outcome.DELIVERED,
                Outcome.SUMMARY_DELIVERED,
                Outcome.INBOX_ONLY_RATE_LIMITED, Outcome.INBOX_ONLY_RATE_LIMITED));

        List<RecordingNotificationSender.SentPush> pushes = sender.sentTo(userId);
        assertThat(pushes).hasSize(6);
        assertThat(pushes.get(5).type()).isEqualTo(NotificationType.SYSTEM_WARNING);
        assertThat(pushes.get(5).title()).isEqualTo(NotificationDispatcher.SUMMARY_TITLE);

        assertThat(preferenceService.getInbox(userId)).as("every notification lands in the inbox").hasSize(8);
    }

    @Test
    void rateLimitWindowResetsAfterThirtyMinutes() {
        for (int n = 0; n < 7; n++) {
            dispatcher.dispatch(NotificationIntent.of(userId, NotificationType.TIMEOUT_APPLIED, "Timeout", "body"));
        }
        clock.advance(Duration.ofMinutes(30));

        Outcome next = dispatcher.dispatch(
                NotificationIntent.of(userId, NotificationType.TIMEOUT_APPLIED, "Timeout", "body")).outcome();
        assertThat(next).isEqualTo(Outcome.DELIVERED);
    }

    @Test
    void nonModerationTypesAreNotRateLimited() {
        for (int n = 0; n < 10; n++) {
            var result = dispatcher.dispatch(
                    NotificationIntent.of(userId, NotificationType.REPORT_RECEIVED, "Report received", "body"));
            assertThat(result.outcome()).isEqualTo(Outcome.DELIVERED);
        }
        assertThat(sender.sentTo(userId)).hasSize(10);
    }

    // ==================== Preferences ====================

    @Test
    void quietHoursHoldBackNonCriticalPushesOnly() {
        // EPOCH is 12:00 UTC
        preferenceService.updateQuietHours(userId, true, LocalTime.of(11, 0), LocalTime.of(13, 0), "UTC");

        var warning = dispatcher.dispatch(
                NotificationIntent.of(userId, NotificationType.MODERATION_WARNING, "Warning", "body"));
        var ban = dispatcher.dispatch(
                NotificationIntent.of(userId, NotificationType.BAN_APPLIED, "Banned", "body"));

        assertThat(warning.outcome()).isEqualTo(Outcome.INBOX_ONLY_QUIET_HOURS);
        assertThat(warning.inboxWritten()).isTrue();
        assertThat(warning.pushed()).isFalse();
        assertThat(ban.outcome()).isEqualTo(Outcome.DELIVERED);

        clock.advance(Duration.ofHours(1));
        var later = dispatcher.dispatch(
                NotificationIntent.of(userId, NotificationType.MODERATION_WARNING, "Warning", "body"));
        assertThat(later.outcome()).isEqualTo(Outcome.DELIVERED);
    }

    @Test
    void moderationAlertOptOutKeepsInbox() {
        preferenceService.setModerationAlertsEnabled(userId, false);

        var result = dispatcher.dispatch(
                NotificationIntent.of(userId, NotificationType.TIMEOUT_APPLIED, "Timeout", "body"));

        assertThat(result.outcome()).isEqualTo(Outcome.INBOX_ONLY_PREFERENCE);
        assertThat(sender.sentTo(userId)).isEmpty();
        assertThat(preferenceService.countUnread(userId)).isEqualTo(1);
    }
}
