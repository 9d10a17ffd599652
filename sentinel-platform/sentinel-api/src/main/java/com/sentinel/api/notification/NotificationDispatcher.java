package com.sentinel.api.notification;

import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.ratewindow.RateWindowTracker;
import com.sentinel.core.domain.NotificationPreference;
import com.sentinel.core.domain.PushNotificationLog;
import com.sentinel.core.domain.PushNotificationLog.Outcome;
import com.sentinel.core.repository.NotificationPreferenceRepository;
import com.sentinel.core.repository.PushNotificationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Delivers a {@link NotificationIntent}: always to the inbox, and as a push unless
 * preferences, quiet hours or the moderation push rate limit say otherwise.
 *
 * Moderation pushes are capped per user per 30-minute window. The first pushes go
 * out individually, the one after the cap becomes a single summary push, and the
 * rest of the window is inbox-only.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String SUMMARY_TITLE = "Multiple account updates";

    private final NotificationSender sender;
    private final InboxWriter inboxWriter;
    private final NotificationPreferenceRepository preferenceRepository;
    private final PushNotificationLogRepository pushLogRepository;
    private final RateWindowTracker rateWindowTracker;
    private final Clock clock;

    @Value("${sentinel.notifications.moderation-push-limit:5}")
    private int moderationPushLimit = 5;

    @Value("${sentinel.notifications.moderation-window-minutes:30}")
    private long moderationWindowMinutes = 30;

    public NotificationDispatcher(
            NotificationSender sender,
            InboxWriter inboxWriter,
            NotificationPreferenceRepository preferenceRepository,
            PushNotificationLogRepository pushLogRepository,
            RateWindowTracker rateWindowTracker,
            Clock clock) {
        this.sender = sender;
        this.inboxWriter = inboxWriter;
        this.preferenceRepository = preferenceRepository;
        this.pushLogRepository = pushLogRepository;
        this.rateWindowTracker = rateWindowTracker;
        this.clock = clock;
    }

    public DispatchResult dispatch(NotificationIntent intent) {
        Instant now = clock.instant();
        boolean inboxWritten = writeInbox(intent);

        NotificationPreference preference = preferenceRepository.findById(intent.userId())
                .orElseGet(() -> NotificationPreference.defaults(intent.userId()));

        if (intent.type().isModeration() && !preference.isModerationAlertsEnabled()) {
            return finish(intent, Outcome.INBOX_ONLY_PREFERENCE, inboxWritten, now);
        }
        if (!intent.type().isCritical() && QuietHours.isActive(preference, now)) {
            return finish(intent, Outcome.INBOX_ONLY_QUIET_HOURS, inboxWritten, now);
        }

        if (intent.type().isModeration()) {
            int count;
            try {
                count = rateWindowTracker.increment(moderationKey(intent.userId()),
                        Duration.ofMinutes(moderationWindowMinutes));
            } catch (TransientIoException e) {
                log.warn("Push rate limit unavailable for {}, keeping {} in inbox only", intent.userId(), intent.type());
                return finish(intent, Outcome.INBOX_ONLY_RATE_LIMITED, inboxWritten, now);
            }
            if (count == moderationPushLimit + 1) {
                NotificationIntent summary = new NotificationIntent(
                        intent.userId(),
                        NotificationType.SYSTEM_WARNING,
                        SUMMARY_TITLE,
                        "There have been several updates to your account. Check your inbox for details.",
                        Map.of("summarizedType", intent.type().name()));
                DeliveryStatus status = push(summary);
                return finish(summary, status == DeliveryStatus.FAILED ? Outcome.FAILED : Outcome.SUMMARY_DELIVERED,
                        inboxWritten, now);
            }
            if (count > moderationPushLimit + 1) {
                return finish(intent, Outcome.INBOX_ONLY_RATE_LIMITED, inboxWritten, now);
            }
        }

        DeliveryStatus status = push(intent);
        return finish(intent, outcomeOf(status), inboxWritten, now);
    }

    static String moderationKey(UUID userId) {
        return "notify:moderation:" + userId;
    }

    private boolean writeInbox(NotificationIntent intent) {
        try {
            inboxWriter.sendSystemMessage(intent.userId(), intent.title(), intent.body(), intent.inboxCategory());
            return true;
        } catch (RuntimeException e) {
            log.error("Inbox write failed for user {} ({})", intent.userId(), intent.type(), e);
            return false;
        }
    }

    private DeliveryStatus push(NotificationIntent intent) {
        try {
            return sender.send(intent.userId(), intent.type(), intent.title(), intent.body(), intent.payload());
        } catch (RuntimeException e) {
            log.warn("Push transport failed for user {} ({}): {}", intent.userId(), intent.type(), e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }

    private DispatchResult finish(NotificationIntent intent, Outcome outcome, boolean inboxWritten, Instant now) {
        try {
            pushLogRepository.save(PushNotificationLog.record(
                    intent.userId(), intent.type().name(), intent.title(), intent.body(), outcome, now));
        } catch (RuntimeException e) {
            log.warn("Could not record push outcome {} for user {}: {}", outcome, intent.userId(), e.getMessage());
        }
        return new DispatchResult(outcome, inboxWritten);
    }

    private static Outcome outcomeOf(DeliveryStatus status) {
        return switch (status) {
            case DELIVERED -> Outcome.DELIVERED;
            case UNREACHABLE -> Outcome.UNREACHABLE;
            case FAILED -> Outcome.FAILED;
        };
    }

    public record DispatchResult(Outcome outcome, boolean inboxWritten) {

        public boolean pushed() {
            return outcome == Outcome.DELIVERED || outcome == Outcome.SUMMARY_DELIVERED;
        }
    }
}
