package com.sentinel.api.ratewindow;

import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Message-rate spam detection. More than 10 messages from one user inside a 10-second
 * window trips a 1-minute timeout in the current scope and clears the window, so the
 * next message starts counting from one.
 */
@Service
public class SpamDetector {

    private static final Logger log = LoggerFactory.getLogger(SpamDetector.class);

    private final RateWindowTracker tracker;
    private final RestrictionService restrictionService;
    private final NotificationPublisher notificationPublisher;

    @Value("${sentinel.spam.max-messages:10}")
    private int maxMessages = 10;

    @Value("${sentinel.spam.window-seconds:10}")
    private long windowSeconds = 10;

    @Value("${sentinel.spam.timeout-seconds:60}")
    private long timeoutSeconds = 60;

    public SpamDetector(
            RateWindowTracker tracker,
            RestrictionService restrictionService,
            NotificationPublisher notificationPublisher) {
        this.tracker = tracker;
        this.restrictionService = restrictionService;
        this.notificationPublisher = notificationPublisher;
    }

    /**
     * Counts one message for the user and trips the detector when the window overflows.
     */
    public SpamCheck recordMessage(UUID userId, UUID scopeId) {
        String key = key(userId);
        int count = tracker.increment(key, Duration.ofSeconds(windowSeconds));
        if (count <= maxMessages) {
            return new SpamCheck(false, count, null);
        }
        if (count > maxMessages + 1) {
            // a concurrent message already tripped this window
            return new SpamCheck(false, count, null);
        }

        tracker.reset(key);
        ScopeRestriction timeout = restrictionService.applyTimeout(userId, scopeId,
                Duration.ofSeconds(timeoutSeconds), RestrictionSource.SPAM_DETECTOR,
                "Sending messages too quickly", null, null);
        notificationPublisher.publish(new NotificationIntent(userId, NotificationType.TIMEOUT_APPLIED,
                "Slow down",
                "You sent too many messages in a short time and cannot chat for 1 minute.",
                Map.of("scopeId", scopeId.toString())));
        log.info("Spam detector tripped for user {} in scope {} after {} messages", userId, scopeId, count);
        return new SpamCheck(true, count, timeout);
    }

    static String key(UUID userId) {
        return "spam:" + userId;
    }

    /**
     * @param count messages counted in the window, including this one
     */
    public record SpamCheck(boolean tripped, int count, ScopeRestriction timeout) {}
}
