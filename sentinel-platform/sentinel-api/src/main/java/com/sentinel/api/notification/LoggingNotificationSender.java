package com.sentinel.api.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Default transport: logs the push. Replace with a real gateway bean in deployments.
 */
@Component
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public DeliveryStatus send(UUID userId, NotificationType type, String title, String body,
                               Map<String, String> payload) {
        log.info("Push to {} [{}] {}", userId, type, title);
        return DeliveryStatus.DELIVERED;
    }
}
