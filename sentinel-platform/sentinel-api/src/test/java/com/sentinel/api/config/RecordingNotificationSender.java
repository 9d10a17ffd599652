package com.sentinel.api.config;

import com.sentinel.api.notification.DeliveryStatus;
import com.sentinel.api.notification.NotificationSender;
import com.sentinel.api.notification.NotificationType;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures pushes instead of delivering them.
 */
public class RecordingNotificationSender implements NotificationSender {

    private final List<SentPush> sent = new CopyOnWriteArrayList<>();

    @Override
    public DeliveryStatus send(UUID userId, NotificationType type, String title, String body,
                               Map<String, String> payload) {
        sent.add(new SentPush(userId, type, title, body));
        return DeliveryStatus.DELIVERED;
    }

    public List<SentPush> sentTo(UUID userId) {
        return sent.stream().filter(p -> p.userId().equals(userId)).toList();
    }

    public record SentPush(UUID userId, NotificationType type, String title, String body) {}
}
