package com.sentinel.api.notification;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single request to tell a user something. Quiet hours, preferences and rate
 * limits are applied once, by {@link NotificationDispatcher}.
 */
public record NotificationIntent(
        UUID userId,
        NotificationType type,
        String title,
        String body,
        Map<String, String> payload
) {
    public NotificationIntent {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(title, "title");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static NotificationIntent of(UUID userId, NotificationType type, String title, String body) {
        return new NotificationIntent(userId, type, title, body, Map.of());
    }

    public String inboxCategory() {
        return type.isModeration() ? "MODERATION" : type.name();
    }
}
