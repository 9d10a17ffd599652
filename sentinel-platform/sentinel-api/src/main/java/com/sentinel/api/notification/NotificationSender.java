package com.sentinel.api.notification;

import java.util.Map;
import java.util.UUID;

/**
 * Push transport. Device tokens and OS delivery live behind this interface.
 * Implementations must not throw when the recipient cannot currently be reached.
 */
public interface NotificationSender {

    DeliveryStatus send(UUID userId, NotificationType type, String title, String body, Map<String, String> payload);
}
