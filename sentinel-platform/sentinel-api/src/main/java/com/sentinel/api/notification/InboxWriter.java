package com.sentinel.api.notification;

import java.util.UUID;

/**
 * Non-push channel. Every notification is written here, pushed or not.
 */
public interface InboxWriter {

    void sendSystemMessage(UUID userId, String title, String body, String category);
}
