package com.sentinel.api.notification;

import com.sentinel.core.domain.InboxMessage;
import com.sentinel.core.repository.InboxMessageRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

@Component
public class JpaInboxWriter implements InboxWriter {

    private final InboxMessageRepository inboxRepository;
    private final Clock clock;

    public JpaInboxWriter(InboxMessageRepository inboxRepository, Clock clock) {
        this.inboxRepository = inboxRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void sendSystemMessage(UUID userId, String title, String body, String category) {
        inboxRepository.save(InboxMessage.system(userId, title, body, category, clock.instant()));
    }
}
