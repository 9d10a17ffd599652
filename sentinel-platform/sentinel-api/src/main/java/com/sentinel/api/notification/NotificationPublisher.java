package com.sentinel.api.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Queues notifications from transactional services. Intents published inside a
 * transaction are dispatched only after it commits, so a rolled-back action never
 * notifies; outside a transaction they are dispatched immediately. Dispatch runs
 * detached from the committed transaction so its writes commit on their own.
 */
@Component
public class NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final ApplicationEventPublisher eventPublisher;
    private final NotificationDispatcher dispatcher;

    public NotificationPublisher(ApplicationEventPublisher eventPublisher, NotificationDispatcher dispatcher) {
        this.eventPublisher = eventPublisher;
        this.dispatcher = dispatcher;
    }

    public void publish(NotificationIntent intent) {
        eventPublisher.publishEvent(intent);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void onCommitted(NotificationIntent intent) {
        try {
            dispatcher.dispatch(intent);
        } catch (RuntimeException e) {
            log.error("Notification {} for user {} could not be dispatched", intent.type(), intent.userId(), e);
        }
    }
}
