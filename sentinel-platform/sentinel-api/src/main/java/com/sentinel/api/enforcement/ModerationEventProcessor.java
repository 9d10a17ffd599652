package com.sentinel.api.enforcement;

import com.sentinel.api.policy.ScopeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs moderation events on the bounded event pool. Events for different users and
 * scopes proceed in parallel; ordering within a (user, scope) pair comes from the
 * strike ledger lock, not from this class.
 */
@Component
public class ModerationEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(ModerationEventProcessor.class);

    private final ModerationService moderationService;
    private final TaskExecutor executor;

    public ModerationEventProcessor(
            ModerationService moderationService,
            @Qualifier("moderationEventExecutor") TaskExecutor executor) {
        this.moderationService = moderationService;
        this.executor = executor;
    }

    public CompletableFuture<EnforcementResult> submit(ModerationEvent event) {
        return CompletableFuture.supplyAsync(
                () -> moderationService.classifyAndEnforce(event.userId(), event.text(), event.context()),
                executor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Moderation event for user {} in {} failed", event.userId(),
                                event.context().scopeId(), error);
                    }
                });
    }

    public List<CompletableFuture<EnforcementResult>> submitAll(List<ModerationEvent> events) {
        return events.stream().map(this::submit).toList();
    }

    public record ModerationEvent(UUID userId, String text, ScopeContext context) {}
}
