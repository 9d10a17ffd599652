package com.sentinel.api.enforcement;

import com.sentinel.api.appeal.NonAppealablePolicy;
import com.sentinel.api.classifier.ClassificationScore;
import com.sentinel.api.error.EnforcementWriteException;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.escalation.EscalationQueueService;
import com.sentinel.api.notification.NotificationDispatcher;
import com.sentinel.api.notification.NotificationDispatcher.DispatchResult;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.api.policy.DecisionPolicy;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ModeratorReviewItem.SourceType;
import com.sentinel.core.domain.ScopeType;
import com.sentinel.core.domain.Violation;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns a classification score into enforcement.
 *
 * Writes for one event commit together or not at all; a failed write is retried once
 * and then reported as {@link EnforcementWriteException}. Review enqueueing and the user
 * notification happen after the commit and never undo it.
 */
@Service
public class EnforcementService {

    private static final Logger log = LoggerFactory.getLogger(EnforcementService.class);

    private final DecisionPolicy decisionPolicy;
    private final EnforcementWriter writer;
    private final EscalationQueueService escalationQueueService;
    private final NotificationDispatcher notificationDispatcher;
    private final NonAppealablePolicy appealPolicy;
    private final Retry writeRetry;

    public EnforcementService(
            DecisionPolicy decisionPolicy,
            EnforcementWriter writer,
            EscalationQueueService escalationQueueService,
            NotificationDispatcher notificationDispatcher,
            NonAppealablePolicy appealPolicy,
            @Qualifier("enforcementWriteRetry") Retry writeRetry) {
        this.decisionPolicy = decisionPolicy;
        this.writer = writer;
        this.escalationQueueService = escalationQueueService;
        this.notificationDispatcher = notificationDispatcher;
        this.appealPolicy = appealPolicy;
        this.writeRetry = writeRetry;
    }

    public EnforcementResult enforce(UUID userId, ClassificationScore score, ScopeContext context) {
        return enforce(userId, null, score, context, false);
    }

    /**
     * @param content  original text, stored truncated on the violation; may be null
     * @param degraded whether the score came from a failed-open classification
     */
    public EnforcementResult enforce(UUID userId, String content, ClassificationScore score,
                                     ScopeContext context, boolean degraded) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(score, "score");
        Objects.requireNonNull(context, "context");

        ModerationAction action = decisionPolicy.decide(score.overall(), context);
        if (action == ModerationAction.ALLOW) {
            return EnforcementResult.allow(score, degraded);
        }

        EnforcementWriter.Written written = write(userId, content, score, action, context);
        Violation violation = written.violation();

        boolean escalationQueued = false;
        if (action == ModerationAction.ESCALATE) {
            escalationQueued = enqueueForReview(violation, context);
        }

        String reason = action.notifiesUser() ? reasonFor(violation) : null;
        boolean notified = action.notifiesUser() && notifyUser(violation, reason, context);

        log.info("{} for user {} in {} {} (overall {}, category {})", action, userId,
                context.scopeType(), context.scopeId(), score.overall(), violation.getCategory());
        return new EnforcementResult(
                !action.hidesContent(),
                action,
                score,
                violation.getId(),
                written.strike(),
                written.restriction(),
                escalationQueued,
                notified,
                degraded,
                reason);
    }

    private EnforcementWriter.Written write(UUID userId, String content, ClassificationScore score,
                                            ModerationAction action, ScopeContext context) {
        try {
            return Retry.decorateSupplier(writeRetry,
                    () -> writer.write(userId, content, score, action, context)).get();
        } catch (DataAccessException | TransactionException | TransientIoException e) {
            log.error("Enforcement write failed for user {} ({}) after retry", userId, action, e);
            throw new EnforcementWriteException("Could not persist " + action + " for user " + userId, e);
        }
    }

    private boolean enqueueForReview(Violation violation, ScopeContext context) {
        try {
            escalationQueueService.enqueue(violation, sourceTypeOf(context.scopeType()), violation.getCategory());
            return true;
        } catch (RuntimeException e) {
            log.error("Violation {} was recorded but could not be queued for review", violation.getId(), e);
            return false;
        }
    }

    private boolean notifyUser(Violation violation, String reason, ScopeContext context) {
        Map<String, String> payload = new HashMap<>();
        payload.put("violationId", violation.getId().toString());
        payload.put("scopeId", context.scopeId().toString());
        if (context.contentId() != null) {
            payload.put("contentId", context.contentId().toString());
        }
        NotificationIntent intent = new NotificationIntent(violation.getUserId(),
                notificationTypeOf(violation.getAction()), titleOf(violation.getAction()), reason, payload);
        try {
            DispatchResult result = notificationDispatcher.dispatch(intent);
            return result.inboxWritten() || result.pushed();
        } catch (RuntimeException e) {
            log.error("User {} was not notified of violation {}", violation.getUserId(), violation.getId(), e);
            return false;
        }
    }

    private String reasonFor(Violation violation) {
        String what = EnforcementWriter.describe(violation.getCategory());
        String message = switch (violation.getAction()) {
            case HIDE -> "Your content was hidden because it looks like " + what + ".";
            case ESCALATE -> "Your content was hidden and sent to a moderator for review (" + what + ").";
            case TIMEOUT -> "You cannot post here for 2 minutes because of " + what + ".";
            case BLOCK -> "You were removed from this space because of " + what + ".";
            default -> "Your content was flagged for " + what + ".";
        };
        if (violation.getAction() == ModerationAction.ESCALATE || !appealPolicy.isAppealable(violation)) {
            return message;
        }
        return appealPolicy.withAppealHint(message, violation.getCategory(), false);
    }

    private static NotificationType notificationTypeOf(ModerationAction action) {
        return switch (action) {
            case TIMEOUT -> NotificationType.TIMEOUT_APPLIED;
            case BLOCK -> NotificationType.BAN_APPLIED;
            default -> NotificationType.MODERATION_WARNING;
        };
    }

    private static String titleOf(ModerationAction action) {
        return switch (action) {
            case HIDE -> "Content hidden";
            case ESCALATE -> "Content under review";
            case TIMEOUT -> "Timed out";
            case BLOCK -> "Removed from this space";
            default -> "Content flagged";
        };
    }

    static SourceType sourceTypeOf(ScopeType scopeType) {
        return switch (scopeType) {
            case STREAM -> SourceType.CHAT_MESSAGE;
            case POST -> SourceType.POST;
            case STORY -> SourceType.STORY;
            case MESSAGE -> SourceType.DIRECT_MESSAGE;
            case PROFILE -> SourceType.PROFILE;
        };
    }
}
