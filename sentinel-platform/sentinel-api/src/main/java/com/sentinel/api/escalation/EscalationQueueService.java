package com.sentinel.api.escalation;

import com.sentinel.api.appeal.NonAppealablePolicy;
import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.error.ErrorKind;
import com.sentinel.api.error.ModerationException;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.OperationResult;
import com.sentinel.api.error.PolicyBlockedException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import com.sentinel.core.domain.ModeratorReviewItem.SourceType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.ModeratorReviewItemRepository;
import com.sentinel.core.repository.ViolationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Human review queue.
 *
 * Items move PENDING to APPROVED, REJECTED or ESCALATED exactly once; any decision on
 * a non-pending item is a validation error. Enqueueing is idempotent per violation.
 */
@Service
public class EscalationQueueService {

    private static final Logger log = LoggerFactory.getLogger(EscalationQueueService.class);

    private final ModeratorReviewItemRepository reviewRepository;
    private final ViolationRepository violationRepository;
    private final RestrictionService restrictionService;
    private final AdminEscalationPolicy adminEscalationPolicy;
    private final NonAppealablePolicy appealPolicy;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate insertTemplate;
    private final Clock clock;

    public EscalationQueueService(
            ModeratorReviewItemRepository reviewRepository,
            ViolationRepository violationRepository,
            RestrictionService restrictionService,
            AdminEscalationPolicy adminEscalationPolicy,
            NonAppealablePolicy appealPolicy,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.reviewRepository = reviewRepository;
        this.violationRepository = violationRepository;
        this.restrictionService = restrictionService;
        this.adminEscalationPolicy = adminEscalationPolicy;
        this.appealPolicy = appealPolicy;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    // ==================== Enqueue ====================

    /**
     * Queues a violation for review. Re-enqueueing the same violation returns the
     * existing item, including when two callers race on the insert.
     */
    public ModeratorReviewItem enqueue(Violation violation, SourceType sourceType, PolicyCategory category) {
        var existing = reviewRepository.findByViolationId(violation.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        ModeratorReviewItem item = ModeratorReviewItem.create(
                violation.getId(),
                violation.getUserId(),
                violation.getScopeId(),
                sourceType,
                true,
                violation.getContentSnippet(),
                violation.getOverallScore(),
                category,
                clock.instant());
        try {
            return insert(item);
        } catch (DataIntegrityViolationException e) {
            log.debug("Review item for violation {} inserted concurrently", violation.getId());
            return reviewRepository.findByViolationId(violation.getId())
                    .orElseThrow(() -> e);
        }
    }

    /**
     * Queues a behaviour-pattern case (no single violation) for review.
     */
    public ModeratorReviewItem enqueueBehavioral(UUID userId, PolicyCategory category, String reason, double riskScore) {
        if (reason == null || reason.isBlank()) {
            throw new ModerationValidationException("A reason is required for behavioural escalations");
        }
        return insert(ModeratorReviewItem.create(null, userId, null, SourceType.BEHAVIOR_PATTERN, true,
                reason, riskScore, category, clock.instant()));
    }

    private ModeratorReviewItem insert(ModeratorReviewItem item) {
        return insertTemplate.execute(status -> {
            ModeratorReviewItem saved = reviewRepository.saveAndFlush(item);
            auditService.recordSystem(EventType.REVIEW_ENQUEUED, saved.getUserId(), saved.getId(),
                    "ModeratorReviewItem", saved.getSourceType() + " / " + saved.getCategory());
            log.info("Review item {} queued for user {} ({})", saved.getId(), saved.getUserId(), saved.getCategory());
            return saved;
        });
    }

    // ==================== Queries ====================

    /**
     * Items in the given status, oldest first; all items when status is null.
     */
    public List<ModeratorReviewItem> getEscalationQueue(ReviewStatus status) {
        return status == null
                ? reviewRepository.findAllByOrderByCreatedAtAsc()
                : reviewRepository.findByStatusOrderByCreatedAtAsc(status);
    }

    public List<ModeratorReviewItem> getAdminEscalationQueue() {
        return reviewRepository.findByStatusOrderByCreatedAtAsc(ReviewStatus.ESCALATED);
    }

    public ModeratorReviewItem getItem(UUID itemId) {
        return reviewRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Review item not found: " + itemId));
    }

    // ==================== Moderator actions ====================

    @Transactional
    public ModeratorReviewItem assign(UUID itemId, UUID moderatorId) {
        ModeratorReviewItem item = loadPending(itemId);
        item.assignTo(moderatorId);
        return reviewRepository.save(item);
    }

    /**
     * The content was fine: the violation is resolved and restrictions created for it are lifted.
     */
    @Transactional
    public ModeratorReviewItem moderatorApprove(UUID itemId, UUID moderatorId, String notes) {
        ModeratorReviewItem item = loadPending(itemId);
        Instant now = clock.instant();
        item.resolve(ReviewStatus.APPROVED, moderatorId, notes, now);
        reviewRepository.save(item);

        if (item.getViolationId() != null) {
            violationRepository.findById(item.getViolationId()).ifPresent(violation -> {
                violation.resolve(now);
                violationRepository.save(violation);
            });
            restrictionService.liftForViolation(item.getViolationId(), "Approved on moderator review");
        }
        auditService.record(EventType.REVIEW_APPROVED, moderatorId, ActorType.MODERATOR,
                item.getUserId(), item.getId(), "ModeratorReviewItem", notes);
        notificationPublisher.publish(new NotificationIntent(item.getUserId(), NotificationType.CONTENT_RESTORED,
                "Content restored",
                "A moderator reviewed your content and found no violation. It is visible again.",
                payloadOf(item)));
        return item;
    }

    /**
     * The violation is upheld; enforcement already applied stays in place.
     */
    @Transactional
    public ModeratorReviewItem moderatorReject(UUID itemId, UUID moderatorId, String notes) {
        ModeratorReviewItem item = loadPending(itemId);
        item.resolve(ReviewStatus.REJECTED, moderatorId, notes, clock.instant());
        reviewRepository.save(item);
        auditService.record(EventType.REVIEW_REJECTED, moderatorId, ActorType.MODERATOR,
                item.getUserId(), item.getId(), "ModeratorReviewItem", notes);
        notificationPublisher.publish(new NotificationIntent(item.getUserId(), NotificationType.MODERATION_WARNING,
                "Moderator decision",
                appealPolicy.withAppealHint(
                        "A moderator reviewed your content and confirmed it breaks the community guidelines.",
                        item.getCategory(), false),
                payloadOf(item)));
        return item;
    }

    /**
     * Upholds the violation and times the user out of the item's scope.
     *
     * @param minutes timeout length, 5 to 60
     */
    @Transactional
    public ModeratorReviewItem moderatorTimeout(UUID itemId, UUID moderatorId, int minutes, String notes) {
        RestrictionService.validateModeratorMinutes(minutes);
        ModeratorReviewItem item = loadPending(itemId);
        if (item.getScopeId() == null) {
            throw new ModerationValidationException("Review item " + itemId + " has no scope to time out from");
        }
        item.resolve(ReviewStatus.REJECTED, moderatorId, notes, clock.instant());
        reviewRepository.save(item);
        restrictionService.applyModeratorTimeout(item.getUserId(), item.getScopeId(), minutes,
                notes == null ? "Moderator timeout" : notes, item.getViolationId());
        auditService.record(EventType.REVIEW_REJECTED, moderatorId, ActorType.MODERATOR,
                item.getUserId(), item.getId(), "ModeratorReviewItem", "timeout " + minutes + "m: " + notes);
        notificationPublisher.publish(new NotificationIntent(item.getUserId(), NotificationType.TIMEOUT_APPLIED,
                "Timed out by a moderator",
                appealPolicy.withAppealHint("A moderator timed you out for " + minutes + " minutes.",
                        item.getCategory(), false),
                payloadOf(item)));
        return item;
    }

    /**
     * Hands the item to admins, only when {@link AdminEscalationPolicy} allows it.
     */
    @Transactional
    public ModeratorReviewItem escalateToAdmin(UUID itemId, UUID moderatorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ModerationValidationException("An escalation reason is required");
        }
        ModeratorReviewItem item = loadPending(itemId);
        long priorRejections = reviewRepository.countByUserIdAndStatus(item.getUserId(), ReviewStatus.REJECTED);
        if (!adminEscalationPolicy.allowsEscalation(item, priorRejections)) {
            throw new PolicyBlockedException("Category " + item.getCategory()
                    + " does not qualify for admin escalation");
        }
        item.escalate(moderatorId, reason, clock.instant());
        reviewRepository.save(item);
        auditService.record(EventType.REVIEW_ESCALATED, moderatorId, ActorType.MODERATOR,
                item.getUserId(), item.getId(), "ModeratorReviewItem", reason);
        log.info("Review item {} escalated to admins by {}", itemId, moderatorId);
        return item;
    }

    /**
     * Applies a moderator decision and reports the outcome as a typed result.
     *
     * @param minutes required for {@link ModeratorDecision#TIMEOUT}
     * @param notes   moderator notes; the escalation reason for {@link ModeratorDecision#ESCALATE}
     */
    public OperationResult<ModeratorReviewItem> moderatorDecide(
            UUID itemId, ModeratorDecision decision, UUID moderatorId, String notes, Integer minutes) {
        if (decision == null) {
            return OperationResult.failure(ErrorKind.VALIDATION, "A decision is required");
        }
        if (decision == ModeratorDecision.TIMEOUT && minutes == null) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Timeout decisions need a duration in minutes");
        }
        try {
            ModeratorReviewItem item = transactionTemplate.execute(status -> switch (decision) {
                case APPROVE -> moderatorApprove(itemId, moderatorId, notes);
                case REJECT -> moderatorReject(itemId, moderatorId, notes);
                case TIMEOUT -> moderatorTimeout(itemId, moderatorId, minutes, notes);
                case ESCALATE -> escalateToAdmin(itemId, moderatorId, notes);
            });
            return OperationResult.ok(item);
        } catch (ModerationException e) {
            return OperationResult.failure(e);
        } catch (ConcurrencyFailureException e) {
            return OperationResult.failure(ErrorKind.CONCURRENCY_CONFLICT,
                    "Review item " + itemId + " was decided concurrently");
        }
    }

    private ModeratorReviewItem loadPending(UUID itemId) {
        ModeratorReviewItem item = getItem(itemId);
        if (!item.isPending()) {
            throw new ModerationValidationException(
                    "Review item " + itemId + " is already " + item.getStatus());
        }
        return item;
    }

    private static Map<String, String> payloadOf(ModeratorReviewItem item) {
        return Map.of("reviewItemId", item.getId().toString());
    }
}
