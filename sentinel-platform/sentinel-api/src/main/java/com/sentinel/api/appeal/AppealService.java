package com.sentinel.api.appeal;

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
import com.sentinel.api.strike.StrikeLedgerService;
import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.Appeal;
import com.sentinel.core.domain.Appeal.AppealStatus;
import com.sentinel.core.domain.Appeal.TargetType;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.AdminPenaltyRepository;
import com.sentinel.core.repository.AppealRepository;
import com.sentinel.core.repository.StrikeRepository;
import com.sentinel.core.repository.ViolationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appeals against admin penalties, strikes and violations.
 *
 * A target has at most one pending appeal. Approval reverses the enforcement the
 * appeal names; denial only records the outcome. Both are final.
 */
@Service
public class AppealService {

    private static final Logger log = LoggerFactory.getLogger(AppealService.class);

    private final AppealRepository appealRepository;
    private final AdminPenaltyRepository penaltyRepository;
    private final StrikeRepository strikeRepository;
    private final ViolationRepository violationRepository;
    private final StrikeLedgerService strikeLedgerService;
    private final RestrictionService restrictionService;
    private final NonAppealablePolicy appealPolicy;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AppealService(
            AppealRepository appealRepository,
            AdminPenaltyRepository penaltyRepository,
            StrikeRepository strikeRepository,
            ViolationRepository violationRepository,
            StrikeLedgerService strikeLedgerService,
            RestrictionService restrictionService,
            NonAppealablePolicy appealPolicy,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.appealRepository = appealRepository;
        this.penaltyRepository = penaltyRepository;
        this.strikeRepository = strikeRepository;
        this.violationRepository = violationRepository;
        this.strikeLedgerService = strikeLedgerService;
        this.restrictionService = restrictionService;
        this.appealPolicy = appealPolicy;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    // ==================== Submit ====================

    /**
     * Appeals an admin penalty.
     */
    public OperationResult<Appeal> submitAppeal(UUID userId, UUID penaltyId, String reason, String evidenceUrl) {
        return submitAppeal(new AppealRequest(userId, TargetType.ADMIN_PENALTY, penaltyId, reason, evidenceUrl));
    }

    public OperationResult<Appeal> submitAppeal(AppealRequest request) {
        try {
            Appeal appeal = transactionTemplate.execute(status -> doSubmit(request));
            log.info("Appeal {} submitted by user {} against {} {}",
                    appeal.getId(), request.userId(), request.targetType(), request.targetId());
            return OperationResult.ok(appeal);
        } catch (ModerationException e) {
            return OperationResult.failure(e);
        } catch (DataIntegrityViolationException e) {
            return OperationResult.failure(ErrorKind.VALIDATION,
                    "An appeal for " + request.targetId() + " is already pending");
        }
    }

    private Appeal doSubmit(AppealRequest request) {
        if (request.userId() == null || request.targetType() == null || request.targetId() == null) {
            throw new ModerationValidationException("User, target type and target id are required");
        }
        if (request.reason() == null || request.reason().trim().length() < Appeal.MIN_REASON_LENGTH) {
            throw new ModerationValidationException(
                    "Appeal reason must be at least " + Appeal.MIN_REASON_LENGTH + " characters");
        }
        if (appealRepository.existsByTargetIdAndStatus(request.targetId(), AppealStatus.PENDING)) {
            throw new ModerationValidationException("An appeal for " + request.targetId() + " is already pending");
        }

        Appeal appeal = switch (request.targetType()) {
            case ADMIN_PENALTY -> penaltyAppeal(request);
            case STRIKE -> strikeAppeal(request);
            case VIOLATION -> violationAppeal(request);
        };
        Appeal saved = appealRepository.saveAndFlush(appeal);

        auditService.record(EventType.APPEAL_SUBMITTED, request.userId(), ActorType.USER, request.userId(),
                saved.getId(), "Appeal", request.targetType() + " " + request.targetId());
        notificationPublisher.publish(new NotificationIntent(request.userId(), NotificationType.APPEAL_RECEIVED,
                "Appeal received",
                "We received your appeal and will let you know once it has been reviewed.",
                Map.of("appealId", saved.getId().toString())));
        return saved;
    }

    private Appeal penaltyAppeal(AppealRequest request) {
        AdminPenalty penalty = penaltyRepository.findById(request.targetId())
                .orElseThrow(() -> new ResourceNotFoundException("Penalty not found: " + request.targetId()));
        requireOwner(penalty.getUserId(), request);
        if (!penalty.isActive()) {
            throw new ModerationValidationException("Penalty " + penalty.getId() + " is no longer active");
        }
        if (!appealPolicy.isAppealable(penalty)) {
            throw new PolicyBlockedException("This penalty cannot be appealed");
        }
        return Appeal.create(request.userId(), TargetType.ADMIN_PENALTY, penalty.getId(), penalty.getId(),
                penalty.getStrikeId(), penalty.getViolationId(), request.reason().trim(), request.evidenceUrl(),
                clock.instant());
    }

    private Appeal strikeAppeal(AppealRequest request) {
        Strike strike = strikeRepository.findById(request.targetId())
                .orElseThrow(() -> new ResourceNotFoundException("Strike not found: " + request.targetId()));
        requireOwner(strike.getUserId(), request);
        if (!strike.isActive()) {
            throw new ModerationValidationException("Strike " + strike.getId() + " has been revoked");
        }
        if (!appealPolicy.isAppealable(strike)) {
            throw new PolicyBlockedException("This strike cannot be appealed");
        }
        return Appeal.create(request.userId(), TargetType.STRIKE, strike.getId(), null,
                strike.getId(), strike.getViolationId(), request.reason().trim(), request.evidenceUrl(),
                clock.instant());
    }

    private Appeal violationAppeal(AppealRequest request) {
        Violation violation = violationRepository.findById(request.targetId())
                .filter(v -> !v.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException("Violation not found: " + request.targetId()));
        requireOwner(violation.getUserId(), request);
        if (violation.isResolved()) {
            throw new ModerationValidationException("Violation " + violation.getId() + " is already resolved");
        }
        if (!appealPolicy.isAppealable(violation)) {
            throw new PolicyBlockedException("This violation cannot be appealed");
        }
        return Appeal.create(request.userId(), TargetType.VIOLATION, violation.getId(), null,
                null, violation.getId(), request.reason().trim(), request.evidenceUrl(), clock.instant());
    }

    private static void requireOwner(UUID ownerId, AppealRequest request) {
        if (!ownerId.equals(request.userId())) {
            throw new ModerationValidationException(
                    request.targetType() + " " + request.targetId() + " does not belong to the appellant");
        }
    }

    // ==================== Resolve ====================

    /**
     * Approves or denies a pending appeal.
     *
     * @param decision APPROVED or DENIED
     */
    public OperationResult<Appeal> resolveAppeal(UUID appealId, AppealStatus decision, UUID adminId, String message) {
        if (decision == null || decision == AppealStatus.PENDING) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Decision must be APPROVED or DENIED");
        }
        try {
            Appeal appeal = transactionTemplate.execute(status -> doResolve(appealId, decision, adminId, message));
            return OperationResult.ok(appeal);
        } catch (ModerationException e) {
            return OperationResult.failure(e);
        } catch (ConcurrencyFailureException e) {
            return OperationResult.failure(ErrorKind.CONCURRENCY_CONFLICT,
                    "Appeal " + appealId + " was resolved concurrently");
        }
    }

    private Appeal doResolve(UUID appealId, AppealStatus decision, UUID adminId, String message) {
        Appeal appeal = appealRepository.findById(appealId)
                .orElseThrow(() -> new ResourceNotFoundException("Appeal not found: " + appealId));
        if (appeal.getStatus() != AppealStatus.PENDING) {
            throw new ModerationValidationException("Appeal " + appealId + " is already " + appeal.getStatus());
        }
        Instant now = clock.instant();
        appeal.resolve(decision, adminId, message, now);
        appealRepository.saveAndFlush(appeal);

        if (decision == AppealStatus.APPROVED) {
            reverseEnforcement(appeal, adminId, now);
            auditService.record(EventType.APPEAL_APPROVED, adminId, ActorType.ADMIN, appeal.getUserId(),
                    appealId, "Appeal", message);
            notificationPublisher.publish(new NotificationIntent(appeal.getUserId(), NotificationType.APPEAL_APPROVED,
                    "Appeal approved",
                    message == null || message.isBlank()
                            ? "Your appeal was approved and the enforcement has been reversed."
                            : "Your appeal was approved: " + message,
                    Map.of("appealId", appealId.toString())));
        } else {
            auditService.record(EventType.APPEAL_DENIED, adminId, ActorType.ADMIN, appeal.getUserId(),
                    appealId, "Appeal", message);
            notificationPublisher.publish(new NotificationIntent(appeal.getUserId(), NotificationType.APPEAL_DENIED,
                    "Appeal denied",
                    message == null || message.isBlank()
                            ? "Your appeal was reviewed and the decision stands."
                            : "Your appeal was denied: " + message,
                    Map.of("appealId", appealId.toString())));
        }
        log.info("Appeal {} {} by admin {}", appealId, decision, adminId);
        return appeal;
    }

    /**
     * Lifts the appealed enforcement. Linked records owned by anyone other than the
     * appellant are left untouched.
     */
    private void reverseEnforcement(Appeal appeal, UUID adminId, Instant now) {
        String reason = "Appeal " + appeal.getId() + " approved";
        UUID owner = appeal.getUserId();
        if (appeal.getPenaltyId() != null) {
            penaltyRepository.findById(appeal.getPenaltyId())
                    .filter(AdminPenalty::isActive)
                    .filter(penalty -> owner.equals(penalty.getUserId()))
                    .ifPresent(penalty -> {
                        penalty.deactivate(reason, now);
                        penaltyRepository.save(penalty);
                        auditService.record(EventType.PENALTY_DEACTIVATED, adminId, ActorType.ADMIN,
                                penalty.getUserId(), penalty.getId(), "AdminPenalty", reason);
                    });
        }
        if (appeal.getStrikeId() != null) {
            strikeRepository.findById(appeal.getStrikeId())
                    .filter(Strike::isActive)
                    .filter(strike -> owner.equals(strike.getUserId()))
                    .ifPresentOrElse(
                            strike -> strikeLedgerService.revokeStrike(strike.getId(), adminId, ActorType.ADMIN, reason),
                            () -> log.warn("Appeal {} links strike {} that is inactive or not owned by {}",
                                    appeal.getId(), appeal.getStrikeId(), owner));
        }
        if (appeal.getViolationId() != null) {
            violationRepository.findById(appeal.getViolationId())
                    .filter(violation -> owner.equals(violation.getUserId()))
                    .ifPresentOrElse(violation -> {
                        violation.resolve(now);
                        violationRepository.save(violation);
                        restrictionService.liftForViolation(violation.getId(), reason);
                    }, () -> log.warn("Appeal {} links violation {} not owned by {}",
                            appeal.getId(), appeal.getViolationId(), owner));
        }
    }

    // ==================== Queries ====================

    public Appeal getAppeal(UUID appealId) {
        return appealRepository.findById(appealId)
                .orElseThrow(() -> new ResourceNotFoundException("Appeal not found: " + appealId));
    }

    public List<Appeal> getAppealsForUser(UUID userId) {
        return appealRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<Appeal> getPendingAppeals() {
        return appealRepository.findByStatusOrderByCreatedAtAsc(AppealStatus.PENDING);
    }

    // DTOs
    public record AppealRequest(
            UUID userId,
            TargetType targetType,
            UUID targetId,
            String reason,
            String evidenceUrl
    ) {}
}
