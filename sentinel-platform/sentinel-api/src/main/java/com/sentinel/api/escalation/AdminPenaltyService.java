package com.sentinel.api.escalation;

import com.sentinel.api.appeal.NonAppealablePolicy;
import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.AdminPenalty.Severity;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.repository.AdminPenaltyRepository;
import com.sentinel.core.repository.ModeratorReviewItemRepository;
import com.sentinel.core.repository.StrikeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin penalties, applied directly or on top of an escalated review item.
 */
@Service
public class AdminPenaltyService {

    private static final Logger log = LoggerFactory.getLogger(AdminPenaltyService.class);

    private final AdminPenaltyRepository penaltyRepository;
    private final ModeratorReviewItemRepository reviewRepository;
    private final StrikeRepository strikeRepository;
    private final NonAppealablePolicy appealPolicy;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public AdminPenaltyService(
            AdminPenaltyRepository penaltyRepository,
            ModeratorReviewItemRepository reviewRepository,
            StrikeRepository strikeRepository,
            NonAppealablePolicy appealPolicy,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.penaltyRepository = penaltyRepository;
        this.reviewRepository = reviewRepository;
        this.strikeRepository = strikeRepository;
        this.appealPolicy = appealPolicy;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    /**
     * Applies a penalty. Temporary penalties last 24, 168 or 720 hours. When the request
     * names a review item, the item must have been escalated and belong to the same user;
     * a linked strike must belong to the same user too.
     */
    @Transactional
    public AdminPenalty applyPenalty(PenaltyRequest request) {
        validate(request);

        UUID violationId = null;
        if (request.reviewItemId() != null) {
            ModeratorReviewItem item = reviewRepository.findById(request.reviewItemId())
                    .orElseThrow(() -> new ResourceNotFoundException("Review item not found: " + request.reviewItemId()));
            if (item.getStatus() != ReviewStatus.ESCALATED) {
                throw new ModerationValidationException("Review item " + item.getId() + " has not been escalated");
            }
            if (!item.getUserId().equals(request.userId())) {
                throw new ModerationValidationException("Review item " + item.getId() + " belongs to another user");
            }
            violationId = item.getViolationId();
        }
        if (request.strikeId() != null) {
            Strike strike = strikeRepository.findById(request.strikeId())
                    .orElseThrow(() -> new ResourceNotFoundException("Strike not found: " + request.strikeId()));
            if (!strike.getUserId().equals(request.userId())) {
                throw new ModerationValidationException("Strike " + strike.getId() + " belongs to another user");
            }
        }

        AdminPenalty penalty = penaltyRepository.save(AdminPenalty.create(
                request.userId(),
                request.adminId(),
                request.severity(),
                request.category(),
                request.reason(),
                request.durationHours(),
                request.evidenceLink(),
                request.policyReference(),
                request.reviewItemId(),
                violationId,
                request.strikeId(),
                clock.instant()));

        auditService.record(EventType.PENALTY_APPLIED, request.adminId(), ActorType.ADMIN,
                request.userId(), penalty.getId(), "AdminPenalty",
                request.severity() + " " + request.category() + ": " + request.reason());

        String body = penalty.getSeverity() == Severity.PERMANENT
                ? "Your account has been permanently suspended: " + request.reason() + "."
                : "Your account has been suspended for " + request.durationHours() + " hours: " + request.reason() + ".";
        if (appealPolicy.isAppealable(penalty)) {
            body = appealPolicy.withAppealHint(body, penalty.getCategory(), false);
        }
        notificationPublisher.publish(new NotificationIntent(request.userId(), NotificationType.BAN_APPLIED,
                "Account suspended", body, Map.of("penaltyId", penalty.getId().toString())));
        log.info("{} penalty {} applied to user {} by admin {}",
                penalty.getSeverity(), penalty.getId(), request.userId(), request.adminId());
        return penalty;
    }

    @Transactional
    public AdminPenalty deactivatePenalty(UUID penaltyId, UUID adminId, String reason) {
        AdminPenalty penalty = getPenalty(penaltyId);
        if (!penalty.isActive()) {
            throw new ModerationValidationException("Penalty already inactive: " + penaltyId);
        }
        penalty.deactivate(reason, clock.instant());
        penaltyRepository.save(penalty);
        auditService.record(EventType.PENALTY_DEACTIVATED, adminId, ActorType.ADMIN,
                penalty.getUserId(), penaltyId, "AdminPenalty", reason);
        return penalty;
    }

    public AdminPenalty getPenalty(UUID penaltyId) {
        return penaltyRepository.findById(penaltyId)
                .orElseThrow(() -> new ResourceNotFoundException("Penalty not found: " + penaltyId));
    }

    public List<AdminPenalty> getActivePenalties(UUID userId) {
        return penaltyRepository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId).stream()
                .filter(p -> !p.isExpired(clock.instant()))
                .toList();
    }

    public boolean isSuspended(UUID userId) {
        return !getActivePenalties(userId).isEmpty();
    }

    private static void validate(PenaltyRequest request) {
        if (request.userId() == null || request.adminId() == null) {
            throw new ModerationValidationException("User and admin ids are required");
        }
        if (request.severity() == null || request.category() == null) {
            throw new ModerationValidationException("Severity and category are required");
        }
        if (request.reason() == null || request.reason().isBlank()) {
            throw new ModerationValidationException("A reason is required");
        }
        if (request.severity() == Severity.TEMPORARY
                && (request.durationHours() == null
                    || !AdminPenalty.ALLOWED_TEMPORARY_HOURS.contains(request.durationHours()))) {
            throw new ModerationValidationException("Temporary penalties must last 24, 168 or 720 hours");
        }
    }

    // DTOs
    public record PenaltyRequest(
            UUID reviewItemId,
            UUID userId,
            UUID adminId,
            Severity severity,
            PolicyCategory category,
            String reason,
            Integer durationHours,
            String evidenceLink,
            String policyReference,
            UUID strikeId
    ) {}
}
