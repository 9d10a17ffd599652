package com.sentinel.api.enforcement;

import com.sentinel.api.appeal.NonAppealablePolicy;
import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.classifier.CategoryWeights;
import com.sentinel.api.classifier.ClassificationService;
import com.sentinel.api.classifier.ClassificationService.ClassificationOutcome;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.OperationResult;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.escalation.AdminPenaltyService;
import com.sentinel.api.escalation.EscalationQueueService;
import com.sentinel.api.escalation.ModeratorDecision;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.api.ratewindow.SpamDetector;
import com.sentinel.api.ratewindow.SpamDetector.SpamCheck;
import com.sentinel.api.report.ForcedReviewService;
import com.sentinel.api.strike.StrikeLedgerService;
import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeType;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.AdminPenaltyRepository;
import com.sentinel.core.repository.ScopeRestrictionRepository;
import com.sentinel.core.repository.StrikeRepository;
import com.sentinel.core.repository.ViolationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Facade over the moderation pipeline: access checks, spam counting, classification
 * and enforcement, plus the admin operations that span several components.
 */
@Service
public class ModerationService {

    private final ClassificationService classificationService;
    private final EnforcementService enforcementService;
    private final SpamDetector spamDetector;
    private final StrikeLedgerService strikeLedgerService;
    private final RestrictionService restrictionService;
    private final AdminPenaltyService adminPenaltyService;
    private final ForcedReviewService forcedReviewService;
    private final EscalationQueueService escalationQueueService;
    private final NonAppealablePolicy appealPolicy;
    private final ViolationRepository violationRepository;
    private final StrikeRepository strikeRepository;
    private final ScopeRestrictionRepository restrictionRepository;
    private final AdminPenaltyRepository penaltyRepository;
    private final ModerationAuditService auditService;
    private final Clock clock;

    public ModerationService(
            ClassificationService classificationService,
            EnforcementService enforcementService,
            SpamDetector spamDetector,
            StrikeLedgerService strikeLedgerService,
            RestrictionService restrictionService,
            AdminPenaltyService adminPenaltyService,
            ForcedReviewService forcedReviewService,
            EscalationQueueService escalationQueueService,
            NonAppealablePolicy appealPolicy,
            ViolationRepository violationRepository,
            StrikeRepository strikeRepository,
            ScopeRestrictionRepository restrictionRepository,
            AdminPenaltyRepository penaltyRepository,
            ModerationAuditService auditService,
            Clock clock) {
        this.classificationService = classificationService;
        this.enforcementService = enforcementService;
        this.spamDetector = spamDetector;
        this.strikeLedgerService = strikeLedgerService;
        this.restrictionService = restrictionService;
        this.adminPenaltyService = adminPenaltyService;
        this.forcedReviewService = forcedReviewService;
        this.escalationQueueService = escalationQueueService;
        this.appealPolicy = appealPolicy;
        this.violationRepository = violationRepository;
        this.strikeRepository = strikeRepository;
        this.restrictionRepository = restrictionRepository;
        this.penaltyRepository = penaltyRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    // ==================== Content ====================

    public EnforcementResult classifyAndEnforce(UUID userId, String text, ScopeContext context) {
        return classifyAndEnforce(userId, text, context, CategoryWeights.defaults());
    }

    /**
     * Moderates one piece of content. Users without access to the scope are refused
     * before anything is classified; chat and direct messages also count towards the
     * spam window. Profile fields use {@link ScopeType#PROFILE} and skip spam counting.
     */
    public EnforcementResult classifyAndEnforce(UUID userId, String text, ScopeContext context,
                                                CategoryWeights weights) {
        if (userId == null || context == null) {
            throw new ModerationValidationException("User and scope are required");
        }
        if (text == null || text.isBlank()) {
            throw new ModerationValidationException("Content must not be empty");
        }

        AccessCheck access = checkAccess(userId, context.scopeId());
        if (!access.allowed()) {
            return EnforcementResult.refused(access.action(), access.reason());
        }

        if (context.scopeType() == ScopeType.STREAM || context.scopeType() == ScopeType.MESSAGE) {
            SpamCheck spam = spamDetector.recordMessage(userId, context.scopeId());
            if (spam.tripped()) {
                return EnforcementResult.refused(ModerationAction.TIMEOUT,
                        "You are sending messages too quickly. Wait a minute before chatting again.");
            }
        }

        ClassificationOutcome outcome = classificationService.classify(text, weights);
        return enforcementService.enforce(userId, text, outcome.score(), context, outcome.degraded());
    }

    // ==================== Access ====================

    /**
     * Whether the user may post in the scope, with a user-facing reason when not.
     * Account-wide penalties and review locks are checked before scope restrictions.
     */
    public AccessCheck checkAccess(UUID userId, UUID scopeId) {
        Instant now = clock.instant();

        Optional<AdminPenalty> penalty = adminPenaltyService.getActivePenalties(userId).stream().findFirst();
        if (penalty.isPresent()) {
            AdminPenalty p = penalty.get();
            String message = p.getExpiresAt() == null
                    ? "Your account is permanently suspended: " + p.getReason() + "."
                    : "Your account is suspended until " + p.getExpiresAt() + ": " + p.getReason() + ".";
            return AccessCheck.denied(ModerationAction.BLOCK, appealPolicy.isAppealable(p)
                    ? appealPolicy.withAppealHint(message, p.getCategory(), false)
                    : message);
        }
        if (forcedReviewService.isLocked(userId)) {
            return AccessCheck.denied(ModerationAction.BLOCK,
                    "Your account is paused while our team reviews recent reports.");
        }

        Optional<Strike> ban = strikeRepository.findInForce(userId, scopeId, now).stream()
                .filter(s -> s.isBanning(now))
                .findFirst();
        if (ban.isPresent()) {
            Strike strike = ban.get();
            String message = strike.isPermanent()
                    ? "You are permanently banned from this space."
                    : "You are banned from this space until " + strike.getExpiresAt() + ".";
            return AccessCheck.denied(ModerationAction.BLOCK,
                    appealPolicy.withAppealHint(message, strike.getType(), strike.isPermanent()));
        }

        Optional<ScopeRestriction> restriction = restrictionService.getActiveRestrictions(userId, scopeId).stream()
                .max(Comparator.comparing(r -> r.getKind() == ScopeRestriction.RestrictionKind.BLOCK));
        if (restriction.isPresent()) {
            ScopeRestriction r = restriction.get();
            boolean block = r.getKind() == ScopeRestriction.RestrictionKind.BLOCK;
            String message = block
                    ? "You have been removed from this space: " + r.getReason() + "."
                    : "You are timed out until " + r.getEndsAt() + ": " + r.getReason() + ".";
            return AccessCheck.denied(block ? ModerationAction.BLOCK : ModerationAction.TIMEOUT,
                    appealPolicy.withAppealHint(message, null, false));
        }
        return AccessCheck.ALLOWED;
    }

    // ==================== Moderator and admin ====================

    public OperationResult<ModeratorReviewItem> moderatorDecide(
            UUID itemId, ModeratorDecision decision, UUID moderatorId, String notes, Integer minutes) {
        return escalationQueueService.moderatorDecide(itemId, decision, moderatorId, notes, minutes);
    }

    /**
     * Removes a violation from the user's history. Restrictions it caused are lifted.
     */
    @Transactional
    public Violation deleteViolation(UUID violationId, UUID adminId, String reason) {
        Violation violation = violationRepository.findById(violationId)
                .orElseThrow(() -> new ResourceNotFoundException("Violation not found: " + violationId));
        if (violation.isDeleted()) {
            throw new ModerationValidationException("Violation already deleted: " + violationId);
        }
        violation.softDelete(adminId, clock.instant());
        violationRepository.save(violation);
        restrictionService.liftForViolation(violationId, "Violation deleted by admin");
        auditService.record(EventType.VIOLATION_DELETED, adminId, ActorType.ADMIN, violation.getUserId(),
                violationId, "Violation", reason);
        return violation;
    }

    public List<Violation> getViolations(UUID userId) {
        return violationRepository.findByUserIdAndDeletedFalseOrderByCreatedAtDesc(userId);
    }

    /**
     * Strikes, restrictions and penalties of the user that end within the given horizon,
     * soonest first. Permanent enforcement never appears.
     */
    public List<UpcomingExpiration> getUpcomingExpirations(UUID userId, Duration within) {
        Instant now = clock.instant();
        Instant until = now.plus(within);
        List<UpcomingExpiration> expirations = new ArrayList<>();
        strikeRepository.findExpiringBetween(userId, now, until).forEach(s -> expirations.add(
                new UpcomingExpiration("STRIKE", s.getId(), s.getScopeId(), s.getExpiresAt())));
        restrictionRepository.findEndingBetween(userId, now, until).forEach(r -> expirations.add(
                new UpcomingExpiration(r.getKind().name(), r.getId(), r.getScopeId(), r.getEndsAt())));
        penaltyRepository.findExpiringBetween(userId, now, until).forEach(p -> expirations.add(
                new UpcomingExpiration("PENALTY", p.getId(), null, p.getExpiresAt())));
        expirations.sort(Comparator.comparing(UpcomingExpiration::expiresAt));
        return expirations;
    }

    public boolean isBanned(UUID userId, UUID scopeId) {
        return strikeLedgerService.isBanned(userId, scopeId);
    }

    // DTOs
    public record AccessCheck(boolean allowed, ModerationAction action, String reason) {

        static final AccessCheck ALLOWED = new AccessCheck(true, ModerationAction.ALLOW, null);

        static AccessCheck denied(ModerationAction action, String reason) {
            return new AccessCheck(false, action, reason);
        }
    }

    /**
     * @param kind STRIKE, TIMEOUT, BLOCK or PENALTY
     */
    public record UpcomingExpiration(String kind, UUID id, UUID scopeId, Instant expiresAt) {}
}
