package com.sentinel.api.enforcement;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeRestriction.RestrictionKind;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import com.sentinel.core.repository.ScopeRestrictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Scope-local timeouts and blocks.
 */
@Service
public class RestrictionService {

    private static final Logger log = LoggerFactory.getLogger(RestrictionService.class);

    public static final int MIN_MODERATOR_TIMEOUT_MINUTES = 5;
    public static final int MAX_MODERATOR_TIMEOUT_MINUTES = 60;

    private final ScopeRestrictionRepository restrictionRepository;
    private final ModerationAuditService auditService;
    private final Clock clock;

    public RestrictionService(
            ScopeRestrictionRepository restrictionRepository,
            ModerationAuditService auditService,
            Clock clock) {
        this.restrictionRepository = restrictionRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    // ==================== Apply ====================

    @Transactional
    public ScopeRestriction applyTimeout(
            UUID userId, UUID scopeId, Duration duration, RestrictionSource source,
            String reason, UUID violationId, UUID strikeId) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new ModerationValidationException("Timeout duration must be positive");
        }
        Instant now = clock.instant();
        return save(ScopeRestriction.create(userId, scopeId, RestrictionKind.TIMEOUT, source, reason,
                now, now.plus(duration), violationId, strikeId));
    }

    /**
     * Blocks the user from the scope until lifted, or for {@code duration} when given.
     */
    @Transactional
    public ScopeRestriction applyBlock(
            UUID userId, UUID scopeId, Duration duration, RestrictionSource source,
            String reason, UUID violationId, UUID strikeId) {
        Instant now = clock.instant();
        Instant endsAt = duration == null ? null : now.plus(duration);
        return save(ScopeRestriction.create(userId, scopeId, RestrictionKind.BLOCK, source, reason,
                now, endsAt, violationId, strikeId));
    }

    /**
     * Moderator-issued timeout; the duration must be within [5, 60] minutes.
     */
    @Transactional
    public ScopeRestriction applyModeratorTimeout(
            UUID userId, UUID scopeId, int minutes, String reason, UUID violationId) {
        validateModeratorMinutes(minutes);
        return applyTimeout(userId, scopeId, Duration.ofMinutes(minutes), RestrictionSource.MODERATOR,
                reason, violationId, null);
    }

    public static void validateModeratorMinutes(int minutes) {
        if (minutes < MIN_MODERATOR_TIMEOUT_MINUTES || minutes > MAX_MODERATOR_TIMEOUT_MINUTES) {
            throw new ModerationValidationException(
                    "Timeout must be between 5 and 60 minutes, got " + minutes);
        }
    }

    private ScopeRestriction save(ScopeRestriction restriction) {
        ScopeRestriction saved = restrictionRepository.save(restriction);
        auditService.recordSystem(EventType.RESTRICTION_APPLIED, saved.getUserId(), saved.getId(),
                "ScopeRestriction", saved.getKind() + " by " + saved.getSource() + ": " + saved.getReason());
        log.info("{} applied to user {} in scope {} until {}",
                saved.getKind(), saved.getUserId(), saved.getScopeId(), saved.getEndsAt());
        return saved;
    }

    // ==================== Lift ====================

    @Transactional
    public ScopeRestriction lift(UUID restrictionId, String reason) {
        ScopeRestriction restriction = restrictionRepository.findById(restrictionId)
                .orElseThrow(() -> new ResourceNotFoundException("Restriction not found: " + restrictionId));
        liftOne(restriction, reason);
        return restriction;
    }

    /**
     * Lifts every active restriction created for the violation.
     *
     * @return number of restrictions lifted
     */
    @Transactional
    public int liftForViolation(UUID violationId, String reason) {
        List<ScopeRestriction> restrictions = restrictionRepository.findByViolationIdAndActiveTrue(violationId);
        restrictions.forEach(r -> liftOne(r, reason));
        return restrictions.size();
    }

    @Transactional
    public int liftForStrike(UUID strikeId, String reason) {
        List<ScopeRestriction> restrictions = restrictionRepository.findByStrikeIdAndActiveTrue(strikeId);
        restrictions.forEach(r -> liftOne(r, reason));
        return restrictions.size();
    }

    private void liftOne(ScopeRestriction restriction, String reason) {
        if (!restriction.isActive()) {
            return;
        }
        restriction.lift(reason, clock.instant());
        restrictionRepository.save(restriction);
        auditService.recordSystem(EventType.RESTRICTION_LIFTED, restriction.getUserId(), restriction.getId(),
                "ScopeRestriction", reason);
    }

    // ==================== Queries ====================

    public boolean isTimedOut(UUID userId, UUID scopeId) {
        return restrictionRepository.existsInForce(userId, scopeId, RestrictionKind.TIMEOUT, clock.instant());
    }

    public boolean isBlocked(UUID userId, UUID scopeId) {
        return restrictionRepository.existsInForce(userId, scopeId, RestrictionKind.BLOCK, clock.instant());
    }

    public List<ScopeRestriction> getActiveRestrictions(UUID userId, UUID scopeId) {
        return restrictionRepository.findInForce(userId, scopeId, clock.instant());
    }
}
