package com.sentinel.api.strike;

import com.sentinel.api.appeal.NonAppealablePolicy;
import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.domain.StrikeLedgerHead;
import com.sentinel.core.repository.StrikeLedgerHeadRepository;
import com.sentinel.core.repository.StrikeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Scoped, decaying strike history.
 *
 * A new strike's level is one more than the strikes currently in force for the same
 * (user, scope), capped at 4. Writers for one pair are serialised by locking its
 * ledger head row; different pairs never contend.
 *
 * Level effects: 1 warns, 2 adds a 10-minute scope timeout, 3 bans from the scope
 * for 24 hours, 4 bans from the scope permanently.
 */
@Service
public class StrikeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StrikeLedgerService.class);

    static final Duration LEVEL_TWO_TIMEOUT = Duration.ofMinutes(10);

    private final StrikeRepository strikeRepository;
    private final StrikeLedgerHeadRepository headRepository;
    private final StrikeLedgerHeadProvisioner headProvisioner;
    private final RestrictionService restrictionService;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final NonAppealablePolicy appealPolicy;
    private final Clock clock;

    public StrikeLedgerService(
            StrikeRepository strikeRepository,
            StrikeLedgerHeadRepository headRepository,
            StrikeLedgerHeadProvisioner headProvisioner,
            RestrictionService restrictionService,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            NonAppealablePolicy appealPolicy,
            Clock clock) {
        this.strikeRepository = strikeRepository;
        this.headRepository = headRepository;
        this.headProvisioner = headProvisioner;
        this.restrictionService = restrictionService;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.appealPolicy = appealPolicy;
        this.clock = clock;
    }

    // ==================== Issue ====================

    @Transactional
    public Strike applyStrike(UUID userId, UUID scopeId, PolicyCategory type, String reason) {
        return applyStrike(userId, scopeId, type, reason, false, null);
    }

    /**
     * Issues the next strike for (user, scope) and applies its level effects.
     *
     * @param violationId violation that caused the strike, may be null
     */
    @Transactional
    public Strike applyStrike(
            UUID userId, UUID scopeId, PolicyCategory type, String reason, boolean issuedByAi, UUID violationId) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(scopeId, "scopeId");
        if (type == null) {
            throw new ModerationValidationException("Strike type is required");
        }

        StrikeLedgerHead head = lockHead(userId, scopeId);
        Instant now = clock.instant();
        long inForce = strikeRepository.countInForce(userId, scopeId, now);
        int level = (int) Math.min(inForce + 1, Strike.MAX_LEVEL);

        Strike strike = strikeRepository.save(
                Strike.create(userId, scopeId, level, type, reason, issuedByAi, violationId, now));
        head.recordStrike(now);
        headRepository.save(head);

        applyLevelEffects(strike);
        auditService.record(EventType.STRIKE_ISSUED, null,
                issuedByAi ? ActorType.SYSTEM : ActorType.ADMIN,
                userId, strike.getId(), "Strike", "level " + level + " " + type + ": " + reason);
        log.info("Strike level {} issued to user {} in scope {} ({})", level, userId, scopeId, type);
        return strike;
    }

    private void applyLevelEffects(Strike strike) {
        Map<String, String> payload = Map.of(
                "strikeId", String.valueOf(strike.getId()),
                "scopeId", strike.getScopeId().toString(),
                "level", String.valueOf(strike.getLevel()));
        switch (strike.getLevel()) {
            case 1 -> notify(strike, NotificationType.MODERATION_WARNING, "Warning issued",
                    "You received a warning for " + describe(strike.getType()) + ".", payload);
            case 2 -> {
                restrictionService.applyTimeout(strike.getUserId(), strike.getScopeId(), LEVEL_TWO_TIMEOUT,
                        RestrictionSource.STRIKE_LEDGER, "Second strike: " + strike.getReason(),
                        strike.getViolationId(), strike.getId());
                notify(strike, NotificationType.TIMEOUT_APPLIED, "Timed out for 10 minutes",
                        "You received a second strike for " + describe(strike.getType())
                                + " and cannot chat here for 10 minutes.", payload);
            }
            case 3 -> notify(strike, NotificationType.BAN_APPLIED, "Banned for 24 hours",
                    "You received a third strike for " + describe(strike.getType())
                            + " and are banned from this space for 24 hours.", payload);
            default -> notify(strike, NotificationType.BAN_APPLIED, "Permanently banned",
                    "You received a fourth strike for " + describe(strike.getType())
                            + " and are permanently banned from this space.", payload);
        }
    }

    private void notify(Strike strike, NotificationType type, String title, String body, Map<String, String> payload) {
        String text = strike.getLevel() == 1
                ? body
                : appealPolicy.withAppealHint(body, strike.getType(), strike.isPermanent());
        notificationPublisher.publish(new NotificationIntent(strike.getUserId(), type, title, text, payload));
    }

    private static String describe(PolicyCategory category) {
        return category.name().toLowerCase().replace('_', ' ');
    }

    private StrikeLedgerHead lockHead(UUID userId, UUID scopeId) {
        var head = headRepository.findForUpdate(userId, scopeId);
        if (head.isPresent()) {
            return head.get();
        }
        try {
            headProvisioner.ensureExists(userId, scopeId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Ledger head for user {} scope {} created concurrently", userId, scopeId);
        }
        return headRepository.findForUpdate(userId, scopeId)
                .orElseThrow(() -> new TransientIoException("Ledger head unavailable for " + userId + "/" + scopeId));
    }

    // ==================== Revoke ====================

    /**
     * Deactivates a strike and lifts restrictions it created. Reserved for admins and
     * approved appeals.
     */
    @Transactional
    public Strike revokeStrike(UUID strikeId, UUID actorId, ActorType actorType, String reason) {
        Strike strike = strikeRepository.findById(strikeId)
                .orElseThrow(() -> new ResourceNotFoundException("Strike not found: " + strikeId));
        lockHead(strike.getUserId(), strike.getScopeId());
        if (!strike.isActive()) {
            throw new ModerationValidationException("Strike already revoked: " + strikeId);
        }
        strike.revoke(reason, clock.instant());
        strikeRepository.save(strike);
        restrictionService.liftForStrike(strikeId, "Strike revoked: " + reason);
        auditService.record(EventType.STRIKE_REVOKED, actorId, actorType, strike.getUserId(),
                strikeId, "Strike", reason);
        log.info("Strike {} revoked for user {} in scope {}", strikeId, strike.getUserId(), strike.getScopeId());
        return strike;
    }

    // ==================== Queries ====================

    /**
     * True iff the user holds an active level 4 strike, or an active level 3 strike that
     * has not expired, for exactly this scope.
     */
    public boolean isBanned(UUID userId, UUID scopeId) {
        return strikeRepository.existsBanningStrike(userId, scopeId, clock.instant());
    }

    public List<Strike> getActiveStrikes(UUID userId, UUID scopeId) {
        return strikeRepository.findInForce(userId, scopeId, clock.instant());
    }

    public List<Strike> getStrikeHistory(UUID userId) {
        return strikeRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public Strike getStrike(UUID strikeId) {
        return strikeRepository.findById(strikeId)
                .orElseThrow(() -> new ResourceNotFoundException("Strike not found: " + strikeId));
    }
}
