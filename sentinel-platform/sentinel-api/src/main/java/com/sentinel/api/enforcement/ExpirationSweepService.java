package com.sentinel.api.enforcement;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.repository.AdminPenaltyRepository;
import com.sentinel.core.repository.ScopeRestrictionRepository;
import com.sentinel.core.repository.StrikeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Periodic cleanup of enforcement that has run its course. Expired penalties and
 * lapsed restrictions are deactivated; users are told when a penalty or a 24-hour
 * scope ban ends. Strikes decay by their expiry timestamp and need no write.
 */
@Service
public class ExpirationSweepService {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweepService.class);

    private final AdminPenaltyRepository penaltyRepository;
    private final ScopeRestrictionRepository restrictionRepository;
    private final StrikeRepository strikeRepository;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    public ExpirationSweepService(
            AdminPenaltyRepository penaltyRepository,
            ScopeRestrictionRepository restrictionRepository,
            StrikeRepository strikeRepository,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.penaltyRepository = penaltyRepository;
        this.restrictionRepository = restrictionRepository;
        this.strikeRepository = strikeRepository;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${sentinel.sweep.interval-ms:300000}",
               initialDelayString = "${sentinel.sweep.initial-delay-ms:60000}")
    public void scheduledSweep() {
        try {
            SweepResult result = sweep();
            if (result.total() > 0) {
                log.info("Expiry sweep: {} penalties, {} restrictions, {} scope bans ended",
                        result.penaltiesExpired(), result.restrictionsLapsed(), result.scopeBansEnded());
            }
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /**
     * Runs one sweep. Each ended scope ban is announced once: the strike is marked in
     * the same transaction that publishes the notice.
     */
    @Transactional
    public SweepResult sweep() {
        Instant now = clock.instant();

        List<AdminPenalty> expired = penaltyRepository.findExpired(now);
        for (AdminPenalty penalty : expired) {
            penalty.deactivate("Expired", now);
            penaltyRepository.save(penalty);
            auditService.recordSystem(EventType.PENALTY_EXPIRED, penalty.getUserId(), penalty.getId(),
                    "AdminPenalty", penalty.getDurationHours() + "h penalty ended");
            notificationPublisher.publish(new NotificationIntent(penalty.getUserId(), NotificationType.BAN_EXPIRED,
                    "Suspension ended",
                    "Your account suspension has ended. Please keep following the community guidelines.",
                    Map.of("penaltyId", penalty.getId().toString())));
        }

        List<ScopeRestriction> lapsed = restrictionRepository.findLapsed(now);
        for (ScopeRestriction restriction : lapsed) {
            restriction.lift("Expired", now);
            restrictionRepository.save(restriction);
        }

        List<Strike> ended = strikeRepository.findUnannouncedEndedScopeBans(now);
        for (Strike strike : ended) {
            strike.markBanEndNotified(now);
            strikeRepository.save(strike);
            notificationPublisher.publish(new NotificationIntent(strike.getUserId(), NotificationType.BAN_EXPIRED,
                    "Ban ended",
                    "Your 24-hour ban from this space has ended.",
                    Map.of("strikeId", strike.getId().toString(), "scopeId", strike.getScopeId().toString())));
        }
        return new SweepResult(expired.size(), lapsed.size(), ended.size());
    }

    public record SweepResult(int penaltiesExpired, int restrictionsLapsed, int scopeBansEnded) {

        public int total() {
            return penaltiesExpired + restrictionsLapsed + scopeBansEnded;
        }
    }
}
