package com.sentinel.api.enforcement;

import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.RecordingNotificationSender;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.api.strike.StrikeLedgerService;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.repository.AdminPenaltyRepository;
import com.sentinel.core.repository.ScopeRestrictionRepository;
import com.sentinel.core.repository.StrikeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class ExpirationSweepServiceTest {

    @Autowired
    private ExpirationSweepService sweepService;

    @Autowired
    private StrikeLedgerService strikeLedgerService;

    @Autowired
    private RestrictionService restrictionService;

    @Autowired
    private RecordingNotificationSender sender;

    @Autowired
    private AdminPenaltyRepository penaltyRepository;

    @Autowired
    private ScopeRestrictionRepository restrictionRepository;

    @Autowired
    private StrikeRepository strikeRepository;

    @Autowired
    private ModerationAuditService auditService;

    @Autowired
    private NotificationPublisher notificationPublisher;

    @Autowired
    private MutableClock clock;

    private UUID userId;
    private UUID scopeId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        userId = UUID.randomUUID();
        scopeId = UUID.randomUUID();
    }

    @Test
    void endedScopeBan_isAnnouncedOnNextSweep() {
        for (int i = 0; i < 3; i++) {
            strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HATE_SPEECH, "slur " + i);
        }
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();

        clock.advance(Duration.ofHours(25));
        ExpirationSweepService.SweepResult result = sweepService.sweep();

        assertThat(result.scopeBansEnded()).isGreaterThanOrEqualTo(1);
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isFalse();
        assertThat(sender.sentTo(userId).stream()
                .filter(p -> p.type() == NotificationType.BAN_EXPIRED)
                .count()).isEqualTo(1);
    }

    @Test
    void scopeBan_isAnnouncedOnlyOnce() {
        for (int i = 0; i < 3; i++) {
            strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "abuse " + i);
        }

        clock.advance(Duration.ofHours(25));
        sweepService.sweep();
        clock.advance(Duration.ofMinutes(5));
        sweepService.sweep();

        assertThat(sender.sentTo(userId).stream()
                .filter(p -> p.type() == NotificationType.BAN_EXPIRED)
                .count()).isEqualTo(1);
    }

    @Test
    void scopeBanEndedBeforeFirstSweep_isStillAnnounced() {
        Strike ban = null;
        for (int i = 0; i < 3; i++) {
            ban = strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HATE_SPEECH, "slur " + i);
        }

        clock.advance(Duration.ofDays(3));
        ExpirationSweepService.SweepResult result = restartedSweepService().sweep();

        assertThat(result.scopeBansEnded()).isGreaterThanOrEqualTo(1);
        assertThat(strikeLedgerService.getStrike(ban.getId()).getBanEndNotifiedAt()).isEqualTo(clock.instant());
        assertThat(sender.sentTo(userId)).filteredOn(p -> p.type() == NotificationType.BAN_EXPIRED).hasSize(1);
    }

    @Test
    void restartedSweeper_doesNotRepeatAnnouncement() {
        for (int i = 0; i < 3; i++) {
            strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "abuse " + i);
        }

        clock.advance(Duration.ofHours(25));
        sweepService.sweep();
        clock.advance(Duration.ofMinutes(5));
        restartedSweepService().sweep();

        assertThat(sender.sentTo(userId)).filteredOn(p -> p.type() == NotificationType.BAN_EXPIRED).hasSize(1);
    }

    @Test
    void lapsedTimeout_isLifted() {
        ScopeRestriction timeout = restrictionService.applyTimeout(userId, scopeId, Duration.ofMinutes(2),
                ScopeRestriction.RestrictionSource.AI_POLICY, "toxic message", null, null);
        assertThat(timeout.isActive()).isTrue();

        clock.advance(Duration.ofMinutes(3));
        ExpirationSweepService.SweepResult result = sweepService.sweep();

        assertThat(result.restrictionsLapsed()).isGreaterThanOrEqualTo(1);
        assertThat(restrictionService.getActiveRestrictions(userId, scopeId)).isEmpty();
    }

    private ExpirationSweepService restartedSweepService() {
        return new ExpirationSweepService(penaltyRepository, restrictionRepository, strikeRepository,
                auditService, notificationPublisher, clock);
    }
}
