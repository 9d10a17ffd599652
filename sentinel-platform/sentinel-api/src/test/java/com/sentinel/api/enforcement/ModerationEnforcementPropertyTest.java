package com.sentinel.api.enforcement;

import com.sentinel.api.classifier.CategoryWeights;
import com.sentinel.api.classifier.ClassificationScores;
import com.sentinel.api.classifier.RiskCategory;
import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.RecordingNotificationSender;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.api.strike.StrikeLedgerService;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction.RestrictionKind;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.ModeratorReviewItemRepository;
import com.sentinel.core.repository.ViolationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Score to action to persisted enforcement, through the public moderation entry points.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class ModerationEnforcementPropertyTest {

    @Autowired
    private EnforcementService enforcementService;

    @Autowired
    private ModerationService moderationService;

    @Autowired
    private RestrictionService restrictionService;

    @Autowired
    private StrikeLedgerService strikeLedgerService;

    @Autowired
    private ViolationRepository violationRepository;

    @Autowired
    private ModeratorReviewItemRepository reviewRepository;

    @Autowired
    private RecordingNotificationSender sender;

    @Autowired
    private MutableClock clock;

    private UUID userId;
    private UUID streamId;
    private ScopeContext stream;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        userId = UUID.randomUUID();
        streamId = UUID.randomUUID();
        stream = ScopeContext.stream(streamId);
    }

    // ==================== Decision bands ====================

    @Test
    void lowScoreIsAllowedWithoutRecord() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.TOXICITY, 0.10), stream);

        assertThat(result.allowed()).isTrue();
        assertThat(result.action()).isEqualTo(ModerationAction.ALLOW);
        assertThat(result.violationId()).isNull();
        assertThat(violationRepository.findByUserIdAndDeletedFalseOrderByCreatedAtDesc(userId)).isEmpty();
        assertThat(sender.sentTo(userId)).isEmpty();
    }

    @Test
    void flagIsRecordedButNotHiddenOrNotified() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.SPAM, 0.35), stream);

        assertThat(result.allowed()).isTrue();
        assertThat(result.action()).isEqualTo(ModerationAction.FLAG);
        assertThat(result.notified()).isFalse();
        Violation violation = violationRepository.findById(result.violationId()).orElseThrow();
        assertThat(violation.isHiddenFromOthers()).isFalse();
        assertThat(sender.sentTo(userId)).isEmpty();
    }

    @Test
    void midScoreHidesContentAndNotifiesOnce() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.TOXICITY, 0.55), stream);

        assertThat(result.allowed()).isFalse();
        assertThat(result.action()).isEqualTo(ModerationAction.HIDE);
        assertThat(result.strike()).isNull();
        assertThat(result.restriction()).isNull();
        assertThat(result.notified()).isTrue();
        assertThat(result.reason()).contains("appeal");

        Violation violation = violationRepository.findById(result.violationId()).orElseThrow();
        assertThat(violation.isHiddenFromOthers()).isTrue();
        assertThat(violation.getCategory()).isEqualTo(PolicyCategory.TOXICITY);

        var pushes = sender.sentTo(userId);
        assertThat(pushes).hasSize(1);
        assertThat(pushes.get(0).type()).isEqualTo(NotificationType.MODERATION_WARNING);
        assertThat(strikeLedgerService.getActiveStrikes(userId, streamId)).isEmpty();
    }

    @Test
    void escalationBandQueuesPendingReview() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.THREAT, 0.65), stream);

        assertThat(result.action()).isEqualTo(ModerationAction.ESCALATE);
        assertThat(result.escalationQueued()).isTrue();
        ModeratorReviewItem item = reviewRepository.findByViolationId(result.violationId()).orElseThrow();
        assertThat(item.isPending()).isTrue();
        assertThat(item.getUserId()).isEqualTo(userId);
        assertThat(result.reason()).as("escalations point to review, not appeals").doesNotContain("appeal");
    }

    @Test
    void timeoutBandRestrictsForTwoMinutesAndStrikesRepeatOffences() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.HARASSMENT, 0.75), stream);

        assertThat(result.action()).isEqualTo(ModerationAction.TIMEOUT);
        assertThat(result.restriction()).isNotNull();
        assertThat(result.restriction().getKind()).isEqualTo(RestrictionKind.TIMEOUT);
        assertThat(Duration.between(result.restriction().getStartsAt(), result.restriction().getEndsAt())).isEqualTo(Duration.ofMinutes(2));
        assertThat(result.strike()).isNotNull();
        assertThat(result.strike().getLevel()).isEqualTo(1);
        assertThat(result.strike().getType()).isEqualTo(PolicyCategory.HARASSMENT);

        assertThat(restrictionService.isTimedOut(userId, streamId)).isTrue();
        clock.advance(Duration.ofMinutes(2));
        assertThat(restrictionService.isTimedOut(userId, streamId)).isFalse();
    }

    @Test
    void blockBandRemovesFromScopeWithoutStrikeForToxicity() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.TOXICITY, 0.92), stream);

        assertThat(result.action()).isEqualTo(ModerationAction.BLOCK);
        assertThat(result.restriction().getKind()).isEqualTo(RestrictionKind.BLOCK);
        assertThat(result.restriction().getEndsAt()).isNull();
        assertThat(result.strike()).isNull();
        assertThat(sender.sentTo(userId).get(0).type()).isEqualTo(NotificationType.BAN_APPLIED);

        ModerationService.AccessCheck access = moderationService.checkAccess(userId, streamId);
        assertThat(access.allowed()).isFalse();
        assertThat(access.action()).isEqualTo(ModerationAction.BLOCK);
        assertThat(moderationService.checkAccess(userId, UUID.randomUUID()).allowed()).isTrue();
    }

    @Test
    void actionNeverDecreasesAsScoreRises() {
        ModerationAction previous = ModerationAction.ALLOW;
        for (int pct = 0; pct <= 100; pct += 5) {
            UUID user = UUID.randomUUID();
            EnforcementResult result = enforcementService.enforce(user,
                    ClassificationScores.dominatedBy(RiskCategory.SPAM, pct / 100.0), ScopeContext.stream(UUID.randomUUID()));
            assertThat(result.action().isAtLeast(previous)).as(pct + "% gave " + result.action() + " after " + previous).isTrue();
            previous = result.action();
        }
        assertThat(previous).isEqualTo(ModerationAction.BLOCK);
    }

    // ==================== Full pipeline ====================

    @Test
    void classifyAndEnforceBlocksHateSpeechUnderHateOnlyWeights() {
        CategoryWeights hateOnly = CategoryWeights.of(onlyWeight(RiskCategory.HATE_SPEECH));

        EnforcementResult result = moderationService.classifyAndEnforce(userId,
                "you subhuman vermin", stream, hateOnly);

        assertThat(result.action()).isEqualTo(ModerationAction.BLOCK);
        assertThat(result.degraded()).isFalse();
        assertThat(result.strike()).as("hate speech accumulates strikes").isNotNull();
        assertThat(result.strike().getType()).isEqualTo(PolicyCategory.HATE_SPEECH);
    }

    @Test
    void blockedUserIsRefusedBeforeClassification() {
        enforcementService.enforce(userId, ClassificationScores.dominatedBy(RiskCategory.TOXICITY, 0.95), stream);
        int violationsBefore = moderationService.getViolations(userId).size();

        EnforcementResult refused = moderationService.classifyAndEnforce(userId, "hello again", stream);

        assertThat(refused.allowed()).isFalse();
        assertThat(refused.action()).isEqualTo(ModerationAction.BLOCK);
        assertThat(refused.violationId()).isNull();
        assertThat(moderationService.getViolations(userId)).hasSize(violationsBefore);
    }

    @Test
    void emptyContentIsRejected() {
        assertThatThrownBy(() -> moderationService.classifyAndEnforce(userId, "   ", stream)).isInstanceOf(ModerationValidationException.class);
    }

    @Test
    void benignChatPasses() {
        EnforcementResult result = moderationService.classifyAndEnforce(userId, "great stream, thanks!", stream);

        assertThat(result.allowed()).isTrue();
        assertThat(result.action()).isEqualTo(ModerationAction.ALLOW);
    }

    // ==================== Admin ====================

    @Test
    void deletingViolationLiftsItsRestriction() {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(RiskCategory.SPAM, 0.90), stream);
        assertThat(restrictionService.isBlocked(userId, streamId)).isTrue();

        Violation deleted = moderationService.deleteViolation(result.violationId(), UUID.randomUUID(), "false positive");

        assertThat(deleted.isDeleted()).isTrue();
        assertThat(restrictionService.isBlocked(userId, streamId)).isFalse();
        assertThat(moderationService.getViolations(userId)).isEmpty();
        assertThatThrownBy(() -> moderationService.deleteViolation(result.violationId(), UUID.randomUUID(), "again")).isInstanceOf(ModerationValidationException.class);
    }

    @Test
    void upcomingExpirationsAreSortedAndSkipPermanent() {
        enforcementService.enforce(userId, ClassificationScores.dominatedBy(RiskCategory.HARASSMENT, 0.75), stream);
        UUID otherStream = UUID.randomUUID();
        enforcementService.enforce(userId, ClassificationScores.dominatedBy(RiskCategory.TOXICITY, 0.90),
                ScopeContext.stream(otherStream));

        var expirations = moderationService.getUpcomingExpirations(userId, Duration.ofDays(31));

        assertThat(expirations).isNotEmpty();
        for (int i = 1; i < expirations.size(); i++) {
            assertThat(expirations.get(i).expiresAt().isBefore(expirations.get(i - 1).expiresAt())).isFalse();
        }
        assertThat(expirations.stream().noneMatch(e -> e.scopeId() != null && e.scopeId().equals(otherStream))).as("a permanent block has no expiry").isTrue();
        assertThat(expirations.get(0).kind()).isEqualTo("TIMEOUT");
    }

    private static Map<RiskCategory, Double> onlyWeight(RiskCategory kept) {
        Map<RiskCategory, Double> weights = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            weights.put(category, category == kept ? 1.0 : 0.0);
        }
        return weights;
    }
}
