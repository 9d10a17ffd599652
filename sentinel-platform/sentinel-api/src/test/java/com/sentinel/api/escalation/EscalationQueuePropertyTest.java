package com.sentinel.api.escalation;

import com.sentinel.api.classifier.ClassificationScores;
import com.sentinel.api.classifier.RiskCategory;
import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.enforcement.EnforcementResult;
import com.sentinel.api.enforcement.EnforcementService;
import com.sentinel.api.enforcement.ModerationService;
import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.error.ErrorKind;
import com.sentinel.api.error.OperationResult;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import com.sentinel.core.domain.ModeratorReviewItem.SourceType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.ViolationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * Review queue transitions: PENDING moves once, enqueueing is idempotent per violation,
 * admin escalation needs a qualifying category.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class EscalationQueuePropertyTest {

    @Autowired
    private EscalationQueueService queueService;

    @Autowired
    private EnforcementService enforcementService;

    @Autowired
    private ModerationService moderationService;

    @Autowired
    private RestrictionService restrictionService;

    @Autowired
    private ViolationRepository violationRepository;

    @Autowired
    private MutableClock clock;

    private UUID userId;
    private UUID streamId;
    private UUID moderatorId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        userId = UUID.randomUUID();
        streamId = UUID.randomUUID();
        moderatorId = UUID.randomUUID();
    }

    // ==================== Enqueue ====================

    @Test
    void enqueueIsIdempotentPerViolation() {
        ModeratorReviewItem first = escalatedItem(RiskCategory.TOXICITY);
        Violation violation = violationRepository.findById(first.getViolationId()).orElseThrow();

        for (int n = 0; n < 3; n++) {
            ModeratorReviewItem again = queueService.enqueue(violation, SourceType.CHAT_MESSAGE, violation.getCategory());
            assertThat(again.getId()).isEqualTo(first.getId());
        }
    }

    @Test
    void concurrentEnqueueYieldsOneItem() throws Exception {
        ModeratorReviewItem existing = escalatedItem(RiskCategory.THREAT);
        Violation violation = violationRepository.findById(existing.getViolationId()).orElseThrow();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<UUID>> tasks = new ArrayList<>();
            for (int n = 0; n < 8; n++) {
                tasks.add(() -> queueService.enqueue(violation, SourceType.CHAT_MESSAGE, PolicyCategory.THREAT).getId());
            }
            for (Future<UUID> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(existing.getId());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    // ==================== Decisions ====================

    @Test
    void approveResolvesViolationAndIsTerminal() {
        ModeratorReviewItem item = escalatedItem(RiskCategory.TOXICITY);

        OperationResult<ModeratorReviewItem> approved =
                moderationService.moderatorDecide(item.getId(), ModeratorDecision.APPROVE, moderatorId, "fine", null);
        assertThat(approved.success()).isTrue();
        assertThat(approved.value().getStatus()).isEqualTo(ReviewStatus.APPROVED);
        assertThat(violationRepository.findById(item.getViolationId()).orElseThrow().isResolved()).isTrue();

        OperationResult<ModeratorReviewItem> again =
                moderationService.moderatorDecide(item.getId(), ModeratorDecision.REJECT, moderatorId, "changed my mind", null);
        assertThat(again.success()).isFalse();
        assertThat(again.errorKind()).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    void timeoutDecisionValidatesMinutesAndRestricts() {
        ModeratorReviewItem item = escalatedItem(RiskCategory.TOXICITY);

        var missing = queueService.moderatorDecide(item.getId(), ModeratorDecision.TIMEOUT, moderatorId, "x", null);
        var tooShort = queueService.moderatorDecide(item.getId(), ModeratorDecision.TIMEOUT, moderatorId, "x", 3);
        assertThat(missing.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(tooShort.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(queueService.getItem(item.getId()).getStatus()).isEqualTo(ReviewStatus.PENDING);

        var timedOut = queueService.moderatorDecide(item.getId(), ModeratorDecision.TIMEOUT, moderatorId, "cool off", 10);
        assertThat(timedOut.success()).isTrue();
        assertThat(timedOut.value().getStatus()).isEqualTo(ReviewStatus.REJECTED);
        assertThat(restrictionService.isTimedOut(userId, streamId)).isTrue();
    }

    @Test
    void adminEscalationRequiresQualifyingCategory() {
        ModeratorReviewItem mild = escalatedItem(RiskCategory.TOXICITY);
        var blocked = queueService.moderatorDecide(mild.getId(), ModeratorDecision.ESCALATE, moderatorId, "please", null);
        assertThat(blocked.success()).isFalse();
        assertThat(blocked.errorKind()).isEqualTo(ErrorKind.POLICY_BLOCKED);

        ModeratorReviewItem severe = escalatedItem(RiskCategory.THREAT);
        var escalated = queueService.moderatorDecide(severe.getId(), ModeratorDecision.ESCALATE, moderatorId,
                "credible threat", null);
        assertThat(escalated.success()).isTrue();
        assertThat(escalated.value().getStatus()).isEqualTo(ReviewStatus.ESCALATED);
        assertThat(queueService.getAdminEscalationQueue().stream().anyMatch(i -> i.getId().equals(severe.getId()))).isTrue();
    }

    @Test
    void concurrentDecisionsLeaveExactlyOneWinner() throws Exception {
        ModeratorReviewItem item = escalatedItem(RiskCategory.TOXICITY);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<OperationResult<ModeratorReviewItem>>> tasks = new ArrayList<>();
            for (int n = 0; n < 4; n++) {
                ModeratorDecision decision = n % 2 == 0 ? ModeratorDecision.APPROVE : ModeratorDecision.REJECT;
                tasks.add(() -> queueService.moderatorDecide(item.getId(), decision, UUID.randomUUID(), "race", null));
            }
            int winners = 0;
            for (Future<OperationResult<ModeratorReviewItem>> future : pool.invokeAll(tasks)) {
                OperationResult<ModeratorReviewItem> result = future.get();
                if (result.success()) {
                    winners++;
                } else {
                    assertThat(result.errorKind() == ErrorKind.VALIDATION
                            || result.errorKind() == ErrorKind.CONCURRENCY_CONFLICT).as(result.message()).isTrue();
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private ModeratorReviewItem escalatedItem(RiskCategory category) {
        EnforcementResult result = enforcementService.enforce(userId,
                ClassificationScores.dominatedBy(category, 0.65), ScopeContext.stream(streamId));
        assertThat(result.escalationQueued()).isTrue();
        return queueService.getEscalationQueue(ReviewStatus.PENDING).stream()
                .filter(i -> result.violationId().equals(i.getViolationId()))
                .findFirst()
                .orElseThrow();
    }
}
