package com.sentinel.api.report;

import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.enforcement.ModerationService;
import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.escalation.EscalationQueueService;
import com.sentinel.api.report.ReportIntakeService.ReportOutcome;
import com.sentinel.api.report.ReportIntakeService.ReportRequest;
import com.sentinel.core.domain.ModeratorReviewItem.SourceType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class ReportIntakePropertyTest {

    @Autowired
    private ReportIntakeService reportIntakeService;

    @Autowired
    private HarassmentReportService harassmentReportService;

    @Autowired
    private ForcedReviewService forcedReviewService;

    @Autowired
    private EscalationQueueService queueService;

    @Autowired
    private RestrictionService restrictionService;

    @Autowired
    private ModerationService moderationService;

    @Autowired
    private MutableClock clock;

    private UUID reportedUserId;
    private UUID streamId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        reportedUserId = UUID.randomUUID();
        streamId = UUID.randomUUID();
    }

    // ==================== Validation ====================

    @Test
    void invalidReportsAreRejected() {
        UUID reporter = UUID.randomUUID();
        assertThatThrownBy(() -> reportIntakeService.submitReport(
                new ReportRequest(reporter, reporter, null, PolicyCategory.SPAM, null))).isInstanceOf(ModerationValidationException.class);
        assertThatThrownBy(() -> reportIntakeService.submitReport(
                new ReportRequest(reporter, reportedUserId, null, null, null))).isInstanceOf(ModerationValidationException.class);
        assertThatThrownBy(() -> reportIntakeService.submitReport(
                new ReportRequest(reporter, reportedUserId, null, PolicyCategory.SPAM, "x".repeat(1001)))).isInstanceOf(ModerationValidationException.class);
        assertThat(reportIntakeService.getReportsAgainst(reportedUserId)).isEmpty();
    }

    @Test
    void reportSeverityFollowsCategory() {
        ReportOutcome threat = file(UUID.randomUUID(), PolicyCategory.THREAT, null);
        ReportOutcome spam = file(UUID.randomUUID(), PolicyCategory.SPAM, null);

        assertThat(threat.report().getSeverity()).isEqualTo(3);
        assertThat(spam.report().getSeverity()).isEqualTo(1);
        assertThat(threat.lockdown()).as("no stream, no lockdown check").isNull();
    }

    // ==================== Harassment auto-timeout ====================

    @Test
    void thirdUniqueHarassmentReporterTimesOutOnce() {
        UUID first = UUID.randomUUID();
        assertThat(file(first, PolicyCategory.HARASSMENT, streamId).harassmentTimeout()).isNull();
        assertThat(file(first, PolicyCategory.HARASSMENT, streamId).harassmentTimeout()).as("same reporter again").isNull();
        assertThat(file(UUID.randomUUID(), PolicyCategory.HARASSMENT, streamId).harassmentTimeout()).isNull();
        assertThat(harassmentReportService.uniqueReporterCount(reportedUserId, streamId)).isEqualTo(2);

        ReportOutcome third = file(UUID.randomUUID(), PolicyCategory.HARASSMENT, streamId);
        assertThat(third.harassmentTimeout()).isNotNull();
        assertThat(third.harassmentTimeout().getSource()).isEqualTo(RestrictionSource.HARASSMENT_REPORTS);
        assertThat(Duration.between(third.harassmentTimeout().getStartsAt(), third.harassmentTimeout().getEndsAt())).isEqualTo(Duration.ofMinutes(5));
        assertThat(restrictionService.isTimedOut(reportedUserId, streamId)).isTrue();

        assertThat(file(UUID.randomUUID(), PolicyCategory.HARASSMENT, streamId).harassmentTimeout()).as("auto-timeout fires once per user and stream").isNull();
        assertThat(restrictionService.isTimedOut(reportedUserId, UUID.randomUUID())).isFalse();
    }

    @Test
    void nonHarassmentReportsDoNotTrack() {
        for (int n = 0; n < 4; n++) {
            file(UUID.randomUUID(), PolicyCategory.TOXICITY, streamId);
        }
        assertThat(harassmentReportService.uniqueReporterCount(reportedUserId, streamId)).isEqualTo(0);
        assertThat(restrictionService.isTimedOut(reportedUserId, streamId)).isFalse();
    }

    // ==================== Forced review ====================

    @Test
    void sixReportsInThreeDaysLockAccountForReview() {
        for (int n = 0; n < 5; n++) {
            assertThat(file(UUID.randomUUID(), PolicyCategory.IMPERSONATION, null).reviewLock()).isNull();
            clock.advance(Duration.ofHours(12));
        }
        ReportOutcome sixth = file(UUID.randomUUID(), PolicyCategory.IMPERSONATION, null);

        assertThat(sixth.reviewLock()).isNotNull();
        assertThat(sixth.reviewLock().getReportCount()).isEqualTo(6);
        assertThat(forcedReviewService.isLocked(reportedUserId)).isTrue();
        assertThat(moderationService.checkAccess(reportedUserId, UUID.randomUUID()).allowed()).isFalse();
        assertThat(queueService.getEscalationQueue(null).stream().anyMatch(i ->
                reportedUserId.equals(i.getUserId()) && i.getSourceType() == SourceType.BEHAVIOR_PATTERN)).isTrue();

        assertThat(file(UUID.randomUUID(), PolicyCategory.IMPERSONATION, null).reviewLock()).as("an active lock is not duplicated").isNull();
    }

    @Test
    void concurrentReportsPastThresholdLockAccountOnce() throws Exception {
        for (int n = 0; n < 5; n++) {
            file(UUID.randomUUID(), PolicyCategory.SPAM, null);
        }

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Callable<ReportOutcome>> tasks = new ArrayList<>();
            for (int n = 0; n < 6; n++) {
                tasks.add(() -> file(UUID.randomUUID(), PolicyCategory.SPAM, null));
            }
            int locksCreated = 0;
            for (Future<ReportOutcome> future : pool.invokeAll(tasks)) {
                if (future.get().reviewLock() != null) {
                    locksCreated++;
                }
            }
            assertThat(locksCreated).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(forcedReviewService.getActiveLocks())
                .filteredOn(lock -> reportedUserId.equals(lock.getUserId()))
                .hasSize(1);
        assertThat(queueService.getEscalationQueue(null))
                .filteredOn(item -> reportedUserId.equals(item.getUserId())
                        && item.getSourceType() == SourceType.BEHAVIOR_PATTERN)
                .hasSize(1);
    }

    @Test
    void oldReportsFallOutOfReviewWindow() {
        for (int n = 0; n < 5; n++) {
            file(UUID.randomUUID(), PolicyCategory.SPAM, null);
        }
        clock.advance(Duration.ofDays(3));

        assertThat(file(UUID.randomUUID(), PolicyCategory.SPAM, null).reviewLock()).isNull();
        assertThat(forcedReviewService.isLocked(reportedUserId)).isFalse();
    }

    @Test
    void adminUnlockRestoresAccess() {
        for (int n = 0; n < 6; n++) {
            file(UUID.randomUUID(), PolicyCategory.OTHER, null);
        }
        assertThat(forcedReviewService.isLocked(reportedUserId)).isTrue();

        forcedReviewService.unlock(reportedUserId, UUID.randomUUID());

        assertThat(forcedReviewService.isLocked(reportedUserId)).isFalse();
        assertThat(moderationService.checkAccess(reportedUserId, UUID.randomUUID()).allowed()).isTrue();
        assertThatThrownBy(() -> forcedReviewService.unlock(reportedUserId, UUID.randomUUID())).isInstanceOf(ResourceNotFoundException.class);
    }

    private ReportOutcome file(UUID reporterId, PolicyCategory category, UUID stream) {
        return reportIntakeService.submitReport(new ReportRequest(reporterId, reportedUserId, stream, category, null));
    }
}
