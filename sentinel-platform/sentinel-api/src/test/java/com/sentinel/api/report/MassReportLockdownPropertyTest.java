package com.sentinel.api.report;

import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.RecordingNotificationSender;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.PolicyBlockedException;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.api.report.ReportIntakeService.ReportOutcome;
import com.sentinel.api.report.ReportIntakeService.ReportRequest;
import com.sentinel.core.domain.MassReportEvent;
import com.sentinel.core.domain.PolicyCategory;
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

/**
 * Fifteen unique reporters inside a minute hide a stream's chat once, until the
 * creator acknowledges.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class MassReportLockdownPropertyTest {

    @Autowired
    private ReportIntakeService reportIntakeService;

    @Autowired
    private MassReportLockdownService lockdownService;

    @Autowired
    private RecordingNotificationSender sender;

    @Autowired
    private MutableClock clock;

    private UUID streamId;
    private UUID creatorId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        streamId = UUID.randomUUID();
        creatorId = UUID.randomUUID();
        lockdownService.registerStream(streamId, creatorId);
    }

    @Test
    void fifteenthUniqueReporterTriggersSingleLockdown() {
        for (int n = 1; n < 15; n++) {
            ReportOutcome outcome = report(UUID.randomUUID());
            assertThat(outcome.lockdown().triggered()).as("report " + n).isFalse();
        }
        assertThat(lockdownService.isChatHidden(streamId)).isFalse();

        ReportOutcome fifteenth = report(UUID.randomUUID());
        assertThat(fifteenth.lockdown().newlyTriggered()).isTrue();
        assertThat(fifteenth.lockdown().uniqueReporters()).isEqualTo(15);
        assertThat(lockdownService.isChatHidden(streamId)).isTrue();
        assertThat(sender.sentTo(creatorId).stream().anyMatch(p -> p.type() == NotificationType.STREAM_LOCKDOWN)).isTrue();

        ReportOutcome sixteenth = report(UUID.randomUUID());
        assertThat(sixteenth.lockdown().triggered()).isTrue();
        assertThat(sixteenth.lockdown().newlyTriggered()).isFalse();
        assertThat(sixteenth.lockdown().event().getId()).isEqualTo(fifteenth.lockdown().event().getId());
        assertThat(lockdownService.getLockdownHistory(streamId)).hasSize(1);
    }

    @Test
    void repeatReportsFromOneUserCountOnce() {
        UUID reporter = UUID.randomUUID();
        for (int n = 0; n < 20; n++) {
            report(reporter);
        }
        for (int n = 0; n < 13; n++) {
            report(UUID.randomUUID());
        }
        assertThat(lockdownService.isChatHidden(streamId)).isFalse();
        assertThat(lockdownService.checkMassReportLockdown(streamId).uniqueReporters()).isEqualTo(14);
    }

    @Test
    void reportsOutsideTheTrailingMinuteDoNotCount() {
        for (int n = 0; n < 14; n++) {
            report(UUID.randomUUID());
        }
        clock.advance(Duration.ofSeconds(61));

        assertThat(report(UUID.randomUUID()).lockdown().triggered()).isFalse();
        assertThat(lockdownService.isChatHidden(streamId)).isFalse();
    }

    @Test
    void onlyCreatorCanAcknowledge() {
        MassReportEvent event = triggerLockdown();

        assertThatThrownBy(() -> lockdownService.acknowledge(event.getId(), UUID.randomUUID())).isInstanceOf(PolicyBlockedException.class);
        assertThat(lockdownService.isChatHidden(streamId)).isTrue();

        MassReportEvent acknowledged = lockdownService.acknowledge(event.getId(), creatorId);
        assertThat(acknowledged.getResolvedAt()).isNotNull();
        assertThat(acknowledged.isCreatorAcknowledged()).isTrue();
        assertThat(lockdownService.isChatHidden(streamId)).isFalse();
        assertThat(lockdownService.getOpenLockdowns().stream().noneMatch(e -> e.getId().equals(event.getId()))).isTrue();

        assertThatThrownBy(() -> lockdownService.acknowledge(event.getId(), creatorId)).isInstanceOf(ModerationValidationException.class);
    }

    @Test
    void acknowledgedReportsDoNotCountTowardsTheNextLockdown() {
        MassReportEvent first = triggerLockdown();
        lockdownService.acknowledge(first.getId(), creatorId);

        clock.advance(Duration.ofSeconds(1));
        ReportOutcome afterAck = report(UUID.randomUUID());
        assertThat(afterAck.lockdown().triggered()).isFalse();
        assertThat(afterAck.lockdown().uniqueReporters()).isEqualTo(1);
        assertThat(lockdownService.isChatHidden(streamId)).isFalse();
        assertThat(lockdownService.getLockdownHistory(streamId)).hasSize(1);

        ReportOutcome last = null;
        for (int n = 0; n < 14; n++) {
            last = report(UUID.randomUUID());
        }
        assertThat(last.lockdown().newlyTriggered()).isTrue();
        assertThat(last.lockdown().event().getId()).isNotEqualTo(first.getId());
        assertThat(lockdownService.getLockdownHistory(streamId)).hasSize(2);
    }

    @Test
    void reportedChatterNeverBecomesStreamOwner() {
        UUID unregistered = UUID.randomUUID();
        UUID chatter = UUID.randomUUID();
        reportIntakeService.submitReport(
                new ReportRequest(UUID.randomUUID(), chatter, unregistered, PolicyCategory.HARASSMENT, "spamming slurs"));

        UUID realCreator = UUID.randomUUID();
        lockdownService.registerStream(unregistered, realCreator);
        ReportOutcome last = null;
        for (int n = 0; n < 14; n++) {
            last = reportIntakeService.submitReport(
                    new ReportRequest(UUID.randomUUID(), UUID.randomUUID(), unregistered, PolicyCategory.SPAM, null));
        }
        MassReportEvent event = last.lockdown().event();
        assertThat(last.lockdown().newlyTriggered()).isTrue();

        assertThat(sender.sentTo(chatter)).noneMatch(p -> p.type() == NotificationType.STREAM_LOCKDOWN);
        assertThat(sender.sentTo(realCreator)).anyMatch(p -> p.type() == NotificationType.STREAM_LOCKDOWN);
        assertThatThrownBy(() -> lockdownService.acknowledge(event.getId(), chatter))
                .isInstanceOf(PolicyBlockedException.class);
        assertThat(lockdownService.acknowledge(event.getId(), realCreator).isCreatorAcknowledged()).isTrue();
    }

    @Test
    void lockdownOnStreamWithoutCreatorCannotBeAcknowledgedByAnyone() {
        UUID unregistered = UUID.randomUUID();
        ReportOutcome last = null;
        for (int n = 0; n < 15; n++) {
            last = reportIntakeService.submitReport(
                    new ReportRequest(UUID.randomUUID(), UUID.randomUUID(), unregistered, PolicyCategory.SPAM, null));
        }
        MassReportEvent event = last.lockdown().event();

        assertThatThrownBy(() -> lockdownService.acknowledge(event.getId(), UUID.randomUUID()))
                .isInstanceOf(PolicyBlockedException.class);
        assertThat(lockdownService.isChatHidden(unregistered)).isTrue();
    }

    @Test
    void concurrentReportsCreateOneEvent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ReportOutcome>> tasks = new ArrayList<>();
            for (int n = 0; n < 24; n++) {
                tasks.add(() -> report(UUID.randomUUID()));
            }
            int created = 0;
            for (Future<ReportOutcome> future : pool.invokeAll(tasks)) {
                if (future.get().lockdown().newlyTriggered()) {
                    created++;
                }
            }
            assertThat(created).isEqualTo(1);
            assertThat(lockdownService.getLockdownHistory(streamId)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private MassReportEvent triggerLockdown() {
        ReportOutcome last = null;
        for (int n = 0; n < 15; n++) {
            last = report(UUID.randomUUID());
        }
        assertThat(last.lockdown().newlyTriggered()).isTrue();
        return last.lockdown().event();
    }

    private ReportOutcome report(UUID reporterId) {
        return reportIntakeService.submitReport(
                new ReportRequest(reporterId, UUID.randomUUID(), streamId, PolicyCategory.SPAM, null));
    }
}
