package com.sentinel.api.report;

import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.HarassmentReportTracker;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import com.sentinel.core.repository.HarassmentReportTrackerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Harassment reports within one stream. Three distinct reporters against the same
 * user time them out of that stream for 5 minutes, once per (user, stream).
 */
@Service
public class HarassmentReportService {

    private static final Logger log = LoggerFactory.getLogger(HarassmentReportService.class);

    private final HarassmentReportTrackerRepository trackerRepository;
    private final ReportRowProvisioner provisioner;
    private final RestrictionService restrictionService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${sentinel.reports.harassment-threshold:3}")
    private int threshold = 3;

    @Value("${sentinel.reports.harassment-timeout-minutes:5}")
    private long timeoutMinutes = 5;

    public HarassmentReportService(
            HarassmentReportTrackerRepository trackerRepository,
            ReportRowProvisioner provisioner,
            RestrictionService restrictionService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.trackerRepository = trackerRepository;
        this.provisioner = provisioner;
        this.restrictionService = restrictionService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    /**
     * Adds the reporter and applies the automatic timeout when the threshold is first reached.
     *
     * @return the timeout applied by this report, or null
     */
    @Transactional
    public ScopeRestriction recordReport(UUID reportedUserId, UUID streamId, UUID reporterId) {
        HarassmentReportTracker tracker = lockTracker(reportedUserId, streamId);
        int uniqueReporters = tracker.addReporter(reporterId, clock.instant());

        ScopeRestriction timeout = null;
        if (uniqueReporters >= threshold && !tracker.isAutoTimeoutApplied()) {
            timeout = restrictionService.applyTimeout(reportedUserId, streamId, Duration.ofMinutes(timeoutMinutes),
                    RestrictionSource.HARASSMENT_REPORTS,
                    "Reported for harassment by " + uniqueReporters + " users", null, null);
            tracker.markAutoTimeoutApplied(clock.instant());
            notificationPublisher.publish(new NotificationIntent(reportedUserId, NotificationType.TIMEOUT_APPLIED,
                    "Timed out for 5 minutes",
                    "Several people reported you for harassment in this stream, so you cannot chat here for "
                            + timeoutMinutes + " minutes.",
                    Map.of("streamId", streamId.toString())));
            log.info("Harassment auto-timeout for user {} in stream {} after {} reporters",
                    reportedUserId, streamId, uniqueReporters);
        }
        trackerRepository.save(tracker);
        return timeout;
    }

    public int uniqueReporterCount(UUID reportedUserId, UUID streamId) {
        return trackerRepository.findByReportedUserIdAndStreamId(reportedUserId, streamId)
                .map(HarassmentReportTracker::getUniqueReporterCount)
                .orElse(0);
    }

    private HarassmentReportTracker lockTracker(UUID reportedUserId, UUID streamId) {
        var tracker = trackerRepository.findForUpdate(reportedUserId, streamId);
        if (tracker.isPresent()) {
            return tracker.get();
        }
        try {
            provisioner.ensureTracker(reportedUserId, streamId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Harassment tracker for user {} stream {} created concurrently", reportedUserId, streamId);
        }
        return trackerRepository.findForUpdate(reportedUserId, streamId)
                .orElseThrow(() -> new TransientIoException(
                        "Harassment tracker unavailable for " + reportedUserId + "/" + streamId));
    }
}
