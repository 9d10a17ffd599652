package com.sentinel.api.report;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.error.ModerationValidationException;
import com.sentinel.api.error.PolicyBlockedException;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.MassReportEvent;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.StreamChatState;
import com.sentinel.core.repository.MassReportEventRepository;
import com.sentinel.core.repository.StreamChatStateRepository;
import com.sentinel.core.repository.UserReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mass-report lockdown. When 15 or more distinct users report a stream within the
 * trailing 60 seconds, chat is hidden and the creator is asked to review. The
 * lockdown lasts until the creator acknowledges it.
 */
@Service
public class MassReportLockdownService {

    private static final Logger log = LoggerFactory.getLogger(MassReportLockdownService.class);

    private final MassReportEventRepository eventRepository;
    private final StreamChatStateRepository chatStateRepository;
    private final UserReportRepository reportRepository;
    private final ReportRowProvisioner provisioner;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${sentinel.reports.mass-report-threshold:15}")
    private int threshold = 15;

    @Value("${sentinel.reports.mass-report-window-seconds:60}")
    private long windowSeconds = 60;

    public MassReportLockdownService(
            MassReportEventRepository eventRepository,
            StreamChatStateRepository chatStateRepository,
            UserReportRepository reportRepository,
            ReportRowProvisioner provisioner,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.eventRepository = eventRepository;
        this.chatStateRepository = chatStateRepository;
        this.reportRepository = reportRepository;
        this.provisioner = provisioner;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    /**
     * Records who owns a stream so lockdown notices reach them and only they can acknowledge.
     * The first owner recorded wins.
     */
    @Transactional
    public StreamChatState registerStream(UUID streamId, UUID creatorId) {
        StreamChatState state = lockState(streamId, creatorId);
        state.assignCreator(creatorId);
        return chatStateRepository.save(state);
    }

    /**
     * Evaluates the stream's trailing report window. Creates at most one unresolved
     * event per stream: checks for the same stream are serialised on its chat state row.
     * Reports filed before the last acknowledged lockdown do not count again.
     */
    @Transactional
    public LockdownStatus checkMassReportLockdown(UUID streamId) {
        StreamChatState state = lockState(streamId, null);
        var open = eventRepository.findFirstByStreamIdAndResolvedAtIsNullOrderByTriggeredAtDesc(streamId);
        if (open.isPresent()) {
            return new LockdownStatus(true, false, open.get(), open.get().getUniqueReporterIds().size());
        }

        Instant now = clock.instant();
        Instant since = countingFrom(streamId, now.minus(Duration.ofSeconds(windowSeconds)));
        List<UUID> reporters = reportRepository.findDistinctReportersForStream(streamId, since, now);
        if (reporters.size() < threshold) {
            return new LockdownStatus(false, false, null, reporters.size());
        }

        int reportCount = (int) reportRepository.countForStream(streamId, since, now);
        MassReportEvent event = eventRepository.save(
                MassReportEvent.create(streamId, new HashSet<>(reporters), reportCount, now));
        state.hideChat(now);
        chatStateRepository.save(state);

        auditService.recordSystem(EventType.LOCKDOWN_TRIGGERED, state.getCreatorId(), event.getId(),
                "MassReportEvent", reporters.size() + " unique reporters in " + windowSeconds + "s");
        if (state.getCreatorId() != null) {
            notificationPublisher.publish(new NotificationIntent(state.getCreatorId(), NotificationType.STREAM_LOCKDOWN,
                    "Chat paused",
                    "Your stream received many reports in a short time, so chat has been hidden. "
                            + "Review the reports and acknowledge to turn chat back on.",
                    Map.of("streamId", streamId.toString(), "eventId", event.getId().toString())));
        } else {
            log.warn("Stream {} locked down with no known creator to notify", streamId);
        }
        log.warn("Mass report lockdown on stream {}: {} unique reporters", streamId, reporters.size());
        return new LockdownStatus(true, true, event, reporters.size());
    }

    /**
     * Ends a lockdown. Only the stream's registered creator may acknowledge.
     */
    @Transactional
    public MassReportEvent acknowledge(UUID eventId, UUID creatorId) {
        MassReportEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Lockdown event not found: " + eventId));
        StreamChatState state = lockState(event.getStreamId(), null);
        if (state.getCreatorId() == null) {
            throw new PolicyBlockedException("Stream " + event.getStreamId() + " has no registered creator");
        }
        if (!state.getCreatorId().equals(creatorId)) {
            throw new PolicyBlockedException("Only the stream creator can acknowledge a lockdown");
        }
        if (event.isResolved()) {
            throw new ModerationValidationException("Lockdown " + eventId + " is already resolved");
        }
        Instant now = clock.instant();
        event.acknowledge(creatorId, now);
        eventRepository.save(event);
        state.showChat(now);
        chatStateRepository.save(state);
        auditService.record(EventType.LOCKDOWN_ACKNOWLEDGED, creatorId, ActorType.USER, creatorId,
                eventId, "MassReportEvent", "chat restored on stream " + event.getStreamId());
        log.info("Lockdown {} on stream {} acknowledged by {}", eventId, event.getStreamId(), creatorId);
        return event;
    }

    public boolean isChatHidden(UUID streamId) {
        return chatStateRepository.findById(streamId).map(StreamChatState::isChatHidden).orElse(false);
    }

    public List<MassReportEvent> getOpenLockdowns() {
        return eventRepository.findByResolvedAtIsNullOrderByTriggeredAtAsc();
    }

    public List<MassReportEvent> getLockdownHistory(UUID streamId) {
        return eventRepository.findByStreamIdOrderByTriggeredAtDesc(streamId);
    }

    private Instant countingFrom(UUID streamId, Instant windowStart) {
        return eventRepository.findFirstByStreamIdAndResolvedAtIsNotNullOrderByResolvedAtDesc(streamId)
                .map(MassReportEvent::getResolvedAt)
                .filter(resolvedAt -> resolvedAt.isAfter(windowStart))
                .orElse(windowStart);
    }

    private StreamChatState lockState(UUID streamId, UUID creatorId) {
        var state = chatStateRepository.findForUpdate(streamId);
        if (state.isPresent()) {
            return state.get();
        }
        try {
            provisioner.ensureChatState(streamId, creatorId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Chat state for stream {} created concurrently", streamId);
        }
        return chatStateRepository.findForUpdate(streamId)
                .orElseThrow(() -> new TransientIoException("Chat state unavailable for stream " + streamId));
    }

    /**
     * @param triggered      true while the stream has an unresolved lockdown
     * @param newlyTriggered true only for the check that created the event
     * @param event          the unresolved event, null when not locked down
     */
    public record LockdownStatus(boolean triggered, boolean newlyTriggered, MassReportEvent event, int uniqueReporters) {}
}
