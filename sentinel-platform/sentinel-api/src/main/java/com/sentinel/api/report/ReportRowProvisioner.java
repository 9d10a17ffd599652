package com.sentinel.api.report;

import com.sentinel.core.domain.HarassmentReportTracker;
import com.sentinel.core.domain.ReviewLockGuard;
import com.sentinel.core.domain.StreamChatState;
import com.sentinel.core.repository.HarassmentReportTrackerRepository;
import com.sentinel.core.repository.ReviewLockGuardRepository;
import com.sentinel.core.repository.StreamChatStateRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates the rows report detectors lock, each in its own transaction.
 * A concurrent creator surfaces as DataIntegrityViolationException to the caller.
 */
@Component
public class ReportRowProvisioner {

    private final StreamChatStateRepository chatStateRepository;
    private final HarassmentReportTrackerRepository trackerRepository;
    private final ReviewLockGuardRepository guardRepository;

    public ReportRowProvisioner(
            StreamChatStateRepository chatStateRepository,
            HarassmentReportTrackerRepository trackerRepository,
            ReviewLockGuardRepository guardRepository) {
        this.chatStateRepository = chatStateRepository;
        this.trackerRepository = trackerRepository;
        this.guardRepository = guardRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureChatState(UUID streamId, UUID creatorId) {
        if (!chatStateRepository.existsById(streamId)) {
            chatStateRepository.saveAndFlush(StreamChatState.create(streamId, creatorId));
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureTracker(UUID reportedUserId, UUID streamId) {
        if (trackerRepository.findByReportedUserIdAndStreamId(reportedUserId, streamId).isEmpty()) {
            trackerRepository.saveAndFlush(HarassmentReportTracker.create(reportedUserId, streamId));
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureReviewGuard(UUID userId) {
        if (!guardRepository.existsById(userId)) {
            guardRepository.saveAndFlush(ReviewLockGuard.create(userId));
        }
    }
}
