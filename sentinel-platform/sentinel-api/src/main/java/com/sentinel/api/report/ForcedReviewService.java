package com.sentinel.api.report;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.error.ResourceNotFoundException;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.api.escalation.EscalationQueueService;
import com.sentinel.api.notification.NotificationIntent;
import com.sentinel.api.notification.NotificationPublisher;
import com.sentinel.api.notification.NotificationType;
import com.sentinel.core.domain.ForcedReviewLock;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ReviewLockGuard;
import com.sentinel.core.repository.ForcedReviewLockRepository;
import com.sentinel.core.repository.ReviewLockGuardRepository;
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
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Locks an account for manual review when it collects too many reports
 * (6 within 3 days by default). Only an admin can unlock it.
 */
@Service
public class ForcedReviewService {

    private static final Logger log = LoggerFactory.getLogger(ForcedReviewService.class);

    private final ForcedReviewLockRepository lockRepository;
    private final UserReportRepository reportRepository;
    private final ReviewLockGuardRepository guardRepository;
    private final ReportRowProvisioner provisioner;
    private final EscalationQueueService escalationQueueService;
    private final ModerationAuditService auditService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Value("${sentinel.reports.review-lock-threshold:6}")
    private int threshold = 6;

    @Value("${sentinel.reports.review-lock-window-days:3}")
    private long windowDays = 3;

    public ForcedReviewService(
            ForcedReviewLockRepository lockRepository,
            UserReportRepository reportRepository,
            ReviewLockGuardRepository guardRepository,
            ReportRowProvisioner provisioner,
            EscalationQueueService escalationQueueService,
            ModerationAuditService auditService,
            NotificationPublisher notificationPublisher,
            Clock clock) {
        this.lockRepository = lockRepository;
        this.reportRepository = reportRepository;
        this.guardRepository = guardRepository;
        this.provisioner = provisioner;
        this.escalationQueueService = escalationQueueService;
        this.auditService = auditService;
        this.notificationPublisher = notificationPublisher;
        this.clock = clock;
    }

    /**
     * Locks the user when recent reports reach the threshold and no lock is active.
     * Evaluations for the same user are serialised on the user's guard row.
     *
     * @return the lock created by this call
     */
    @Transactional
    public Optional<ForcedReviewLock> evaluate(UUID userId, PolicyCategory latestCategory) {
        ReviewLockGuard guard = lockGuard(userId);
        if (lockRepository.existsByUserIdAndActiveTrue(userId)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        long reports = reportRepository.countAgainstUserSince(userId, now.minus(Duration.ofDays(windowDays)));
        if (reports < threshold) {
            return Optional.empty();
        }

        String reason = reports + " reports in " + windowDays + " days";
        ForcedReviewLock lock = lockRepository.save(ForcedReviewLock.create(userId, reason, (int) reports, now));
        guard.recordLock(now);
        guardRepository.save(guard);
        auditService.recordSystem(EventType.REVIEW_LOCK_APPLIED, userId, lock.getId(), "ForcedReviewLock", reason);
        escalationQueueService.enqueueBehavioral(userId, latestCategory,
                "Account locked for review: " + reason, Math.min(1.0, reports / (double) (threshold * 2)));
        notificationPublisher.publish(NotificationIntent.of(userId, NotificationType.REVIEW_LOCK,
                "Account under review",
                "Your account received several reports and is paused while our team reviews it."));
        log.warn("User {} locked for review after {}", userId, reason);
        return Optional.of(lock);
    }

    @Transactional
    public ForcedReviewLock unlock(UUID userId, UUID adminId) {
        List<ForcedReviewLock> active = lockRepository.findByActiveTrueOrderByLockedAtAsc().stream()
                .filter(l -> l.getUserId().equals(userId))
                .toList();
        if (active.isEmpty()) {
            throw new ResourceNotFoundException("No active review lock for user " + userId);
        }
        Instant now = clock.instant();
        active.forEach(l -> {
            l.unlock(adminId, now);
            lockRepository.save(l);
        });
        ForcedReviewLock first = active.get(0);
        auditService.record(EventType.REVIEW_LOCK_RELEASED, adminId, ActorType.ADMIN, userId,
                first.getId(), "ForcedReviewLock", "unlocked");
        log.info("Review lock on user {} released by admin {}", userId, adminId);
        return first;
    }

    public boolean isLocked(UUID userId) {
        return lockRepository.existsByUserIdAndActiveTrue(userId);
    }

    public List<ForcedReviewLock> getActiveLocks() {
        return lockRepository.findByActiveTrueOrderByLockedAtAsc();
    }

    private ReviewLockGuard lockGuard(UUID userId) {
        var guard = guardRepository.findForUpdate(userId);
        if (guard.isPresent()) {
            return guard.get();
        }
        try {
            provisioner.ensureReviewGuard(userId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Review lock guard for user {} created concurrently", userId);
        }
        return guardRepository.findForUpdate(userId)
                .orElseThrow(() -> new TransientIoException("Review lock guard unavailable for user " + userId));
    }
}
