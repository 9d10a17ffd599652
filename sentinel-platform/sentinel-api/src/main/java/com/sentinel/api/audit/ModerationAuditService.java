package com.sentinel.api.audit;

import com.sentinel.core.domain.ModerationAuditEntry;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.repository.ModerationAuditEntryRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Append-only moderation history. Entries join the caller's transaction, so an
 * action and its audit entry commit or roll back together.
 */
@Service
public class ModerationAuditService {

    private final ModerationAuditEntryRepository auditRepository;
    private final Clock clock;

    public ModerationAuditService(ModerationAuditEntryRepository auditRepository, Clock clock) {
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    @Transactional
    public ModerationAuditEntry record(
            EventType eventType,
            UUID actorId,
            ActorType actorType,
            UUID subjectUserId,
            UUID resourceId,
            String resourceType,
            String details) {

        return auditRepository.save(ModerationAuditEntry.create(
                eventType,
                actorId,
                actorType,
                subjectUserId,
                resourceId,
                resourceType,
                details,
                clock.instant()));
    }

    /**
     * Shorthand for actions taken by the engine itself.
     */
    @Transactional
    public ModerationAuditEntry recordSystem(
            EventType eventType, UUID subjectUserId, UUID resourceId, String resourceType, String details) {
        return record(eventType, null, ActorType.SYSTEM, subjectUserId, resourceId, resourceType, details);
    }

    public Page<ModerationAuditEntry> getHistoryForUser(UUID userId, Pageable pageable) {
        return auditRepository.findBySubjectUserIdOrderByTimestampDesc(userId, pageable);
    }

    public List<ModerationAuditEntry> getHistoryForResource(UUID resourceId) {
        return auditRepository.findByResourceIdOrderByTimestampDesc(resourceId);
    }

    public Page<ModerationAuditEntry> getByEventType(EventType eventType, Pageable pageable) {
        return auditRepository.findByEventTypeOrderByTimestampDesc(eventType, pageable);
    }
}
