package com.sentinel.core.repository;

import com.sentinel.core.domain.ModerationAuditEntry;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Moderation history is append-only; entries are saved once and never updated.
 */
@Repository
public interface ModerationAuditEntryRepository extends JpaRepository<ModerationAuditEntry, UUID> {

    Page<ModerationAuditEntry> findBySubjectUserIdOrderByTimestampDesc(UUID subjectUserId, Pageable pageable);

    List<ModerationAuditEntry> findByResourceIdOrderByTimestampDesc(UUID resourceId);

    Page<ModerationAuditEntry> findByEventTypeOrderByTimestampDesc(EventType eventType, Pageable pageable);

    @Query("SELECT COUNT(e) FROM ModerationAuditEntry e WHERE e.eventType = :eventType AND e.timestamp >= :start AND e.timestamp <= :end")
    long countByEventTypeInRange(
            @Param("eventType") EventType eventType,
            @Param("start") Instant start,
            @Param("end") Instant end);
}
