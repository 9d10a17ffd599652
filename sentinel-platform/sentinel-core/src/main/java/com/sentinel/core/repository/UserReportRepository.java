package com.sentinel.core.repository;

import com.sentinel.core.domain.UserReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserReportRepository extends JpaRepository<UserReport, UUID> {

    /**
     * Distinct reporters against a stream inside the trailing window.
     */
    @Query("SELECT DISTINCT r.reporterId FROM UserReport r WHERE r.streamId = :streamId AND r.createdAt > :since AND r.createdAt <= :now")
    List<UUID> findDistinctReportersForStream(
            @Param("streamId") UUID streamId,
            @Param("since") Instant since,
            @Param("now") Instant now);

    @Query("SELECT COUNT(r) FROM UserReport r WHERE r.streamId = :streamId AND r.createdAt > :since AND r.createdAt <= :now")
    long countForStream(@Param("streamId") UUID streamId, @Param("since") Instant since, @Param("now") Instant now);

    @Query("SELECT COUNT(r) FROM UserReport r WHERE r.reportedUserId = :userId AND r.createdAt > :since")
    long countAgainstUserSince(@Param("userId") UUID userId, @Param("since") Instant since);

    List<UserReport> findByReportedUserIdOrderByCreatedAtDesc(UUID reportedUserId);
}
