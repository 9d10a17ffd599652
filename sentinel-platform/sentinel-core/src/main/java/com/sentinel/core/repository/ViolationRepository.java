package com.sentinel.core.repository;

import com.sentinel.core.domain.Violation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ViolationRepository extends JpaRepository<Violation, UUID> {

    List<Violation> findByUserIdAndDeletedFalseOrderByCreatedAtDesc(UUID userId);

    List<Violation> findByUserIdAndScopeIdAndDeletedFalseOrderByCreatedAtDesc(UUID userId, UUID scopeId);

    /**
     * Violations for a user since a point in time, excluding soft-deleted rows.
     */
    @Query("SELECT v FROM Violation v WHERE v.userId = :userId AND v.createdAt >= :since AND v.deleted = false ORDER BY v.createdAt DESC")
    List<Violation> findRecentByUser(@Param("userId") UUID userId, @Param("since") Instant since);

    long countByUserIdAndResolvedFalseAndDeletedFalse(UUID userId);
}
