package com.sentinel.core.repository;

import com.sentinel.core.domain.Strike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Strike lookups. "In force" means active and either permanent or not yet expired.
 */
@Repository
public interface StrikeRepository extends JpaRepository<Strike, UUID> {

    @Query("SELECT COUNT(s) FROM Strike s WHERE s.userId = :userId AND s.scopeId = :scopeId " +
           "AND s.active = true AND (s.expiresAt IS NULL OR s.expiresAt > :now)")
    long countInForce(@Param("userId") UUID userId, @Param("scopeId") UUID scopeId, @Param("now") Instant now);

    @Query("SELECT s FROM Strike s WHERE s.userId = :userId AND s.scopeId = :scopeId " +
           "AND s.active = true AND (s.expiresAt IS NULL OR s.expiresAt > :now) ORDER BY s.createdAt DESC")
    List<Strike> findInForce(@Param("userId") UUID userId, @Param("scopeId") UUID scopeId, @Param("now") Instant now);

    /**
     * Whether the user is banned from the scope: an active level 4 strike, or an
     * active level 3 strike that has not expired yet.
     */
    @Query("SELECT COUNT(s) > 0 FROM Strike s WHERE s.userId = :userId AND s.scopeId = :scopeId AND s.active = true " +
           "AND (s.level = 4 OR (s.level = 3 AND s.expiresAt > :now))")
    boolean existsBanningStrike(@Param("userId") UUID userId, @Param("scopeId") UUID scopeId, @Param("now") Instant now);

    List<Strike> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Strike> findByViolationId(UUID violationId);

    /**
     * Level 3 strikes whose scope ban has ended and has not been announced yet.
     */
    @Query("SELECT s FROM Strike s WHERE s.active = true AND s.level = 3 AND s.expiresAt <= :now " +
           "AND s.banEndNotifiedAt IS NULL")
    List<Strike> findUnannouncedEndedScopeBans(@Param("now") Instant now);

    @Query("SELECT s FROM Strike s WHERE s.userId = :userId AND s.active = true " +
           "AND s.expiresAt > :now AND s.expiresAt <= :until ORDER BY s.expiresAt ASC")
    List<Strike> findExpiringBetween(@Param("userId") UUID userId, @Param("now") Instant now, @Param("until") Instant until);
}
