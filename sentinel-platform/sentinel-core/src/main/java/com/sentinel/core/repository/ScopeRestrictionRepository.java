package com.sentinel.core.repository;

import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeRestriction.RestrictionKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScopeRestrictionRepository extends JpaRepository<ScopeRestriction, UUID> {

    @Query("SELECT r FROM ScopeRestriction r WHERE r.userId = :userId AND r.scopeId = :scopeId AND r.active = true " +
           "AND r.startsAt <= :now AND (r.endsAt IS NULL OR r.endsAt > :now) ORDER BY r.startsAt DESC")
    List<ScopeRestriction> findInForce(@Param("userId") UUID userId, @Param("scopeId") UUID scopeId, @Param("now") Instant now);

    @Query("SELECT COUNT(r) > 0 FROM ScopeRestriction r WHERE r.userId = :userId AND r.scopeId = :scopeId " +
           "AND r.kind = :kind AND r.active = true AND r.startsAt <= :now AND (r.endsAt IS NULL OR r.endsAt > :now)")
    boolean existsInForce(
            @Param("userId") UUID userId,
            @Param("scopeId") UUID scopeId,
            @Param("kind") RestrictionKind kind,
            @Param("now") Instant now);

    List<ScopeRestriction> findByViolationIdAndActiveTrue(UUID violationId);

    List<ScopeRestriction> findByStrikeIdAndActiveTrue(UUID strikeId);

    /**
     * Active restrictions whose end time has passed; picked up by the expiry sweep.
     */
    @Query("SELECT r FROM ScopeRestriction r WHERE r.active = true AND r.endsAt IS NOT NULL AND r.endsAt <= :now")
    List<ScopeRestriction> findLapsed(@Param("now") Instant now);

    @Query("SELECT r FROM ScopeRestriction r WHERE r.userId = :userId AND r.active = true " +
           "AND r.endsAt > :now AND r.endsAt <= :until ORDER BY r.endsAt ASC")
    List<ScopeRestriction> findEndingBetween(@Param("userId") UUID userId, @Param("now") Instant now, @Param("until") Instant until);
}
