package com.sentinel.core.repository;

import com.sentinel.core.domain.AdminPenalty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AdminPenaltyRepository extends JpaRepository<AdminPenalty, UUID> {

    List<AdminPenalty> findByUserIdAndActiveTrueOrderByCreatedAtDesc(UUID userId);

    List<AdminPenalty> findByUserIdOrderByCreatedAtDesc(UUID userId);

    @Query("SELECT p FROM AdminPenalty p WHERE p.active = true AND p.expiresAt IS NOT NULL AND p.expiresAt <= :now")
    List<AdminPenalty> findExpired(@Param("now") Instant now);

    @Query("SELECT p FROM AdminPenalty p WHERE p.userId = :userId AND p.active = true " +
           "AND p.expiresAt > :now AND p.expiresAt <= :until ORDER BY p.expiresAt ASC")
    List<AdminPenalty> findExpiringBetween(@Param("userId") UUID userId, @Param("now") Instant now, @Param("until") Instant until);
}
