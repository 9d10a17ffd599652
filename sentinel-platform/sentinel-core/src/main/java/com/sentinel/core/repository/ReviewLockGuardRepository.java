package com.sentinel.core.repository;

import com.sentinel.core.domain.ReviewLockGuard;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReviewLockGuardRepository extends JpaRepository<ReviewLockGuard, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM ReviewLockGuard g WHERE g.userId = :userId")
    Optional<ReviewLockGuard> findForUpdate(@Param("userId") UUID userId);
}
