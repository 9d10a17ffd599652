package com.sentinel.core.repository;

import com.sentinel.core.domain.ForcedReviewLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ForcedReviewLockRepository extends JpaRepository<ForcedReviewLock, UUID> {

    Optional<ForcedReviewLock> findFirstByUserIdAndActiveTrue(UUID userId);

    boolean existsByUserIdAndActiveTrue(UUID userId);

    List<ForcedReviewLock> findByActiveTrueOrderByLockedAtAsc();
}
