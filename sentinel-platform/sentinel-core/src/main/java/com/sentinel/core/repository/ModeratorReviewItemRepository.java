package com.sentinel.core.repository;

import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ModeratorReviewItemRepository extends JpaRepository<ModeratorReviewItem, UUID> {

    Optional<ModeratorReviewItem> findByViolationId(UUID violationId);

    List<ModeratorReviewItem> findByStatusOrderByCreatedAtAsc(ReviewStatus status);

    List<ModeratorReviewItem> findAllByOrderByCreatedAtAsc();

    long countByUserIdAndStatus(UUID userId, ReviewStatus status);

    List<ModeratorReviewItem> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
