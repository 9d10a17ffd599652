package com.sentinel.core.repository;

import com.sentinel.core.domain.Appeal;
import com.sentinel.core.domain.Appeal.AppealStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AppealRepository extends JpaRepository<Appeal, UUID> {

    boolean existsByTargetIdAndStatus(UUID targetId, AppealStatus status);

    long countByTargetIdAndStatus(UUID targetId, AppealStatus status);

    List<Appeal> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Appeal> findByStatusOrderByCreatedAtAsc(AppealStatus status);
}
