package com.sentinel.core.repository;

import com.sentinel.core.domain.HarassmentReportTracker;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface HarassmentReportTrackerRepository extends JpaRepository<HarassmentReportTracker, UUID> {

    Optional<HarassmentReportTracker> findByReportedUserIdAndStreamId(UUID reportedUserId, UUID streamId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM HarassmentReportTracker t WHERE t.reportedUserId = :userId AND t.streamId = :streamId")
    Optional<HarassmentReportTracker> findForUpdate(@Param("userId") UUID reportedUserId, @Param("streamId") UUID streamId);
}
