package com.sentinel.core.repository;

import com.sentinel.core.domain.MassReportEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MassReportEventRepository extends JpaRepository<MassReportEvent, UUID> {

    Optional<MassReportEvent> findFirstByStreamIdAndResolvedAtIsNullOrderByTriggeredAtDesc(UUID streamId);

    Optional<MassReportEvent> findFirstByStreamIdAndResolvedAtIsNotNullOrderByResolvedAtDesc(UUID streamId);

    long countByStreamIdAndResolvedAtIsNull(UUID streamId);

    List<MassReportEvent> findByStreamIdOrderByTriggeredAtDesc(UUID streamId);

    List<MassReportEvent> findByResolvedAtIsNullOrderByTriggeredAtAsc();
}
