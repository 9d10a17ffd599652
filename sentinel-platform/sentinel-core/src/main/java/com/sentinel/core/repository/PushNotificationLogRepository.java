package com.sentinel.core.repository;

import com.sentinel.core.domain.PushNotificationLog;
import com.sentinel.core.domain.PushNotificationLog.Outcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PushNotificationLogRepository extends JpaRepository<PushNotificationLog, UUID> {

    List<PushNotificationLog> findByUserIdOrderByCreatedAtAsc(UUID userId);

    long countByUserIdAndOutcome(UUID userId, Outcome outcome);
}
