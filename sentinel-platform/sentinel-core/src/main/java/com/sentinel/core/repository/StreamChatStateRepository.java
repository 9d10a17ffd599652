package com.sentinel.core.repository;

import com.sentinel.core.domain.StreamChatState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StreamChatStateRepository extends JpaRepository<StreamChatState, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StreamChatState s WHERE s.streamId = :streamId")
    Optional<StreamChatState> findForUpdate(@Param("streamId") UUID streamId);
}
