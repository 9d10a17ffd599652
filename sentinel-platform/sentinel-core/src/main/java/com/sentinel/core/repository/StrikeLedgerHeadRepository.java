package com.sentinel.core.repository;

import com.sentinel.core.domain.StrikeLedgerHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StrikeLedgerHeadRepository extends JpaRepository<StrikeLedgerHead, UUID> {

    Optional<StrikeLedgerHead> findByUserIdAndScopeId(UUID userId, UUID scopeId);

    /**
     * Locks the ledger head for the pair until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM StrikeLedgerHead h WHERE h.userId = :userId AND h.scopeId = :scopeId")
    Optional<StrikeLedgerHead> findForUpdate(@Param("userId") UUID userId, @Param("scopeId") UUID scopeId);
}
