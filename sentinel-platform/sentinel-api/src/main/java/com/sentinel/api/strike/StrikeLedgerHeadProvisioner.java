package com.sentinel.api.strike;

import com.sentinel.core.domain.StrikeLedgerHead;
import com.sentinel.core.repository.StrikeLedgerHeadRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates the ledger head row for a (user, scope) pair on first use, in its own
 * transaction so the strike writer can then lock a committed row.
 */
@Component
public class StrikeLedgerHeadProvisioner {

    private final StrikeLedgerHeadRepository headRepository;

    public StrikeLedgerHeadProvisioner(StrikeLedgerHeadRepository headRepository) {
        this.headRepository = headRepository;
    }

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when another writer
     *         created the row first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureExists(UUID userId, UUID scopeId) {
        if (headRepository.findByUserIdAndScopeId(userId, scopeId).isEmpty()) {
            headRepository.saveAndFlush(StrikeLedgerHead.create(userId, scopeId));
        }
    }
}
