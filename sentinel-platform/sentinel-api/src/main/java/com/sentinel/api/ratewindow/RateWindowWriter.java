package com.sentinel.api.ratewindow;

import com.sentinel.core.domain.RateWindow;
import com.sentinel.core.repository.RateWindowRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Single-row counter statements, each in its own short transaction so the row lock
 * is released as soon as the count is known.
 */
@Component
public class RateWindowWriter {

    private final RateWindowRepository repository;

    public RateWindowWriter(RateWindowRepository repository) {
        this.repository = repository;
    }

    /**
     * Increments a current window or restarts a stale one.
     *
     * @return the new count, or empty when no row exists for the key yet
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Integer> incrementExisting(String key, Instant staleBefore, Instant now) {
        if (repository.incrementIfCurrent(key, staleBefore) == 1) {
            return repository.findHitCount(key);
        }
        if (repository.restartIfStale(key, staleBefore, now) == 1) {
            return Optional.of(1);
        }
        return Optional.empty();
    }

    /**
     * Inserts the first window for a key. A concurrent insert for the same key
     * surfaces as {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int insertFirst(String key, Instant now) {
        repository.saveAndFlush(RateWindow.open(key, now));
        return 1;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void delete(String key) {
        repository.deleteByKey(key);
    }
}
