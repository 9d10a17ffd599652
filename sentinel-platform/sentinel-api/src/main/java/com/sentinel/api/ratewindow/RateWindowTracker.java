package com.sentinel.api.ratewindow;

import com.sentinel.api.error.ConcurrencyConflictException;
import com.sentinel.api.error.TransientIoException;
import com.sentinel.core.repository.RateWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fixed-window counter keyed by subject, backed by the {@code rate_windows} table.
 * A window is current while its start is newer than {@code now - windowLength};
 * the first hit after that restarts it at one.
 */
@Service
public class RateWindowTracker {

    private static final Logger log = LoggerFactory.getLogger(RateWindowTracker.class);

    static final int MAX_CONFLICT_RETRIES = 3;

    private final RateWindowWriter writer;
    private final RateWindowRepository repository;
    private final Clock clock;

    public RateWindowTracker(RateWindowWriter writer, RateWindowRepository repository, Clock clock) {
        this.writer = writer;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Atomically counts one hit for the key and returns the count in the current window.
     *
     * @throws TransientIoException when the store fails or conflicts persist past the retry bound
     */
    public int increment(String subjectKey, Duration windowLength) {
        requireValid(subjectKey, windowLength);
        ConcurrencyConflictException lastConflict = null;
        for (int attempt = 0; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            Instant now = clock.instant();
            Instant staleBefore = now.minus(windowLength);
            try {
                Optional<Integer> count = writer.incrementExisting(subjectKey, staleBefore, now);
                if (count.isPresent()) {
                    return count.get();
                }
                return writer.insertFirst(subjectKey, now);
            } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
                lastConflict = new ConcurrencyConflictException("Lost rate window race for " + subjectKey, e);
                log.debug("Rate window conflict on {} (attempt {})", subjectKey, attempt + 1);
            } catch (DataAccessException e) {
                throw new TransientIoException("Rate window store unavailable for " + subjectKey, e);
            }
        }
        throw new TransientIoException("Rate window for " + subjectKey + " kept conflicting", lastConflict);
    }

    /**
     * Current count without counting a hit; zero when the window is missing or stale.
     */
    public int peek(String subjectKey, Duration windowLength) {
        requireValid(subjectKey, windowLength);
        Instant staleBefore = clock.instant().minus(windowLength);
        return repository.findCurrentHitCount(subjectKey, staleBefore).orElse(0);
    }

    public void reset(String subjectKey) {
        try {
            writer.delete(subjectKey);
        } catch (DataAccessException e) {
            throw new TransientIoException("Could not reset rate window " + subjectKey, e);
        }
    }

    private static void requireValid(String subjectKey, Duration windowLength) {
        if (subjectKey == null || subjectKey.isBlank()) {
            throw new IllegalArgumentException("Subject key is required");
        }
        if (windowLength == null || windowLength.isNegative() || windowLength.isZero()) {
            throw new IllegalArgumentException("Window length must be positive");
        }
    }
}
