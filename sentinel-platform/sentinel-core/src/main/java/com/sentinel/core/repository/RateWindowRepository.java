package com.sentinel.core.repository;

import com.sentinel.core.domain.RateWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Counter updates are single conditional statements so concurrent increments
 * on the same key serialise on the row lock instead of racing in memory.
 */
@Repository
public interface RateWindowRepository extends JpaRepository<RateWindow, String> {

    /**
     * Increments the counter if the stored window is still current.
     *
     * @return rows updated, 0 when the key is missing or its window is stale
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RateWindow w SET w.hitCount = w.hitCount + 1 WHERE w.subjectKey = :key AND w.windowStart > :staleBefore")
    int incrementIfCurrent(@Param("key") String key, @Param("staleBefore") Instant staleBefore);

    /**
     * Restarts a stale window at {@code now} with a count of one.
     *
     * @return rows updated, 0 when the key is missing or another writer already restarted it
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RateWindow w SET w.hitCount = 1, w.windowStart = :now WHERE w.subjectKey = :key AND w.windowStart <= :staleBefore")
    int restartIfStale(@Param("key") String key, @Param("staleBefore") Instant staleBefore, @Param("now") Instant now);

    @Query("SELECT w.hitCount FROM RateWindow w WHERE w.subjectKey = :key")
    Optional<Integer> findHitCount(@Param("key") String key);

    @Query("SELECT w.hitCount FROM RateWindow w WHERE w.subjectKey = :key AND w.windowStart > :staleBefore")
    Optional<Integer> findCurrentHitCount(@Param("key") String key, @Param("staleBefore") Instant staleBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RateWindow w WHERE w.subjectKey = :key")
    int deleteByKey(@Param("key") String key);
}
