package com.sentinel.api.strike;

import com.sentinel.api.config.MutableClock;
import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.enforcement.RestrictionService;
import com.sentinel.core.domain.ModerationAuditEntry.ActorType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Strike;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * Strike ledger against a real persistence context.
 * Levels escalate per (user, scope), level 3 bans for a day, level 4 forever.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class StrikeLedgerServicePropertyTest {

    @Autowired
    private StrikeLedgerService strikeLedgerService;

    @Autowired
    private RestrictionService restrictionService;

    @Autowired
    private MutableClock clock;

    private UUID userId;
    private UUID scopeId;

    @BeforeEach
    void setUp() {
        clock.set(TestModerationConfiguration.EPOCH);
        userId = UUID.randomUUID();
        scopeId = UUID.randomUUID();
    }

    // ==================== Level progression ====================

    @Test
    void levelsFollowStrikesInForceCappedAtFour() {
        for (int n = 0; n < 6; n++) {
            Strike strike = strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "strike " + n);
            assertThat(strike.getLevel()).as("strike #" + (n + 1)).isEqualTo(Math.min(n + 1, Strike.MAX_LEVEL));
        }
    }

    @Test
    void levelFourNeverExpires() {
        Strike last = null;
        for (int n = 0; n < 4; n++) {
            last = strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HATE_SPEECH, "hate");
        }

        assertThat(last.getLevel()).isEqualTo(4);
        assertThat(last.getExpiresAt()).isNull();
        assertThat(last.isPermanent()).isTrue();

        clock.advance(Duration.ofDays(3650));
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();
    }

    @Test
    void secondStrikeTimesOutForTenMinutes() {
        strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "first");
        assertThat(restrictionService.isTimedOut(userId, scopeId)).isFalse();

        strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "second");
        assertThat(restrictionService.isTimedOut(userId, scopeId)).isTrue();

        clock.advance(Duration.ofMinutes(10));
        assertThat(restrictionService.isTimedOut(userId, scopeId)).isFalse();
    }

    @Test
    void thirdStrikeBansForTwentyFourHours() {
        for (int n = 0; n < 3; n++) {
            strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "strike");
        }
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();

        clock.advance(Duration.ofHours(23));
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();

        clock.advance(Duration.ofHours(1));
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isFalse();
    }

    @Test
    void expiredStrikesNoLongerCount() {
        strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.TOXICITY, "old");
        clock.advance(Duration.ofDays(31));

        Strike fresh = strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.TOXICITY, "new");
        assertThat(fresh.getLevel()).isEqualTo(1);
    }

    // ==================== Scope isolation ====================

    @Test
    void banInOneScopeDoesNotLeakIntoAnother() {
        UUID otherScope = UUID.randomUUID();
        for (int n = 0; n < 4; n++) {
            strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "strike");
        }

        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();
        assertThat(strikeLedgerService.isBanned(userId, otherScope)).isFalse();
        assertThat(strikeLedgerService.applyStrike(userId, otherScope, PolicyCategory.SPAM, "elsewhere").getLevel()).isEqualTo(1);
    }

    // ==================== Revocation ====================

    @Test
    void revokingBanningStrikeLiftsBan() {
        Strike third = null;
        for (int n = 0; n < 3; n++) {
            third = strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "strike");
        }
        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isTrue();

        strikeLedgerService.revokeStrike(third.getId(), UUID.randomUUID(), ActorType.ADMIN, "mistake");

        assertThat(strikeLedgerService.isBanned(userId, scopeId)).isFalse();
        assertThat(strikeLedgerService.getActiveStrikes(userId, scopeId)).hasSize(2);
    }

    // ==================== Concurrency ====================

    @Test
    void concurrentStrikesGetDistinctLevels() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Strike>> tasks = new ArrayList<>();
            for (int n = 0; n < 4; n++) {
                tasks.add(() -> strikeLedgerService.applyStrike(userId, scopeId, PolicyCategory.HARASSMENT, "race"));
            }
            List<Integer> levels = new ArrayList<>();
            for (Future<Strike> future : pool.invokeAll(tasks)) {
                levels.add(future.get().getLevel());
            }
            levels.sort(Integer::compareTo);
            assertThat(levels).isEqualTo(List.of(1, 2, 3, 4));
        } finally {
            pool.shutdownNow();
        }
    }
}
