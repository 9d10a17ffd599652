package com.sentinel.core.domain;

import com.sentinel.core.domain.AdminPenalty.Severity;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class AdminPenaltyTest {

    private static final Instant NOW = Instant.parse("2026-05-10T08:00:00Z");

    @Property(tries = 100)
    void temporaryDurationsOutsideAllowedSetAreRejected(@ForAll @IntRange(min = -10, max = 1000) int hours) {
        Assume.that(!AdminPenalty.ALLOWED_TEMPORARY_HOURS.contains(hours));

        assertThatThrownBy(() -> penalty(Severity.TEMPORARY, hours)).isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void temporaryPenaltyExpiresAfterItsDuration() {
        AdminPenalty penalty = penalty(Severity.TEMPORARY, 168);

        assertThat(penalty.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofHours(168)));
        assertThat(penalty.isExpired(NOW.plus(Duration.ofHours(167)))).isFalse();
        assertThat(penalty.isExpired(NOW.plus(Duration.ofHours(168)))).isTrue();
    }

    @Example
    void permanentPenaltyNeverExpires() {
        AdminPenalty penalty = penalty(Severity.PERMANENT, null);

        assertThat(penalty.getExpiresAt()).isNull();
        assertThat(penalty.isExpired(NOW.plus(Duration.ofDays(10_000)))).isFalse();
    }

    private static AdminPenalty penalty(Severity severity, Integer hours) {
        return AdminPenalty.create(UUID.randomUUID(), UUID.randomUUID(), severity, PolicyCategory.HARASSMENT,
                "repeated harassment", hours, null, null, null, null, null, NOW);
    }
}
