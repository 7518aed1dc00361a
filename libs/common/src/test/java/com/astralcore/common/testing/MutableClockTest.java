package com.astralcore.common.testing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MutableClock")
class MutableClockTest {

    @Test
    @DisplayName("should advance by the given duration")
    void shouldAdvance() {
        var clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

        clock.advance(Duration.ofMinutes(31));

        assertThat(clock.instant()).isEqualTo(Instant.parse("2025-01-01T00:31:00Z"));
    }

    @Test
    @DisplayName("zoned copy shares the same instant")
    void zonedCopySharesInstant() {
        var clock = MutableClock.atEpochDay();
        var zoned = clock.withZone(ZoneId.of("America/New_York"));

        clock.advance(Duration.ofHours(1));

        assertThat(zoned.instant()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should reject null start")
    void shouldRejectNullStart() {
        assertThatThrownBy(() -> new MutableClock(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
