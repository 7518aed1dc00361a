package com.astralcore.security.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.astralcore.common.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ViolationTracker")
class ViolationTrackerTest {

    private MutableClock clock;
    private ViolationTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochDay();
        tracker = new ViolationTracker(3, Duration.ofHours(1), Duration.ofHours(24), clock);
    }

    @Test
    @DisplayName("should block on reaching the threshold within the window")
    void shouldBlockAtThreshold() {
        assertThat(tracker.recordViolation("ip")).isEmpty();
        assertThat(tracker.recordViolation("ip")).isEmpty();

        Optional<Instant> blocked = tracker.recordViolation("ip");

        assertThat(blocked).contains(clock.instant().plus(Duration.ofHours(24)));
        assertThat(tracker.blockedUntil("ip")).isPresent();
    }

    @Test
    @DisplayName("should forget violations older than the tracking window")
    void shouldResetAfterTrackingWindow() {
        tracker.recordViolation("ip");
        tracker.recordViolation("ip");
        clock.advance(Duration.ofHours(1));

        assertThat(tracker.recordViolation("ip")).isEmpty();
        assertThat(tracker.blockedUntil("ip")).isEmpty();
    }

    @Test
    @DisplayName("should lift the block when it expires")
    void shouldExpireBlock() {
        for (int i = 0; i < 3; i++) {
            tracker.recordViolation("ip");
        }
        clock.advance(Duration.ofHours(24));

        assertThat(tracker.blockedUntil("ip")).isEmpty();
    }

    @Test
    @DisplayName("unblock should remove the identifier")
    void shouldUnblock() {
        for (int i = 0; i < 3; i++) {
            tracker.recordViolation("ip");
        }

        tracker.unblock("ip");

        assertThat(tracker.blockedUntil("ip")).isEmpty();
    }
}
