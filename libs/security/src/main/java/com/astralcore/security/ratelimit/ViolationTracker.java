package com.astralcore.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Escalates repeat offenders to a temporary block list.
 * <p>
 * Each rate-limit rejection counts as a violation for the client identifier. Once an
 * identifier reaches the threshold within the tracking window it is blocked for the block
 * duration, independently of any window counter.
 */
public final class ViolationTracker {

    public static final int DEFAULT_THRESHOLD = 10;
    public static final Duration DEFAULT_TRACKING_WINDOW = Duration.ofHours(1);
    public static final Duration DEFAULT_BLOCK_DURATION = Duration.ofHours(24);

    private final int threshold;
    private final Duration trackingWindow;
    private final Duration blockDuration;
    private final Clock clock;
    private final Cache<String, Violations> violations;
    private final Cache<String, Instant> blocked;

    public ViolationTracker(Clock clock) {
        this(DEFAULT_THRESHOLD, DEFAULT_TRACKING_WINDOW, DEFAULT_BLOCK_DURATION, clock);
    }

    public ViolationTracker(int threshold, Duration trackingWindow, Duration blockDuration, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (trackingWindow == null || trackingWindow.isNegative() || trackingWindow.isZero()) {
            throw new IllegalArgumentException("trackingWindow must be positive");
        }
        if (blockDuration == null || blockDuration.isNegative() || blockDuration.isZero()) {
            throw new IllegalArgumentException("blockDuration must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.threshold = threshold;
        this.trackingWindow = trackingWindow;
        this.blockDuration = blockDuration;
        this.clock = clock;
        this.violations = Caffeine.newBuilder()
                .maximumSize(FixedWindowRateLimiter.DEFAULT_MAX_KEYS)
                .expireAfterWrite(trackingWindow)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        this.blocked = Caffeine.newBuilder()
                .maximumSize(FixedWindowRateLimiter.DEFAULT_MAX_KEYS)
                .expireAfterWrite(blockDuration)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Records one violation.
     *
     * @return the block expiry if this violation put the identifier on the block list
     */
    public Optional<Instant> recordViolation(String identifier) {
        Instant now = clock.instant();
        Violations updated = violations.asMap().compute(identifier, (k, current) -> {
            if (current == null || !now.isBefore(current.firstAt().plus(trackingWindow))) {
                return new Violations(1, now);
            }
            return new Violations(current.count() + 1, current.firstAt());
        });
        if (updated.count() < threshold) {
            return Optional.empty();
        }
        violations.invalidate(identifier);
        Instant until = now.plus(blockDuration);
        blocked.put(identifier, until);
        return Optional.of(until);
    }

    /**
     * Returns when the block on {@code identifier} ends, if it is blocked.
     */
    public Optional<Instant> blockedUntil(String identifier) {
        Instant until = blocked.getIfPresent(identifier);
        if (until == null || !clock.instant().isBefore(until)) {
            return Optional.empty();
        }
        return Optional.of(until);
    }

    public void unblock(String identifier) {
        blocked.invalidate(identifier);
        violations.invalidate(identifier);
    }

    public void sweep() {
        violations.cleanUp();
        blocked.cleanUp();
    }

    private record Violations(int count, Instant firstAt) {
    }
}
