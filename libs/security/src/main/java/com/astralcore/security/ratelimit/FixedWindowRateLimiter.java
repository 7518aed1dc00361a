package com.astralcore.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window counter for a single {@link RateLimitPolicy}.
 * <p>
 * Counters live in a bounded Caffeine cache: each entry expires when its window resets,
 * and the least recently used keys are evicted first under memory pressure. The
 * increment and the comparison against the limit happen inside one atomic
 * {@code compute} per key, so concurrent requests can never both take the last slot.
 */
public final class FixedWindowRateLimiter {

    public static final int DEFAULT_MAX_KEYS = 10_000;

    private final RateLimitPolicy policy;
    private final Clock clock;
    private final Cache<String, Window> windows;

    public FixedWindowRateLimiter(RateLimitPolicy policy, Clock clock) {
        this(policy, clock, DEFAULT_MAX_KEYS);
    }

    public FixedWindowRateLimiter(RateLimitPolicy policy, Clock clock, int maxKeys) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (maxKeys < 1) {
            throw new IllegalArgumentException("maxKeys must be positive");
        }
        this.policy = policy;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfter(new WindowExpiry(clock))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Counts one request against {@code key} and decides whether it is allowed.
     */
    public RateLimitDecision check(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        Instant now = clock.instant();
        Window window = windows.asMap().compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.resetAt())) {
                return new Window(1, now.plus(policy.window()));
            }
            return new Window(current.count() + 1, current.resetAt());
        });
        if (window.count() <= policy.maxRequests()) {
            return RateLimitDecision.allow(policy.name(), policy.maxRequests(),
                    policy.maxRequests() - window.count(), window.resetAt());
        }
        return RateLimitDecision.reject(policy.name(), policy.maxRequests(), window.resetAt(), now);
    }

    /**
     * Reports the state of {@code key} without counting a request.
     */
    public RateLimitDecision peek(String key) {
        Instant now = clock.instant();
        Window window = windows.getIfPresent(key);
        if (window == null || !now.isBefore(window.resetAt())) {
            return RateLimitDecision.allow(policy.name(), policy.maxRequests(),
                    policy.maxRequests(), now.plus(policy.window()));
        }
        if (window.count() < policy.maxRequests()) {
            return RateLimitDecision.allow(policy.name(), policy.maxRequests(),
                    policy.maxRequests() - window.count(), window.resetAt());
        }
        return RateLimitDecision.reject(policy.name(), policy.maxRequests(), window.resetAt(), now);
    }

    /**
     * Gives back one request of budget, for policies that only count failures.
     */
    public void uncount(String key) {
        windows.asMap().computeIfPresent(key, (k, current) ->
                new Window(Math.max(0, current.count() - 1), current.resetAt()));
    }

    public void reset(String key) {
        windows.invalidate(key);
    }

    /**
     * Drops expired windows.
     */
    public void sweep() {
        windows.cleanUp();
    }

    public long trackedKeys() {
        return windows.estimatedSize();
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    private record Window(int count, Instant resetAt) {
    }

    private static final class WindowExpiry implements Expiry<String, Window> {

        private final Clock clock;

        WindowExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, Window value, long currentTime) {
            return untilReset(value);
        }

        @Override
        public long expireAfterUpdate(String key, Window value, long currentTime, long currentDuration) {
            return untilReset(value);
        }

        @Override
        public long expireAfterRead(String key, Window value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long untilReset(Window value) {
            return Math.max(0, Duration.between(clock.instant(), value.resetAt()).toNanos());
        }
    }
}
