package com.astralcore.security.ratelimit;

import java.time.Duration;

/**
 * Request budget for one class of endpoint.
 *
 * @param name           policy name, e.g. {@code auth:login}
 * @param window         fixed window length
 * @param maxRequests    requests allowed per window and key
 * @param countSuccesses whether successful requests consume budget; when {@code false}
 *                       callers un-count them with {@link RateLimitService#recordSuccess}
 * @param neverBlock     count and report but never reject (crisis endpoints)
 */
public record RateLimitPolicy(
        String name,
        Duration window,
        int maxRequests,
        boolean countSuccesses,
        boolean neverBlock
) {

    public RateLimitPolicy {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
    }

    public static RateLimitPolicy of(String name, Duration window, int maxRequests) {
        return new RateLimitPolicy(name, window, maxRequests, true, false);
    }

    public RateLimitPolicy withLimit(Duration window, int maxRequests) {
        return new RateLimitPolicy(name, window, maxRequests, countSuccesses, neverBlock);
    }
}
