package com.astralcore.security.ratelimit;

import java.time.Instant;

/**
 * Answer to a rate-limit check.
 *
 * @param policy            the policy that was applied
 * @param allowed           whether the request may proceed
 * @param limit             the policy's request budget per window
 * @param remaining         requests left in the current window
 * @param resetAt           when the current window (or block) ends
 * @param retryAfterSeconds seconds until retrying can succeed; zero when allowed
 * @param blocked           rejected by the temporary block list rather than the window
 */
public record RateLimitDecision(
        String policy,
        boolean allowed,
        int limit,
        int remaining,
        Instant resetAt,
        long retryAfterSeconds,
        boolean blocked
) {

    static RateLimitDecision allow(String policy, int limit, int remaining, Instant resetAt) {
        return new RateLimitDecision(policy, true, limit, remaining, resetAt, 0, false);
    }

    static RateLimitDecision reject(String policy, int limit, Instant resetAt, Instant now) {
        return new RateLimitDecision(policy, false, limit, 0, resetAt,
                retryAfterSeconds(resetAt, now), false);
    }

    static RateLimitDecision blocked(String policy, int limit, Instant blockedUntil, Instant now) {
        return new RateLimitDecision(policy, false, limit, 0, blockedUntil,
                retryAfterSeconds(blockedUntil, now), true);
    }

    /**
     * Whole seconds until {@code resetAt}, rounded up, never less than one.
     */
    static long retryAfterSeconds(Instant resetAt, Instant now) {
        long millis = resetAt.toEpochMilli() - now.toEpochMilli();
        return Math.max(1, (millis + 999) / 1000);
    }
}
