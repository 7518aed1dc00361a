package com.astralcore.common.error;

import java.time.Instant;

/**
 * Thrown when a caller exceeds the request budget of a rate-limit policy.
 */
public class RateLimitExceededException extends AstralSecurityException {

    private final String policy;
    private final Instant resetAt;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String policy, Instant resetAt, long retryAfterSeconds) {
        super(ErrorCategory.RATE_LIMIT_EXCEEDED,
                "Too many requests. Retry after %d seconds".formatted(retryAfterSeconds));
        this.policy = policy;
        this.resetAt = resetAt;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String policy() {
        return policy;
    }

    public Instant resetAt() {
        return resetAt;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
