package com.astralcore.security.ratelimit;

import com.astralcore.security.http.SecurityHeaders;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response headers describing a rate-limit decision. {@code X-RateLimit-Reset} is the
 * window reset as epoch seconds; {@code Retry-After} is only present on rejections.
 */
public final class RateLimitHeaders {

    private RateLimitHeaders() {
        // Utility class
    }

    public static Map<String, String> of(RateLimitDecision decision) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(SecurityHeaders.RATE_LIMIT_LIMIT, Integer.toString(decision.limit()));
        headers.put(SecurityHeaders.RATE_LIMIT_REMAINING, Integer.toString(decision.remaining()));
        headers.put(SecurityHeaders.RATE_LIMIT_RESET, Long.toString(decision.resetAt().getEpochSecond()));
        if (!decision.allowed()) {
            headers.put(SecurityHeaders.RETRY_AFTER, Long.toString(decision.retryAfterSeconds()));
        }
        return headers;
    }
}
