package com.astralcore.security.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitHeaders")
class RateLimitHeadersTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Test
    @DisplayName("should report limit, remaining and reset in epoch seconds")
    void shouldDescribeAllowed() {
        RateLimitDecision decision = RateLimitDecision.allow("api:read", 100, 42, NOW.plusSeconds(30));

        Map<String, String> headers = RateLimitHeaders.of(decision);

        assertThat(headers)
                .containsEntry("X-RateLimit-Limit", "100")
                .containsEntry("X-RateLimit-Remaining", "42")
                .containsEntry("X-RateLimit-Reset", Long.toString(NOW.plusSeconds(30).getEpochSecond()))
                .doesNotContainKey("Retry-After");
    }

    @Test
    @DisplayName("should add Retry-After on rejection")
    void shouldDescribeRejected() {
        RateLimitDecision decision = RateLimitDecision.reject("auth:login", 5, NOW.plusMillis(1_200), NOW);

        assertThat(RateLimitHeaders.of(decision))
                .containsEntry("X-RateLimit-Remaining", "0")
                .containsEntry("Retry-After", "2");
    }
}
