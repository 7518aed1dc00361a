package com.astralcore.security.session;

import java.time.Duration;

/**
 * Session lifetime limits.
 *
 * @param maxAge             absolute lifetime from creation
 * @param idleTimeout        maximum time between two validations
 * @param maxSessionsPerUser concurrent sessions per user; the oldest are evicted beyond it
 */
public record SessionPolicy(Duration maxAge, Duration idleTimeout, int maxSessionsPerUser) {

    public static final SessionPolicy DEFAULT =
            new SessionPolicy(Duration.ofHours(24), Duration.ofMinutes(30), 5);

    public SessionPolicy {
        if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
        if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        if (maxSessionsPerUser < 1) {
            throw new IllegalArgumentException("maxSessionsPerUser must be at least 1");
        }
    }
}
