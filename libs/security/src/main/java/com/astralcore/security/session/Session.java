package com.astralcore.security.session;

import java.time.Duration;
import java.time.Instant;

/**
 * An authenticated session. Instances are immutable; the store replaces them atomically.
 */
public record Session(
        String sessionId,
        String userId,
        String role,
        String fingerprint,
        Instant createdAt,
        Instant lastActivityAt,
        boolean trustDevice,
        String ipAddress,
        String userAgent,
        boolean mfaVerified
) {

    /**
     * Copy with {@code lastActivityAt} moved to {@code now}; activity never moves backwards.
     */
    Session touch(Instant now) {
        Instant activity = now.isAfter(lastActivityAt) ? now : lastActivityAt;
        return new Session(sessionId, userId, role, fingerprint, createdAt, activity, trustDevice,
                ipAddress, userAgent, mfaVerified);
    }

    Session rotate(String newSessionId, Instant now) {
        return new Session(newSessionId, userId, role, fingerprint, createdAt, lastActivityAt,
                trustDevice, ipAddress, userAgent, mfaVerified).touch(now);
    }

    Session withTrustDevice(boolean trust) {
        return new Session(sessionId, userId, role, fingerprint, createdAt, lastActivityAt, trust,
                ipAddress, userAgent, mfaVerified);
    }

    Session withMfaVerified() {
        return new Session(sessionId, userId, role, fingerprint, createdAt, lastActivityAt,
                trustDevice, ipAddress, userAgent, true);
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public Duration idle(Instant now) {
        return Duration.between(lastActivityAt, now);
    }

    @Override
    public String toString() {
        return "Session[userId=" + userId + ", role=" + role + ", createdAt=" + createdAt + "]";
    }
}
