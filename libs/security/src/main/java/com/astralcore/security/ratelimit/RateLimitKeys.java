package com.astralcore.security.ratelimit;

import com.astralcore.crypto.SecureTokens;

/**
 * Builds counter keys. Authenticated callers are keyed by user id; anonymous callers by a
 * short hash of IP and user agent, so raw addresses never sit in the counter table.
 */
public final class RateLimitKeys {

    private static final int ANONYMOUS_HASH_LENGTH = 16;

    private RateLimitKeys() {
        // Utility class
    }

    public static String forUser(String policy, String userId) {
        return policy + ":user:" + userId;
    }

    public static String forAnonymous(String policy, String clientIp, String userAgent) {
        String fingerprint = (clientIp == null ? "" : clientIp) + ":" + (userAgent == null ? "" : userAgent);
        return policy + ":ip:" + SecureTokens.sha256Prefix(fingerprint, ANONYMOUS_HASH_LENGTH);
    }

    public static String forCaller(String policy, String userId, String clientIp, String userAgent) {
        return userId != null && !userId.isBlank()
                ? forUser(policy, userId)
                : forAnonymous(policy, clientIp, userAgent);
    }
}
