package com.astralcore.security.http;

/**
 * Header and cookie names read and written at the HTTP boundary.
 */
public final class SecurityHeaders {

    public static final String CSRF_TOKEN = "x-csrf-token";
    public static final String CSRF_COOKIE = "__csrf_token";
    public static final String SESSION_COOKIE = "__session";

    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    public static final String X_FORWARDED_FOR = "x-forwarded-for";
    public static final String X_REAL_IP = "x-real-ip";
    public static final String CF_CONNECTING_IP = "cf-connecting-ip";

    public static final String USER_AGENT = "user-agent";
    public static final String ACCEPT_LANGUAGE = "accept-language";
    public static final String ACCEPT_ENCODING = "accept-encoding";

    private SecurityHeaders() {
        // Utility class
    }
}
