package com.astralcore.security.ratelimit;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The built-in policy table. Crisis endpoints are never blocked; login counts failed
 * attempts only.
 */
public final class RateLimitPolicies {

    public static final String AUTH_LOGIN = "auth:login";
    public static final String AUTH_REGISTER = "auth:register";
    public static final String AUTH_FORGOT_PASSWORD = "auth:forgot-password";
    public static final String AUTH_RESET_PASSWORD = "auth:reset-password";
    public static final String AUTH_MFA_VERIFY = "auth:mfa-verify";
    public static final String CRISIS_ASSESS = "crisis:assess";
    public static final String CRISIS_HOTLINE = "crisis:hotline";
    public static final String FILES_UPLOAD = "files:upload";
    public static final String API_READ = "api:read";
    public static final String API_WRITE = "api:write";
    public static final String API_GENERAL = "api:general";
    public static final String WELLNESS_MOOD = "wellness:mood";
    public static final String WELLNESS_JOURNAL = "wellness:journal";
    public static final String SEARCH_GLOBAL = "search:global";
    public static final String NOTIFICATIONS_SEND = "notifications:send";

    private RateLimitPolicies() {
        // Utility class
    }

    public static Map<String, RateLimitPolicy> defaults() {
        Map<String, RateLimitPolicy> table = new LinkedHashMap<>();
        put(table, new RateLimitPolicy(AUTH_LOGIN, Duration.ofMinutes(15), 5, false, false));
        put(table, RateLimitPolicy.of(AUTH_REGISTER, Duration.ofHours(1), 3));
        put(table, RateLimitPolicy.of(AUTH_FORGOT_PASSWORD, Duration.ofHours(1), 3));
        put(table, RateLimitPolicy.of(AUTH_RESET_PASSWORD, Duration.ofMinutes(15), 5));
        put(table, RateLimitPolicy.of(AUTH_MFA_VERIFY, Duration.ofMinutes(5), 5));
        put(table, new RateLimitPolicy(CRISIS_ASSESS, Duration.ofMinutes(1), 10, true, true));
        put(table, new RateLimitPolicy(CRISIS_HOTLINE, Duration.ofMinutes(1), 20, true, true));
        put(table, RateLimitPolicy.of(FILES_UPLOAD, Duration.ofHours(1), 10));
        put(table, RateLimitPolicy.of(API_READ, Duration.ofMinutes(1), 100));
        put(table, RateLimitPolicy.of(API_WRITE, Duration.ofMinutes(1), 30));
        put(table, RateLimitPolicy.of(API_GENERAL, Duration.ofMinutes(1), 60));
        put(table, RateLimitPolicy.of(WELLNESS_MOOD, Duration.ofHours(1), 20));
        put(table, RateLimitPolicy.of(WELLNESS_JOURNAL, Duration.ofHours(1), 10));
        put(table, RateLimitPolicy.of(SEARCH_GLOBAL, Duration.ofMinutes(1), 20));
        put(table, RateLimitPolicy.of(NOTIFICATIONS_SEND, Duration.ofHours(1), 50));
        return Collections.unmodifiableMap(table);
    }

    /**
     * The default table with window and limit replaced for the named policies. Unknown
     * names are added as new policies counting every request.
     */
    public static Map<String, RateLimitPolicy> withOverrides(Map<String, PolicyOverride> overrides) {
        Map<String, RateLimitPolicy> table = new LinkedHashMap<>(defaults());
        overrides.forEach((name, override) -> {
            RateLimitPolicy base = table.get(name);
            table.put(name, base == null
                    ? RateLimitPolicy.of(name, override.window(), override.maxRequests())
                    : base.withLimit(override.window(), override.maxRequests()));
        });
        return Collections.unmodifiableMap(table);
    }

    private static void put(Map<String, RateLimitPolicy> table, RateLimitPolicy policy) {
        table.put(policy.name(), policy);
    }

    /**
     * Configured replacement for a policy's window and limit.
     */
    public record PolicyOverride(Duration window, int maxRequests) {
    }
}
