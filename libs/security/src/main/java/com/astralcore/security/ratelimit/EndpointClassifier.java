package com.astralcore.security.ratelimit;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps a request path to the name of the rate-limit policy that governs it.
 * <p>
 * Rules are tried in order and the first matching prefix wins. Remaining {@code /api/}
 * paths fall back to {@code api:read} for safe methods and {@code api:write} otherwise;
 * everything else is {@code api:general}.
 */
public final class EndpointClassifier {

    private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");
    private static final Pattern API_PATH = Pattern.compile("^/api/.*");

    private final List<Rule> rules;

    public EndpointClassifier() {
        this(defaultRules());
    }

    public EndpointClassifier(List<Rule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        this.rules = List.copyOf(rules);
    }

    public static List<Rule> defaultRules() {
        return List.of(
                Rule.prefix("/api/auth/login", RateLimitPolicies.AUTH_LOGIN),
                Rule.prefix("/api/auth/register", RateLimitPolicies.AUTH_REGISTER),
                Rule.prefix("/api/auth/forgot-password", RateLimitPolicies.AUTH_FORGOT_PASSWORD),
                Rule.prefix("/api/auth/reset-password", RateLimitPolicies.AUTH_RESET_PASSWORD),
                Rule.prefix("/api/auth/mfa/verify", RateLimitPolicies.AUTH_MFA_VERIFY),
                Rule.prefix("/api/crisis/assess", RateLimitPolicies.CRISIS_ASSESS),
                Rule.prefix("/api/crisis/hotline", RateLimitPolicies.CRISIS_HOTLINE),
                Rule.prefix("/api/files/upload", RateLimitPolicies.FILES_UPLOAD),
                Rule.prefix("/api/wellness/mood", RateLimitPolicies.WELLNESS_MOOD),
                Rule.prefix("/api/journal", RateLimitPolicies.WELLNESS_JOURNAL),
                Rule.prefix("/api/search", RateLimitPolicies.SEARCH_GLOBAL),
                Rule.prefix("/api/notifications/send", RateLimitPolicies.NOTIFICATIONS_SEND));
    }

    public String classify(String method, String path) {
        if (path == null) {
            return RateLimitPolicies.API_GENERAL;
        }
        for (Rule rule : rules) {
            if (rule.pattern().matcher(path).lookingAt()) {
                return rule.policy();
            }
        }
        if (API_PATH.matcher(path).matches()) {
            String normalized = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
            return READ_METHODS.contains(normalized)
                    ? RateLimitPolicies.API_READ
                    : RateLimitPolicies.API_WRITE;
        }
        return RateLimitPolicies.API_GENERAL;
    }

    /**
     * A path pattern (matched from the start of the path) and the policy it selects.
     */
    public record Rule(Pattern pattern, String policy) {

        public static Rule prefix(String pathPrefix, String policy) {
            return new Rule(Pattern.compile(Pattern.quote(pathPrefix)), policy);
        }
    }
}
