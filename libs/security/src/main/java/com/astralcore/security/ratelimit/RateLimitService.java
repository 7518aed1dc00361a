package com.astralcore.security.ratelimit;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditDetails;
import com.astralcore.audit.AuditEntry;
import com.astralcore.audit.AuditTrail;
import com.astralcore.common.error.RateLimitExceededException;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.observability.SecurityMetrics;
import com.astralcore.security.http.ClientIpResolver;
import com.astralcore.security.http.InboundRequest;
import com.astralcore.security.http.SecurityHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for rate limiting: one {@link FixedWindowRateLimiter} per policy, endpoint
 * classification, key derivation and the violation block list.
 * <p>
 * All counters are local to this process.
 */
public final class RateLimitService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private static final String ENTITY = "RateLimit";

    private final Map<String, FixedWindowRateLimiter> limiters;
    private final EndpointClassifier classifier;
    private final ViolationTracker violations;
    private final Clock clock;
    private final SecurityMetrics metrics;
    private final AuditTrail audit;
    private final boolean enabled;

    public RateLimitService(Map<String, RateLimitPolicy> policies, EndpointClassifier classifier,
                            ViolationTracker violations, Clock clock, SecurityMetrics metrics,
                            AuditTrail audit, boolean enabled) {
        if (policies == null || !policies.containsKey(RateLimitPolicies.API_GENERAL)) {
            throw new IllegalArgumentException(
                    "policies must define " + RateLimitPolicies.API_GENERAL);
        }
        if (classifier == null || violations == null || clock == null || metrics == null
                || audit == null) {
            throw new IllegalArgumentException("collaborators must not be null");
        }
        Map<String, FixedWindowRateLimiter> built = new LinkedHashMap<>();
        policies.forEach((name, policy) -> built.put(name, new FixedWindowRateLimiter(policy, clock)));
        this.limiters = Map.copyOf(built);
        this.classifier = classifier;
        this.violations = violations;
        this.clock = clock;
        this.metrics = metrics;
        this.audit = audit;
        this.enabled = enabled;
    }

    /**
     * Counts one request for {@code key} under the named policy. Unknown policy names fall
     * back to {@code api:general}.
     */
    public RateLimitDecision check(String policyName, String key) {
        FixedWindowRateLimiter limiter = limiter(policyName);
        RateLimitPolicy policy = limiter.policy();
        if (!enabled) {
            return RateLimitDecision.allow(policy.name(), policy.maxRequests(),
                    policy.maxRequests(), clock.instant().plus(policy.window()));
        }
        RateLimitDecision decision = limiter.check(key);
        if (!decision.allowed() && policy.neverBlock()) {
            log.warn("Rate limit exceeded on never-block policy {}; allowing request", policy.name());
            decision = RateLimitDecision.allow(policy.name(), decision.limit(), 0, decision.resetAt());
        }
        metrics.rateLimitDecision(policy.name(), decision.allowed());
        return decision;
    }

    /**
     * Classifies the request, derives its key and checks it. Callers on the block list are
     * rejected before any counter is touched, except on never-block policies.
     *
     * @param userId authenticated user id, or {@code null} for anonymous callers
     */
    public RateLimitDecision checkRequest(InboundRequest request, String userId) {
        String policyName = classifier.classify(request.method(), request.path());
        RateLimitPolicy policy = limiter(policyName).policy();
        String clientIp = ClientIpResolver.resolve(request);
        Instant now = clock.instant();

        if (enabled && !policy.neverBlock()) {
            Optional<Instant> blockedUntil = violations.blockedUntil(clientIp);
            if (blockedUntil.isPresent()) {
                metrics.rateLimitDecision(policy.name(), false);
                return RateLimitDecision.blocked(policy.name(), policy.maxRequests(),
                        blockedUntil.get(), now);
            }
        }

        String key = RateLimitKeys.forCaller(policy.name(), userId, clientIp,
                request.header(SecurityHeaders.USER_AGENT));
        RateLimitDecision decision = check(policy.name(), key);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded: policy={} path={} retryAfter={}s",
                    policy.name(), request.path(), decision.retryAfterSeconds());
            violations.recordViolation(clientIp).ifPresent(until -> onBlocked(clientIp, userId, until));
        }
        return decision;
    }

    /**
     * Like {@link #check} but throws when the request is rejected.
     *
     * @throws RateLimitExceededException when the budget is exhausted
     */
    public RateLimitDecision enforce(String policyName, String key) {
        RateLimitDecision decision = check(policyName, key);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision.policy(), decision.resetAt(),
                    decision.retryAfterSeconds());
        }
        return decision;
    }

    /**
     * Reports the state of {@code key} without consuming budget.
     */
    public RateLimitDecision status(String policyName, String key) {
        return limiter(policyName).peek(key);
    }

    /**
     * Un-counts a successful request for policies that only count failures (login). No-op
     * for policies that count every request.
     */
    public void recordSuccess(String policyName, String key) {
        FixedWindowRateLimiter limiter = limiter(policyName);
        if (!limiter.policy().countSuccesses()) {
            limiter.uncount(key);
        }
    }

    /**
     * Administrative override, e.g. after a successful step-up authentication.
     */
    public void reset(String policyName, String key) {
        limiter(policyName).reset(key);
        log.info("Rate limit reset for policy {}", policyName);
    }

    public void unblock(String clientIp) {
        violations.unblock(clientIp);
        log.info(SecurityMarkers.SECURITY, "Client removed from block list");
    }

    public String classify(String method, String path) {
        return classifier.classify(method, path);
    }

    public Optional<RateLimitPolicy> policy(String policyName) {
        FixedWindowRateLimiter limiter = limiters.get(policyName);
        return limiter == null ? Optional.empty() : Optional.of(limiter.policy());
    }

    public void sweep() {
        limiters.values().forEach(FixedWindowRateLimiter::sweep);
        violations.sweep();
    }

    public long trackedKeys() {
        return limiters.values().stream().mapToLong(FixedWindowRateLimiter::trackedKeys).sum();
    }

    public boolean enabled() {
        return enabled;
    }

    private FixedWindowRateLimiter limiter(String policyName) {
        FixedWindowRateLimiter limiter = policyName == null ? null : limiters.get(policyName);
        return limiter != null ? limiter : limiters.get(RateLimitPolicies.API_GENERAL);
    }

    private void onBlocked(String clientIp, String userId, Instant until) {
        metrics.rateLimitBlocked();
        log.warn(SecurityMarkers.SECURITY, "Client blocked until {} after repeated rate-limit violations",
                until);
        audit.recordFailure(AuditEntry.of(AuditActions.IP_BLOCKED, ENTITY)
                        .actor(userId)
                        .client(clientIp, null)
                        .details(new BlockDetails(until)),
                "repeated rate-limit violations");
    }

    private record BlockDetails(Instant blockedUntil) implements AuditDetails {

        @Override
        public Map<String, Object> toMap() {
            return Map.of("blockedUntil", blockedUntil.toString());
        }
    }
}
