package com.astralcore.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer counters for security outcomes, tagged with the owning service name.
 * <p>
 * One instance is shared by every security component of a process. Outcome tags are
 * always enum names, never caller-supplied values, so tag cardinality stays bounded.
 */
public final class SecurityMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String CSRF_VALIDATIONS = "astral.csrf.validations";
    public static final String RATE_LIMIT_DECISIONS = "astral.ratelimit.decisions";
    public static final String RATE_LIMIT_BLOCKED = "astral.ratelimit.blocked";
    public static final String SESSION_VALIDATIONS = "astral.session.validations";
    public static final String MFA_VERIFICATIONS = "astral.mfa.verifications";
    public static final String AUDIT_WRITE_FAILURES = "astral.audit.write.failures";
    public static final String INTEGRITY_FAILURES = "astral.crypto.integrity.failures";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Metrics backed by a private in-memory registry, for components constructed
     * outside a Spring context.
     */
    public static SecurityMetrics standalone() {
        return new SecurityMetrics(new SimpleMeterRegistry(), "standalone");
    }

    public void csrfValidation(String outcome) {
        counter(CSRF_VALIDATIONS, "CSRF token validation outcomes", "outcome", outcome).increment();
    }

    public void rateLimitDecision(String policy, boolean allowed) {
        counter(RATE_LIMIT_DECISIONS, "Rate limit decisions per policy",
                "policy", policy, "allowed", Boolean.toString(allowed)).increment();
    }

    public void rateLimitBlocked() {
        counter(RATE_LIMIT_BLOCKED, "Identifiers placed on the temporary block list").increment();
    }

    public void sessionValidation(String status) {
        counter(SESSION_VALIDATIONS, "Session validation outcomes", "status", status).increment();
    }

    public void mfaVerification(String outcome) {
        counter(MFA_VERIFICATIONS, "MFA verification outcomes", "outcome", outcome).increment();
    }

    public void auditWriteFailure() {
        counter(AUDIT_WRITE_FAILURES, "Audit events that could not be persisted").increment();
    }

    public void integrityFailure(String source) {
        counter(INTEGRITY_FAILURES, "Authenticated payloads that failed verification",
                "source", source).increment();
    }

    /**
     * Registers a gauge reading the supplier on every scrape.
     */
    public void gauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier)
                .description(description)
                .tags(baseTags())
                .register(registry);
    }

    /**
     * Creates (or looks up) a counter with the service tag plus the given tags.
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
