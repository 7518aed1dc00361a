package com.astralcore.securityservice.config;

import com.astralcore.audit.AuditTrail;
import com.astralcore.crypto.EncryptionService;
import com.astralcore.crypto.PasswordHasher;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.mfa.MfaSettings;
import com.astralcore.security.ratelimit.RateLimitPolicies;
import com.astralcore.security.session.SessionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the security substrate, bound from {@code astral.security.*}.
 *
 * <p>Every optional value falls back to its production default in the compact constructors, so
 * a deployment only has to provide the secrets:
 *
 * <pre>
 * astral:
 *   security:
 *     encryption:
 *       master-key: ${ENCRYPTION_MASTER_KEY}
 *     csrf:
 *       secret: ${CSRF_SECRET}
 * </pre>
 *
 * @param serviceName service name used as the {@code service} metric tag
 * @param environment deployment environment; anything but {@code production} drops the
 *     {@code Secure} cookie attribute
 * @param encryption field encryption settings
 * @param password password hashing settings
 * @param csrf anti-forgery token settings
 * @param session session lifetime settings
 * @param rateLimit rate limiting settings
 * @param mfa multi-factor authentication settings
 * @param audit audit trail settings
 * @param maintenance background sweep settings
 */
@ConfigurationProperties(prefix = "astral.security")
@Validated
public record SecurityProperties(
        String serviceName,
        String environment,
        @Valid Encryption encryption,
        Password password,
        @Valid Csrf csrf,
        Session session,
        RateLimit rateLimit,
        Mfa mfa,
        Audit audit,
        Maintenance maintenance) {

    public static final String PRODUCTION = "production";

    public SecurityProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "security-service";
        }
        if (environment == null || environment.isBlank()) {
            environment = PRODUCTION;
        }
        if (encryption == null) {
            encryption = new Encryption(null, 0);
        }
        if (password == null) {
            password = new Password(0);
        }
        if (csrf == null) {
            csrf = new Csrf(null, null, null);
        }
        if (session == null) {
            session = new Session(null, null, 0);
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(true, null);
        }
        if (mfa == null) {
            mfa = new Mfa(null, null, 0, null, 0);
        }
        if (audit == null) {
            audit = new Audit(0, false, null);
        }
        if (maintenance == null) {
            maintenance = new Maintenance(null);
        }
    }

    public boolean production() {
        return PRODUCTION.equalsIgnoreCase(environment);
    }

    /**
     * @param masterKey hex-encoded master key, at least 32 bytes
     * @param iterations PBKDF2 iterations for per-blob key derivation
     */
    public record Encryption(@NotBlank @Size(min = 64) String masterKey, int iterations) {

        public Encryption {
            if (iterations <= 0) {
                iterations = EncryptionService.DEFAULT_ITERATIONS;
            }
        }
    }

    public record Password(int iterations) {

        public Password {
            if (iterations <= 0) {
                iterations = PasswordHasher.DEFAULT_ITERATIONS;
            }
        }
    }

    /**
     * @param secret HMAC secret, at least 32 characters
     * @param tokenLifetime token validity
     * @param exemptPaths path prefixes that never require a token
     */
    public record Csrf(@NotBlank @Size(min = 32) String secret, Duration tokenLifetime, List<String> exemptPaths) {

        public Csrf {
            if (tokenLifetime == null) {
                tokenLifetime = CsrfTokenService.DEFAULT_LIFETIME;
            }
            exemptPaths = exemptPaths == null ? CsrfTokenService.DEFAULT_EXEMPT_PREFIXES : List.copyOf(exemptPaths);
        }
    }

    public record Session(Duration maxAge, Duration idleTimeout, int maxPerUser) {

        public Session {
            if (maxAge == null) {
                maxAge = SessionPolicy.DEFAULT.maxAge();
            }
            if (idleTimeout == null) {
                idleTimeout = SessionPolicy.DEFAULT.idleTimeout();
            }
            if (maxPerUser <= 0) {
                maxPerUser = SessionPolicy.DEFAULT.maxSessionsPerUser();
            }
        }

        public SessionPolicy toPolicy() {
            return new SessionPolicy(maxAge, idleTimeout, maxPerUser);
        }
    }

    /**
     * @param enabled whether limits are enforced at all
     * @param policies per-policy overrides keyed by policy name, e.g. {@code [auth:login]}
     */
    public record RateLimit(Boolean enabled, Map<String, PolicyOverride> policies) {

        public RateLimit {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            policies = policies == null ? Map.of() : Map.copyOf(policies);
        }

        public Map<String, RateLimitPolicies.PolicyOverride> overrides() {
            Map<String, RateLimitPolicies.PolicyOverride> result = new LinkedHashMap<>();
            policies.forEach((name, o) ->
                    result.put(name, new RateLimitPolicies.PolicyOverride(o.window(), o.maxRequests())));
            return result;
        }
    }

    public record PolicyOverride(Duration window, int maxRequests) {
    }

    public record Mfa(String issuer, Duration codeExpiry, int maxAttempts, Duration lockoutDuration,
                      int backupCodeCount) {

        public Mfa {
            MfaSettings defaults = MfaSettings.DEFAULT;
            if (issuer == null || issuer.isBlank()) {
                issuer = defaults.issuer();
            }
            if (codeExpiry == null) {
                codeExpiry = defaults.codeExpiry();
            }
            if (maxAttempts <= 0) {
                maxAttempts = defaults.maxVerificationAttempts();
            }
            if (lockoutDuration == null) {
                lockoutDuration = defaults.lockoutDuration();
            }
            if (backupCodeCount <= 0) {
                backupCodeCount = defaults.backupCodeCount();
            }
        }

        public MfaSettings toSettings() {
            return new MfaSettings(issuer, codeExpiry, maxAttempts, lockoutDuration, backupCodeCount);
        }
    }

    /**
     * @param retentionDays how long audit events are kept
     * @param includeStackTraces whether error events carry stack traces
     * @param purgeInterval how often the retention purge runs
     */
    public record Audit(int retentionDays, boolean includeStackTraces, Duration purgeInterval) {

        public Audit {
            if (retentionDays <= 0) {
                retentionDays = (int) AuditTrail.DEFAULT_RETENTION.toDays();
            }
            if (purgeInterval == null) {
                purgeInterval = Duration.ofDays(1);
            }
        }

        public Duration retention() {
            return Duration.ofDays(retentionDays);
        }
    }

    public record Maintenance(Duration sweepInterval) {

        public Maintenance {
            if (sweepInterval == null) {
                sweepInterval = Duration.ofMinutes(5);
            }
        }
    }
}
