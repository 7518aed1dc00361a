package com.astralcore.securityservice.config;

import com.astralcore.audit.AuditStore;
import com.astralcore.audit.AuditTrail;
import com.astralcore.audit.testing.InMemoryAuditStore;
import com.astralcore.crypto.EncryptionService;
import com.astralcore.crypto.HmacSigner;
import com.astralcore.crypto.KeyMaterial;
import com.astralcore.crypto.PasswordHasher;
import com.astralcore.crypto.PhiFieldEncryptor;
import com.astralcore.observability.PhiRedactor;
import com.astralcore.observability.SecurityMetrics;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.maintenance.MaintenanceScheduler;
import com.astralcore.security.mfa.BackupCodes;
import com.astralcore.security.mfa.MfaEnrollmentStore;
import com.astralcore.security.mfa.MfaService;
import com.astralcore.security.mfa.NotificationGateway;
import com.astralcore.security.mfa.TotpGenerator;
import com.astralcore.security.phi.PhiFieldPolicy;
import com.astralcore.security.phi.PhiRecordService;
import com.astralcore.security.phi.PhiRecordStore;
import com.astralcore.security.ratelimit.EndpointClassifier;
import com.astralcore.security.ratelimit.RateLimitPolicies;
import com.astralcore.security.ratelimit.RateLimitService;
import com.astralcore.security.ratelimit.ViolationTracker;
import com.astralcore.security.session.SessionStore;
import com.astralcore.security.testing.InMemoryMfaEnrollmentStore;
import com.astralcore.security.testing.InMemoryPhiRecordStore;
import com.astralcore.securityservice.notification.LoggingNotificationGateway;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Builds the security substrate as Spring beans.
 *
 * <p>Storage and delivery collaborators ({@link AuditStore}, {@link MfaEnrollmentStore},
 * {@link PhiRecordStore}, {@link NotificationGateway}) fall back to in-process implementations
 * when the application does not define its own.
 */
@Configuration
public class SecurityCoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SecurityCoreConfiguration.class);

    static final String SYSTEM_ACTOR = "system";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry registry, SecurityProperties properties) {
        return new SecurityMetrics(registry, properties.serviceName());
    }

    @Bean
    public PhiRedactor phiRedactor() {
        return new PhiRedactor();
    }

    // ---- Audit ----

    @Bean
    @ConditionalOnMissingBean
    public AuditStore auditStore() {
        log.warn("No AuditStore bean defined; audit events are kept in memory only");
        return new InMemoryAuditStore();
    }

    @Bean
    public ThreadPoolTaskExecutor auditExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("astral-audit-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public AuditTrail auditTrail(AuditStore store, Executor auditExecutor, Clock clock,
                                 SecurityMetrics metrics, PhiRedactor redactor,
                                 SecurityProperties properties) {
        return new AuditTrail(store, auditExecutor, clock, metrics, redactor,
                properties.audit().includeStackTraces());
    }

    // ---- Crypto ----

    @Bean
    public EncryptionService encryptionService(SecurityProperties properties, SecurityMetrics metrics) {
        SecurityProperties.Encryption encryption = properties.encryption();
        return new EncryptionService(KeyMaterial.fromHex(encryption.masterKey()),
                encryption.iterations(), new SecureRandom(), metrics);
    }

    @Bean
    public PasswordHasher passwordHasher(SecurityProperties properties) {
        return new PasswordHasher(properties.password().iterations());
    }

    @Bean
    public PhiFieldEncryptor phiFieldEncryptor(EncryptionService encryptionService) {
        return new PhiFieldEncryptor(encryptionService);
    }

    // ---- CSRF, rate limiting, sessions ----

    @Bean
    public CsrfTokenService csrfTokenService(SecurityProperties properties, Clock clock,
                                             SecurityMetrics metrics) {
        SecurityProperties.Csrf csrf = properties.csrf();
        return new CsrfTokenService(HmacSigner.fromSecret(csrf.secret()), csrf.tokenLifetime(),
                csrf.exemptPaths(), properties.production(), clock, metrics);
    }

    @Bean
    public RateLimitService rateLimitService(SecurityProperties properties, Clock clock,
                                             SecurityMetrics metrics, AuditTrail auditTrail) {
        SecurityProperties.RateLimit rateLimit = properties.rateLimit();
        if (!rateLimit.enabled()) {
            log.warn("Rate limiting is disabled");
        }
        return new RateLimitService(RateLimitPolicies.withOverrides(rateLimit.overrides()),
                new EndpointClassifier(), new ViolationTracker(clock), clock, metrics, auditTrail,
                rateLimit.enabled());
    }

    @Bean
    public SessionStore sessionStore(SecurityProperties properties, Clock clock, AuditTrail auditTrail,
                                     SecurityMetrics metrics) {
        SessionStore store = new SessionStore(properties.session().toPolicy(), clock, auditTrail, metrics,
                properties.production());
        metrics.gauge("astral.session.active", "Active sessions", store::activeCount);
        return store;
    }

    // ---- MFA ----

    @Bean
    @ConditionalOnMissingBean
    public MfaEnrollmentStore mfaEnrollmentStore() {
        log.warn("No MfaEnrollmentStore bean defined; MFA enrollments are kept in memory only");
        return new InMemoryMfaEnrollmentStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationGateway notificationGateway() {
        log.warn("No NotificationGateway bean defined; notifications are logged, not delivered");
        return new LoggingNotificationGateway();
    }

    @Bean
    public MfaService mfaService(MfaEnrollmentStore enrollments, EncryptionService encryptionService,
                                 NotificationGateway notifications, AuditTrail auditTrail,
                                 SecurityMetrics metrics, Clock clock, SecurityProperties properties) {
        return new MfaService(enrollments, encryptionService, new TotpGenerator(clock),
                new BackupCodes(new PasswordHasher(BackupCodes.DEFAULT_HASH_ITERATIONS)),
                notifications, auditTrail, metrics, clock, properties.mfa().toSettings());
    }

    // ---- PHI records ----

    @Bean
    @ConditionalOnMissingBean
    public PhiRecordStore phiRecordStore() {
        log.warn("No PhiRecordStore bean defined; PHI records are kept in memory only");
        return new InMemoryPhiRecordStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public PhiFieldPolicy phiFieldPolicy() {
        return PhiFieldPolicy.defaults();
    }

    @Bean
    public PhiRecordService phiRecordService(PhiRecordStore store, PhiFieldEncryptor encryptor,
                                             PhiFieldPolicy policy, AuditTrail auditTrail) {
        return new PhiRecordService(store, encryptor, policy, auditTrail);
    }

    // ---- Housekeeping ----

    @Bean(initMethod = "start", destroyMethod = "stop")
    public MaintenanceScheduler maintenanceScheduler(SecurityProperties properties,
                                                     SessionStore sessionStore,
                                                     RateLimitService rateLimitService,
                                                     MfaService mfaService,
                                                     AuditTrail auditTrail) {
        SecurityProperties.Audit audit = properties.audit();
        return new MaintenanceScheduler()
                .register("session-sweep", properties.maintenance().sweepInterval(), sessionStore::sweep)
                .register("rate-limit-sweep", properties.maintenance().sweepInterval(), rateLimitService::sweep)
                .register("mfa-sweep", properties.maintenance().sweepInterval(), mfaService::sweep)
                .register("audit-retention", audit.purgeInterval(),
                        () -> auditTrail.purgeOlderThan(audit.retention(), "hipaa-default", SYSTEM_ACTOR));
    }
}
