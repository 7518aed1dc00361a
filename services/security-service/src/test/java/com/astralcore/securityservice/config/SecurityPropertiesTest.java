package com.astralcore.securityservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.astralcore.crypto.EncryptionService;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.mfa.MfaSettings;
import com.astralcore.security.session.SessionPolicy;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

@DisplayName("SecurityProperties")
class SecurityPropertiesTest {

    private static final String MASTER_KEY =
            "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
    private static final String CSRF_SECRET = "a-csrf-secret-that-is-long-enough-123";

    @Nested
    @DisplayName("defaults")
    class Defaults {

        private final SecurityProperties props =
                new SecurityProperties(null, null, null, null, null, null, null, null, null, null);

        @Test
        @DisplayName("assume production")
        void assumeProduction() {
            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.production()).isTrue();
            assertThat(props.serviceName()).isEqualTo("security-service");
        }

        @Test
        @DisplayName("use the library defaults for every section")
        void libraryDefaults() {
            assertThat(props.encryption().iterations()).isEqualTo(EncryptionService.DEFAULT_ITERATIONS);
            assertThat(props.csrf().tokenLifetime()).isEqualTo(CsrfTokenService.DEFAULT_LIFETIME);
            assertThat(props.csrf().exemptPaths()).isEqualTo(CsrfTokenService.DEFAULT_EXEMPT_PREFIXES);
            assertThat(props.session().toPolicy()).isEqualTo(SessionPolicy.DEFAULT);
            assertThat(props.mfa().toSettings()).isEqualTo(MfaSettings.DEFAULT);
            assertThat(props.rateLimit().enabled()).isTrue();
            assertThat(props.rateLimit().overrides()).isEmpty();
            assertThat(props.audit().retention()).isEqualTo(Duration.ofDays(2555));
            assertThat(props.maintenance().sweepInterval()).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("environment comparison ignores case")
        void environmentIgnoresCase() {
            var props = new SecurityProperties(null, "Production", null, null, null, null, null, null, null, null);
            assertThat(props.production()).isTrue();
        }
    }

    @Test
    @DisplayName("maps rate-limit overrides to library overrides")
    void mapsOverrides() {
        var rateLimit = new SecurityProperties.RateLimit(true,
                Map.of("auth:login", new SecurityProperties.PolicyOverride(Duration.ofMinutes(5), 10)));

        assertThat(rateLimit.overrides())
                .containsOnlyKeys("auth:login")
                .extractingByKey("auth:login")
                .satisfies(o -> {
                    assertThat(o.window()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(o.maxRequests()).isEqualTo(10);
                });
    }

    @Nested
    @DisplayName("binding")
    class Binding {

        private final ApplicationContextRunner runner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
                .withUserConfiguration(PropertiesConfiguration.class);

        @Test
        @DisplayName("binds kebab-case keys and durations")
        void bindsValues() {
            runner.withPropertyValues(
                            "astral.security.environment=development",
                            "astral.security.encryption.master-key=" + MASTER_KEY,
                            "astral.security.csrf.secret=" + CSRF_SECRET,
                            "astral.security.session.idle-timeout=10m",
                            "astral.security.rate-limit.policies.[auth:login].window=5m",
                            "astral.security.rate-limit.policies.[auth:login].max-requests=10")
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        SecurityProperties props = context.getBean(SecurityProperties.class);
                        assertThat(props.production()).isFalse();
                        assertThat(props.session().idleTimeout()).isEqualTo(Duration.ofMinutes(10));
                        assertThat(props.rateLimit().policies()).containsKey("auth:login");
                        assertThat(props.rateLimit().enabled()).isTrue();
                    });
        }

        @Test
        @DisplayName("keeps rate limiting on unless it is switched off explicitly")
        void rateLimitEnabledUnlessDisabled() {
            runner.withPropertyValues(
                            "astral.security.encryption.master-key=" + MASTER_KEY,
                            "astral.security.csrf.secret=" + CSRF_SECRET,
                            "astral.security.rate-limit.policies.[api:read].max-requests=7",
                            "astral.security.rate-limit.policies.[api:read].window=1m")
                    .run(context -> assertThat(context.getBean(SecurityProperties.class).rateLimit().enabled())
                            .isTrue());

            runner.withPropertyValues(
                            "astral.security.encryption.master-key=" + MASTER_KEY,
                            "astral.security.csrf.secret=" + CSRF_SECRET,
                            "astral.security.rate-limit.enabled=false")
                    .run(context -> assertThat(context.getBean(SecurityProperties.class).rateLimit().enabled())
                            .isFalse());
        }

        @Test
        @DisplayName("fails startup without a master key")
        void requiresMasterKey() {
            runner.withPropertyValues("astral.security.csrf.secret=" + CSRF_SECRET)
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("fails startup with a short CSRF secret")
        void rejectsShortCsrfSecret() {
            runner.withPropertyValues(
                            "astral.security.encryption.master-key=" + MASTER_KEY,
                            "astral.security.csrf.secret=too-short")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Configuration
    @EnableConfigurationProperties(SecurityProperties.class)
    static class PropertiesConfiguration {
    }
}
