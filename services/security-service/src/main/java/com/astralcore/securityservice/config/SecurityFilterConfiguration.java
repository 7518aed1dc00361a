package com.astralcore.securityservice.config;

import com.astralcore.audit.AuditTrail;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.ratelimit.RateLimitService;
import com.astralcore.security.session.SessionStore;
import com.astralcore.securityservice.web.CsrfFilter;
import com.astralcore.securityservice.web.RateLimitFilter;
import com.astralcore.securityservice.web.SessionFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Registers the security filters behind {@code RequestContextFilter}.
 *
 * <p>Order: session resolution, then rate limiting (keyed by the session's user when there is
 * one), then CSRF (bound to the session).
 */
@Configuration
public class SecurityFilterConfiguration {

    static final int SESSION_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
    static final int RATE_LIMIT_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;
    static final int CSRF_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 30;

    @Bean
    public FilterRegistrationBean<SessionFilter> sessionFilter(SessionStore sessionStore,
                                                               SecurityProperties properties) {
        FilterRegistrationBean<SessionFilter> registration =
                new FilterRegistrationBean<>(new SessionFilter(sessionStore, properties.production()));
        registration.setOrder(SESSION_FILTER_ORDER);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(RateLimitService rateLimitService,
                                                                   ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(rateLimitService, objectMapper));
        registration.setOrder(RATE_LIMIT_FILTER_ORDER);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<CsrfFilter> csrfFilter(CsrfTokenService csrfTokenService,
                                                         AuditTrail auditTrail,
                                                         ObjectMapper objectMapper) {
        FilterRegistrationBean<CsrfFilter> registration =
                new FilterRegistrationBean<>(new CsrfFilter(csrfTokenService, auditTrail, objectMapper));
        registration.setOrder(CSRF_FILTER_ORDER);
        return registration;
    }
}
