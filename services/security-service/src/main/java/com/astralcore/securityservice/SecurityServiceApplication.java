package com.astralcore.securityservice;

import com.astralcore.securityservice.config.SecurityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Astral Core security service.
 *
 * <p>Hosts the security substrate behind HTTP: request context, rate limiting, session
 * resolution and CSRF filters, the CSRF token endpoint and RFC 7807 error mapping. Actuator
 * exposes health and the {@code astral.*} security metrics.
 */
@SpringBootApplication
@EnableConfigurationProperties(SecurityProperties.class)
public class SecurityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecurityServiceApplication.class, args);
    }
}
