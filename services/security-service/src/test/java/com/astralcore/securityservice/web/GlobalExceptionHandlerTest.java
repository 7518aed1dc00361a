package com.astralcore.securityservice.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.astralcore.common.error.AuthenticationFailureException;
import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.common.error.RateLimitExceededException;
import com.astralcore.common.error.ResourceNotFoundException;
import com.astralcore.common.error.ValidationFailureException;
import com.astralcore.observability.RequestContextHolder;
import com.astralcore.observability.testing.TestRequestContextFactory;
import com.astralcore.securityservice.config.SecurityProperties;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(properties("production"));

    private static SecurityProperties properties(String environment) {
        return new SecurityProperties("security-service", environment,
                null, null, null, null, null, null, null, null);
    }

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Nested
    @DisplayName("security exceptions")
    class SecurityExceptions {

        @Test
        @DisplayName("rate limit maps to 429 with Retry-After")
        void rateLimit() {
            Instant resetAt = Instant.parse("2025-01-01T00:01:00Z");
            ResponseEntity<ProblemDetail> result = handler.handleRateLimit(
                    new RateLimitExceededException("auth:login", resetAt, 42));

            assertThat(result.getStatusCode().value()).isEqualTo(429);
            assertThat(result.getHeaders().getFirst("Retry-After")).isEqualTo("42");
            assertThat(result.getHeaders().getFirst("X-RateLimit-Reset"))
                    .isEqualTo(Long.toString(resetAt.getEpochSecond()));
            assertThat(result.getBody().getType().toString()).endsWith("/rate-limit");
        }

        @Test
        @DisplayName("authentication failures keep the generic message")
        void authentication() {
            ProblemDetail result = handler.handleAuthentication(
                    new AuthenticationFailureException("wrong password for user-1"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getDetail()).isEqualTo("Authentication failed");
        }

        @Test
        @DisplayName("validation failures name the field")
        void validation() {
            ProblemDetail result = handler.handleValidationFailure(
                    new ValidationFailureException("criteria", "Encrypted fields cannot be used as search criteria"));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getProperties()).containsEntry("field", "criteria");
        }

        @Test
        @DisplayName("not found maps to 404 with the message")
        void notFound() {
            ProblemDetail result = handler.handleSecurity(new ResourceNotFoundException("Patient", "p-1"));

            assertThat(result.getStatus()).isEqualTo(404);
            assertThat(result.getTitle()).isEqualTo("Not Found");
            assertThat(result.getDetail()).isNotBlank();
        }

        @Test
        @DisplayName("integrity failures never reveal their message")
        void integrity() {
            ProblemDetail result = handler.handleSecurity(
                    new IntegrityFailureException("tag mismatch on field diagnosis"));

            assertThat(result.getStatus()).isEqualTo(500);
            assertThat(result.getDetail()).isEqualTo(GlobalExceptionHandler.GENERIC_DETAIL);
        }
    }

    @Nested
    @DisplayName("other exceptions")
    class OtherExceptions {

        @Test
        @DisplayName("maps IllegalArgumentException to 400 Bad Request without its message in production")
        void illegalArgument() {
            ProblemDetail result = handler.handleIllegalArgument(
                    new IllegalArgumentException("userId must not be null or blank"));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getDetail()).isEqualTo(GlobalExceptionHandler.INVALID_REQUEST_DETAIL);
            assertThat(result.getTitle()).isEqualTo("Bad Request");
        }

        @Test
        @DisplayName("shows the IllegalArgumentException message in development")
        void illegalArgumentVerboseInDevelopment() {
            var developmentHandler = new GlobalExceptionHandler(properties("development"));

            ProblemDetail result = developmentHandler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

            assertThat(result.getDetail()).isEqualTo("invalid input");
        }

        @Test
        @DisplayName("hides internal error messages in production")
        void genericInProduction() {
            ProblemDetail result = handler.handleGeneric(new RuntimeException("db password rejected"));

            assertThat(result.getStatus()).isEqualTo(500);
            assertThat(result.getDetail()).isEqualTo(GlobalExceptionHandler.GENERIC_DETAIL);
        }

        @Test
        @DisplayName("shows internal error messages in development")
        void verboseInDevelopment() {
            var developmentHandler = new GlobalExceptionHandler(properties("development"));

            ProblemDetail result = developmentHandler.handleGeneric(new RuntimeException("something broke"));

            assertThat(result.getDetail()).isEqualTo("something broke");
        }

        @Test
        @DisplayName("keeps the status of framework errors")
        void frameworkErrors() {
            ProblemDetail result = handler.handleGeneric(new NoResourceFoundException(HttpMethod.GET, "missing"));

            assertThat(result.getStatus()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("problems carry timestamp and correlation id")
    void enrichment() {
        RequestContextHolder.set(TestRequestContextFactory.anonymous());

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", TestRequestContextFactory.DEFAULT_CORRELATION_ID);
    }
}
