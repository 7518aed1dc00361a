package com.astralcore.securityservice.web;

import com.astralcore.common.error.AstralSecurityException;
import com.astralcore.common.error.AuthenticationFailureException;
import com.astralcore.common.error.ErrorCategory;
import com.astralcore.common.error.RateLimitExceededException;
import com.astralcore.common.error.ValidationFailureException;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.security.http.SecurityHeaders;
import com.astralcore.securityservice.config.SecurityProperties;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://astralcore.dev/errors/rate-limit",
 *   "title": "Too Many Requests",
 *   "status": 429,
 *   "detail": "Too many requests. Please try again later.",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Integrity and internal failures only ever carry a generic detail, except that internal
 * errors show the exception message in the {@code development} environment.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_DETAIL = "An unexpected error occurred";
    static final String INVALID_REQUEST_DETAIL = "The request was invalid";

    private final boolean verboseErrors;

    public GlobalExceptionHandler(SecurityProperties properties) {
        this.verboseErrors = "development".equalsIgnoreCase(properties.environment());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimit(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded on policy {}", ex.policy());
        ProblemDetail problem = ProblemDetails.of(ErrorCategory.RATE_LIMIT_EXCEEDED,
                "Too Many Requests", "Too many requests. Please try again later.");
        problem.setProperty("retryAfter", ex.retryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(SecurityHeaders.RETRY_AFTER, Long.toString(ex.retryAfterSeconds()))
                .header(SecurityHeaders.RATE_LIMIT_RESET, Long.toString(ex.resetAt().getEpochSecond()))
                .body(problem);
    }

    @ExceptionHandler(AuthenticationFailureException.class)
    public ProblemDetail handleAuthentication(AuthenticationFailureException ex) {
        log.warn(SecurityMarkers.SECURITY, "Authentication failed: {}", ex.reason());
        return ProblemDetails.of(ErrorCategory.AUTHENTICATION_FAILURE, "Unauthorized", ex.getMessage());
    }

    @ExceptionHandler(ValidationFailureException.class)
    public ProblemDetail handleValidationFailure(ValidationFailureException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetails.of(ErrorCategory.VALIDATION_FAILURE,
                "Validation Error", ex.getMessage());
        if (ex.field() != null) {
            problem.setProperty("field", ex.field());
        }
        return problem;
    }

    @ExceptionHandler(AstralSecurityException.class)
    public ProblemDetail handleSecurity(AstralSecurityException ex) {
        ErrorCategory category = ex.category();
        if (category.exposesDetail()) {
            log.warn("Request failed ({}): {}", category.slug(), ex.getMessage());
            return ProblemDetails.of(category, title(category), ex.getMessage());
        }
        if (category == ErrorCategory.INTEGRITY_FAILURE) {
            log.error(SecurityMarkers.SECURITY, "Integrity failure while serving request", ex);
        } else {
            log.error("Internal server error", ex);
        }
        return ProblemDetails.of(category, title(category), GENERIC_DETAIL);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return ProblemDetails.of(ErrorCategory.VALIDATION_FAILURE, "Validation Error", detail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = verboseErrors && ex.getMessage() != null ? ex.getMessage() : INVALID_REQUEST_DETAIL;
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Spring MVC's own 4xx (unknown route, unsupported method, unreadable body)
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            log.debug("Request rejected by the framework: {}", ex.getMessage());
            return ProblemDetails.of(status, slug(status), status.getReasonPhrase(),
                    framework.getBody().getDetail());
        }
        log.error("Internal server error", ex);
        String detail = verboseErrors && ex.getMessage() != null ? ex.getMessage() : GENERIC_DETAIL;
        return ProblemDetails.of(ErrorCategory.INTERNAL_ERROR, "Internal Server Error", detail);
    }

    private static String slug(HttpStatus status) {
        return status.getReasonPhrase().toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    private static String title(ErrorCategory category) {
        return switch (category) {
            case VALIDATION_FAILURE -> "Validation Error";
            case AUTHENTICATION_FAILURE -> "Unauthorized";
            case RESOURCE_NOT_FOUND -> "Not Found";
            case RATE_LIMIT_EXCEEDED -> "Too Many Requests";
            case INTEGRITY_FAILURE, INTERNAL_ERROR -> "Internal Server Error";
        };
    }
}
