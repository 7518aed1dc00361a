package com.astralcore.securityservice.web;

import com.astralcore.common.error.ErrorCategory;
import com.astralcore.observability.RequestContextHolder;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds RFC 7807 responses with the fields every Astral error carries: a type URI, a
 * timestamp and the correlation id of the request.
 */
public final class ProblemDetails {

    public static final String TYPE_BASE = "https://astralcore.dev/errors/";

    private ProblemDetails() {
        // Utility class
    }

    public static ProblemDetail of(ErrorCategory category, String title, String detail) {
        return of(HttpStatus.valueOf(category.httpStatus()), category.slug(), title, detail);
    }

    public static ProblemDetail of(HttpStatus status, String typeSlug, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + typeSlug));
        problem.setProperty("timestamp", Instant.now().toString());
        RequestContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
