package com.astralcore.common.error;

/**
 * Closed set of failure categories surfaced by the security substrate.
 * <p>
 * Each category carries the HTTP status the service boundary maps it to and a stable
 * machine-readable slug used in problem-detail {@code type} URIs and metric tags.
 */
public enum ErrorCategory {

    VALIDATION_FAILURE(400, "validation"),
    AUTHENTICATION_FAILURE(401, "authentication"),
    RESOURCE_NOT_FOUND(404, "not-found"),
    RATE_LIMIT_EXCEEDED(429, "rate-limit"),
    INTEGRITY_FAILURE(500, "integrity"),
    INTERNAL_ERROR(500, "internal");

    private final int httpStatus;
    private final String slug;

    ErrorCategory(int httpStatus, String slug) {
        this.httpStatus = httpStatus;
        this.slug = slug;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String slug() {
        return slug;
    }

    /**
     * Whether the caller may be shown the exception message. Integrity and internal
     * failures only ever surface a generic message.
     */
    public boolean exposesDetail() {
        return this != INTEGRITY_FAILURE && this != INTERNAL_ERROR;
    }
}
