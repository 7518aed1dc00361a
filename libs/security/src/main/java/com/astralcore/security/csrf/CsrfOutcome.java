package com.astralcore.security.csrf;

/**
 * Result of validating an anti-forgery token. Only {@link #VALID} and {@link #NOT_REQUIRED}
 * let a request through.
 */
public enum CsrfOutcome {
    VALID,
    NOT_REQUIRED,
    MISSING,
    MALFORMED,
    SIGNATURE_INVALID,
    PAYLOAD_INVALID,
    EXPIRED,
    USER_MISMATCH,
    SESSION_MISMATCH;

    public boolean accepted() {
        return this == VALID || this == NOT_REQUIRED;
    }
}
