package com.astralcore.security.session;

/**
 * Result of validating a session id.
 */
public enum SessionStatus {
    ACTIVE,
    NOT_FOUND,
    REVOKED,
    EXPIRED_BY_AGE,
    EXPIRED_BY_IDLE,
    FINGERPRINT_MISMATCH
}
