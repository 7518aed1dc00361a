package com.astralcore.security.mfa;

/**
 * Result of enabling a second factor.
 */
public enum EnableOutcome {
    ENABLED,
    INVALID_CODE,
    CODE_EXPIRED,
    NO_PENDING_CODE,
    MISSING_CONTACT,
    LOCKED
}
