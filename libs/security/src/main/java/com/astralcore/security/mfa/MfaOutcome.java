package com.astralcore.security.mfa;

/**
 * Result of an MFA verification attempt.
 */
public enum MfaOutcome {
    VERIFIED,
    INVALID_CODE,
    CODE_EXPIRED,
    NO_PENDING_CODE,
    LOCKED,
    NOT_ENABLED
}
