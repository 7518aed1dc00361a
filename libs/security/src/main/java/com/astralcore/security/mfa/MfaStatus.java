package com.astralcore.security.mfa;

import java.time.Instant;

/**
 * Summary of a user's MFA enrollment, safe to show in account settings.
 */
public record MfaStatus(boolean enabled, MfaMethod method, Instant enabledAt, int backupCodesRemaining) {

    static MfaStatus disabled() {
        return new MfaStatus(false, null, null, 0);
    }
}
