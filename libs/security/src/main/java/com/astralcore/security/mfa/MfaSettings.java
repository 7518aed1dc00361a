package com.astralcore.security.mfa;

import java.time.Duration;

/**
 * Tunables of the MFA engine.
 *
 * @param issuer                  name shown in authenticator apps
 * @param codeExpiry              lifetime of SMS/email codes
 * @param maxVerificationAttempts consecutive failures before lockout
 * @param lockoutDuration         how long a locked user is refused
 * @param backupCodeCount         backup codes issued per enrollment
 */
public record MfaSettings(
        String issuer,
        Duration codeExpiry,
        int maxVerificationAttempts,
        Duration lockoutDuration,
        int backupCodeCount
) {

    public static final MfaSettings DEFAULT =
            new MfaSettings("Astral Core", Duration.ofMinutes(5), 3, Duration.ofMinutes(15),
                    BackupCodes.DEFAULT_COUNT);

    public MfaSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (codeExpiry == null || codeExpiry.isNegative() || codeExpiry.isZero()) {
            throw new IllegalArgumentException("codeExpiry must be positive");
        }
        if (maxVerificationAttempts < 1) {
            throw new IllegalArgumentException("maxVerificationAttempts must be positive");
        }
        if (lockoutDuration == null || lockoutDuration.isNegative() || lockoutDuration.isZero()) {
            throw new IllegalArgumentException("lockoutDuration must be positive");
        }
        if (backupCodeCount < 1) {
            throw new IllegalArgumentException("backupCodeCount must be positive");
        }
    }
}
