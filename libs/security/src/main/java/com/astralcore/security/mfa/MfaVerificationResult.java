package com.astralcore.security.mfa;

import java.time.Instant;

/**
 * Answer to {@link MfaService#verify}.
 *
 * @param outcome           what happened
 * @param message           user-facing message
 * @param remainingAttempts attempts left before lockout (after a failed attempt), else {@code null}
 * @param lockedUntil       end of the lockout when {@link MfaOutcome#LOCKED}, else {@code null}
 */
public record MfaVerificationResult(
        MfaOutcome outcome,
        String message,
        Integer remainingAttempts,
        Instant lockedUntil
) {

    static MfaVerificationResult verified() {
        return new MfaVerificationResult(MfaOutcome.VERIFIED, "Verification successful", null, null);
    }

    static MfaVerificationResult notEnabled() {
        return new MfaVerificationResult(MfaOutcome.NOT_ENABLED,
                "Multi-factor authentication is not enabled", null, null);
    }

    static MfaVerificationResult locked(Instant lockedUntil) {
        return new MfaVerificationResult(MfaOutcome.LOCKED,
                "Too many failed attempts. Try again later.", 0, lockedUntil);
    }

    static MfaVerificationResult failed(MfaOutcome outcome, int remainingAttempts) {
        String message = switch (outcome) {
            case CODE_EXPIRED -> "Verification code expired. Request a new code.";
            case NO_PENDING_CODE -> "No verification code was requested. Request a new code.";
            default -> "Invalid verification code";
        };
        return new MfaVerificationResult(outcome, message, remainingAttempts, null);
    }

    public boolean success() {
        return outcome == MfaOutcome.VERIFIED;
    }
}
