package com.astralcore.security.mfa;

import java.util.List;

/**
 * Material shown to the user once while setting up an authenticator app. Nothing here is
 * persisted until {@link MfaService#enable} succeeds.
 *
 * @param secret      Base32 TOTP secret, for manual entry
 * @param qrPayload   {@code otpauth://} URI to render as a QR code
 * @param backupCodes plaintext backup codes
 */
public record TotpEnrollment(String secret, String qrPayload, List<String> backupCodes) {

    public TotpEnrollment {
        backupCodes = List.copyOf(backupCodes);
    }

    @Override
    public String toString() {
        return "TotpEnrollment[REDACTED]";
    }
}
