package com.astralcore.security.mfa;

import java.util.List;

/**
 * Request to turn on a second factor.
 *
 * @param userId      the user
 * @param method      factor to enable
 * @param secret      TOTP secret from {@link MfaService#setupTotp} (TOTP only)
 * @param code        current TOTP code, or the code sent by SMS/email
 * @param contact     phone number or email address (SMS/EMAIL only)
 * @param backupCodes backup codes shown during setup, to be stored hashed (optional)
 */
public record MfaEnableRequest(
        String userId,
        MfaMethod method,
        String secret,
        String code,
        String contact,
        List<String> backupCodes
) {

    public MfaEnableRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (method == MfaMethod.TOTP && (secret == null || secret.isBlank())) {
            throw new IllegalArgumentException("secret is required for TOTP");
        }
        backupCodes = backupCodes == null ? List.of() : List.copyOf(backupCodes);
    }

    public static MfaEnableRequest totp(String userId, String secret, String code, List<String> backupCodes) {
        return new MfaEnableRequest(userId, MfaMethod.TOTP, secret, code, null, backupCodes);
    }

    public static MfaEnableRequest sms(String userId, String phoneNumber, String code) {
        return new MfaEnableRequest(userId, MfaMethod.SMS, null, code, phoneNumber, null);
    }

    public static MfaEnableRequest email(String userId, String email, String code) {
        return new MfaEnableRequest(userId, MfaMethod.EMAIL, null, code, email, null);
    }

    @Override
    public String toString() {
        return "MfaEnableRequest[userId=" + userId + ", method=" + method + "]";
    }
}
