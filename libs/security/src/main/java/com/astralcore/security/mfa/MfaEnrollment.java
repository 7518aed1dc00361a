package com.astralcore.security.mfa;

import java.time.Instant;
import java.util.List;

/**
 * A user's enrolled second factor as persisted by the {@link MfaEnrollmentStore}.
 * <p>
 * The TOTP secret and the SMS/email contact are stored only as encrypted blobs; backup
 * codes only as salted slow hashes.
 *
 * @param userId            owner
 * @param method            enrolled factor
 * @param encryptedSecret   encrypted TOTP secret (TOTP only)
 * @param encryptedContact  encrypted phone number or email address (SMS/EMAIL only)
 * @param hashedBackupCodes unused backup codes, hashed
 * @param enabledAt         when the factor was enabled
 */
public record MfaEnrollment(
        String userId,
        MfaMethod method,
        String encryptedSecret,
        String encryptedContact,
        List<String> hashedBackupCodes,
        Instant enabledAt
) {

    public MfaEnrollment {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        hashedBackupCodes = hashedBackupCodes == null ? List.of() : List.copyOf(hashedBackupCodes);
    }

    public MfaEnrollment withBackupCodes(List<String> hashedBackupCodes) {
        return new MfaEnrollment(userId, method, encryptedSecret, encryptedContact,
                hashedBackupCodes, enabledAt);
    }

    @Override
    public String toString() {
        return "MfaEnrollment[userId=" + userId + ", method=" + method
                + ", backupCodes=" + hashedBackupCodes.size() + ", enabledAt=" + enabledAt + "]";
    }
}
