package com.astralcore.common.error;

/**
 * Thrown when ciphertext, a signature or any other authenticated payload fails to verify.
 * Callers must treat the data as untrusted and never fall back to the unverified value.
 */
public class IntegrityFailureException extends AstralSecurityException {

    public IntegrityFailureException(String message) {
        super(ErrorCategory.INTEGRITY_FAILURE, message);
    }

    public IntegrityFailureException(String message, Throwable cause) {
        super(ErrorCategory.INTEGRITY_FAILURE, message, cause);
    }
}
