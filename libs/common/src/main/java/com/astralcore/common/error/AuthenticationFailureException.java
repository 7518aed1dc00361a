package com.astralcore.common.error;

/**
 * Thrown when a credential, session or second factor is rejected.
 * <p>
 * The message is safe to return to the caller: it never says which part of the
 * credential was wrong. The {@code reason} is for logs and audit only.
 */
public class AuthenticationFailureException extends AstralSecurityException {

    private final String reason;

    public AuthenticationFailureException(String reason) {
        super(ErrorCategory.AUTHENTICATION_FAILURE, "Authentication failed");
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
