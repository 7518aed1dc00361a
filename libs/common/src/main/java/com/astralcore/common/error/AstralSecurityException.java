package com.astralcore.common.error;

/**
 * Base type for every failure raised by the security substrate.
 * <p>
 * Subclasses fix the {@link ErrorCategory}; the service boundary maps the category to a
 * status code without inspecting the concrete type.
 */
public abstract class AstralSecurityException extends RuntimeException {

    private final ErrorCategory category;

    protected AstralSecurityException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected AstralSecurityException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
