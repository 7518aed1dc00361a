package com.astralcore.common.error;

/**
 * Thrown when caller-supplied input is malformed or out of range.
 */
public class ValidationFailureException extends AstralSecurityException {

    private final String field;

    public ValidationFailureException(String field, String message) {
        super(ErrorCategory.VALIDATION_FAILURE, message);
        this.field = field;
    }

    /**
     * The offending input field, or {@code null} when the failure is not field-specific.
     */
    public String field() {
        return field;
    }
}
