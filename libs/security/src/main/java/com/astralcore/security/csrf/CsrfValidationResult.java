package com.astralcore.security.csrf;

import java.util.Optional;

/**
 * Outcome of {@link CsrfTokenService#validate}, with the verified payload when there is one.
 */
public record CsrfValidationResult(CsrfOutcome outcome, CsrfPayload payload) {

    public static CsrfValidationResult of(CsrfOutcome outcome) {
        return new CsrfValidationResult(outcome, null);
    }

    public boolean valid() {
        return outcome.accepted();
    }

    public Optional<CsrfPayload> verifiedPayload() {
        return Optional.ofNullable(payload);
    }
}
