package com.astralcore.security.csrf;

import java.time.Instant;

/**
 * A freshly issued anti-forgery token.
 *
 * @param token     wire form, {@code base64(payload) "." hexSignature}
 * @param expiresAt when the token stops validating
 */
public record CsrfToken(String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "CsrfToken[expiresAt=" + expiresAt + "]";
    }
}
