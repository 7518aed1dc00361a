package com.astralcore.security.csrf;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Signed content of an anti-forgery token. Times are epoch milliseconds.
 *
 * @param issuedAt  when the token was minted
 * @param expiresAt after this instant the token is rejected
 * @param userId    user the token is bound to, if any
 * @param sessionId session the token is bound to, if any
 * @param nonce     32 random bytes, hex
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CsrfPayload(long issuedAt, long expiresAt, String userId, String sessionId, String nonce) {
}
