package com.astralcore.security.csrf;

import com.astralcore.crypto.HmacSigner;
import com.astralcore.crypto.SecureTokens;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.observability.SecurityMetrics;
import com.astralcore.security.http.InboundRequest;
import com.astralcore.security.http.SecurityHeaders;
import com.astralcore.security.http.SetCookie;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Issues and validates HMAC-signed anti-forgery tokens.
 * <p>
 * A token is {@code base64(JSON payload) "." hex(HMAC-SHA256(base64 payload))}. Validation
 * checks, in order: presence, shape, signature (constant time), payload decoding, expiry,
 * then the user and session binding. Every outcome is counted and rejections are logged.
 * <p>
 * Only state-changing methods outside the exempt path prefixes require a token.
 */
public final class CsrfTokenService {

    private static final Logger log = LoggerFactory.getLogger(CsrfTokenService.class);

    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);
    public static final List<String> DEFAULT_EXEMPT_PREFIXES =
            List.of("/api/auth", "/api/webhook", "/api/health", "/api/status");

    private static final Set<String> PROTECTED_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final int NONCE_BYTES = 32;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HmacSigner signer;
    private final Duration lifetime;
    private final List<String> exemptPrefixes;
    private final boolean secureCookies;
    private final Clock clock;
    private final SecurityMetrics metrics;

    public CsrfTokenService(HmacSigner signer, Duration lifetime, List<String> exemptPrefixes,
                            boolean secureCookies, Clock clock, SecurityMetrics metrics) {
        if (signer == null) {
            throw new IllegalArgumentException("signer must not be null");
        }
        if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("lifetime must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.signer = signer;
        this.lifetime = lifetime;
        this.exemptPrefixes = exemptPrefixes == null ? List.of() : List.copyOf(exemptPrefixes);
        this.secureCookies = secureCookies;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Mints a token, bound to the user and session when they are given.
     */
    public CsrfToken issue(String userId, String sessionId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(lifetime);
        CsrfPayload payload = new CsrfPayload(now.toEpochMilli(), expiresAt.toEpochMilli(),
                userId, sessionId, SecureTokens.randomToken(NONCE_BYTES));
        String encoded;
        try {
            encoded = Base64.getEncoder().encodeToString(MAPPER.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize CSRF payload", e);
        }
        return new CsrfToken(encoded + "." + signer.sign(encoded), expiresAt);
    }

    /**
     * Validates the token a request presents: the {@code x-csrf-token} header, or else the
     * {@code __csrf_token} cookie. Requests that do not need protection are
     * {@link CsrfOutcome#NOT_REQUIRED}.
     *
     * @param userId    the authenticated user, or {@code null}
     * @param sessionId the presented session, or {@code null}
     */
    public CsrfValidationResult validate(InboundRequest request, String userId, String sessionId) {
        if (!requiresProtection(request.method(), request.path())) {
            return record(CsrfValidationResult.of(CsrfOutcome.NOT_REQUIRED), request.path());
        }
        String token = request.header(SecurityHeaders.CSRF_TOKEN);
        if (token == null || token.isBlank()) {
            token = request.cookie(SecurityHeaders.CSRF_COOKIE);
        }
        return record(check(token, userId, sessionId), request.path());
    }

    /**
     * Validates a token string directly.
     */
    public CsrfValidationResult validate(String token, String userId, String sessionId) {
        return record(check(token, userId, sessionId), null);
    }

    public boolean requiresProtection(String method, String path) {
        if (method == null || !PROTECTED_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            return false;
        }
        if (path == null) {
            return true;
        }
        for (String prefix : exemptPrefixes) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The cookie carrying {@code token}, lasting as long as the token does.
     */
    public SetCookie cookie(CsrfToken token) {
        return new SetCookie(SecurityHeaders.CSRF_COOKIE, token.token(), lifetime, secureCookies);
    }

    public Duration lifetime() {
        return lifetime;
    }

    private CsrfValidationResult check(String token, String userId, String sessionId) {
        if (token == null || token.isBlank()) {
            return CsrfValidationResult.of(CsrfOutcome.MISSING);
        }
        int separator = token.lastIndexOf('.');
        if (separator <= 0 || separator == token.length() - 1) {
            return CsrfValidationResult.of(CsrfOutcome.MALFORMED);
        }
        String encodedPayload = token.substring(0, separator);
        String signature = token.substring(separator + 1);
        if (!signer.verify(encodedPayload, signature)) {
            return CsrfValidationResult.of(CsrfOutcome.SIGNATURE_INVALID);
        }

        CsrfPayload payload;
        try {
            payload = MAPPER.readValue(Base64.getDecoder().decode(encodedPayload), CsrfPayload.class);
        } catch (IOException | IllegalArgumentException e) {
            return CsrfValidationResult.of(CsrfOutcome.PAYLOAD_INVALID);
        }
        if (payload == null || payload.nonce() == null || payload.expiresAt() <= 0) {
            return CsrfValidationResult.of(CsrfOutcome.PAYLOAD_INVALID);
        }

        if (clock.millis() > payload.expiresAt()) {
            return new CsrfValidationResult(CsrfOutcome.EXPIRED, payload);
        }
        if (payload.userId() != null && !Objects.equals(payload.userId(), userId)) {
            return new CsrfValidationResult(CsrfOutcome.USER_MISMATCH, payload);
        }
        if (payload.sessionId() != null && !Objects.equals(payload.sessionId(), sessionId)) {
            return new CsrfValidationResult(CsrfOutcome.SESSION_MISMATCH, payload);
        }
        return new CsrfValidationResult(CsrfOutcome.VALID, payload);
    }

    private CsrfValidationResult record(CsrfValidationResult result, String path) {
        metrics.csrfValidation(result.outcome().name());
        if (!result.valid()) {
            log.warn(SecurityMarkers.SECURITY, "CSRF validation failed: outcome={} path={}",
                    result.outcome(), path);
        } else if (result.outcome() == CsrfOutcome.VALID) {
            log.debug("CSRF token accepted for path {}", path);
        }
        return result;
    }
}
