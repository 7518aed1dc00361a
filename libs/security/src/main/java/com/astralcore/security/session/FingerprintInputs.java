package com.astralcore.security.session;

import com.astralcore.crypto.SecureTokens;
import com.astralcore.security.http.ClientIpResolver;
import com.astralcore.security.http.InboundRequest;
import com.astralcore.security.http.SecurityHeaders;

/**
 * Request attributes a session is bound to.
 */
public record FingerprintInputs(String userAgent, String acceptLanguage, String acceptEncoding,
                                String ipAddress) {

    private static final int FINGERPRINT_LENGTH = 32;

    public static FingerprintInputs from(InboundRequest request) {
        return new FingerprintInputs(
                request.header(SecurityHeaders.USER_AGENT),
                request.header(SecurityHeaders.ACCEPT_LANGUAGE),
                request.header(SecurityHeaders.ACCEPT_ENCODING),
                ClientIpResolver.resolve(request));
    }

    /**
     * First 32 hex characters of {@code sha256(userAgent|acceptLanguage|acceptEncoding|ip)},
     * with absent values as empty strings.
     */
    public String fingerprint() {
        String joined = String.join("|", orEmpty(userAgent), orEmpty(acceptLanguage),
                orEmpty(acceptEncoding), orEmpty(ipAddress));
        return SecureTokens.sha256Prefix(joined, FINGERPRINT_LENGTH);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
