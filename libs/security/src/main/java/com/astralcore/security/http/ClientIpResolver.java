package com.astralcore.security.http;

/**
 * Resolves the client IP address behind proxies.
 * <p>
 * Order: first hop of {@code x-forwarded-for}, then {@code x-real-ip}, then
 * {@code cf-connecting-ip}, then the transport peer address, then {@value #FALLBACK_IP}.
 */
public final class ClientIpResolver {

    public static final String FALLBACK_IP = "127.0.0.1";

    private ClientIpResolver() {
        // Utility class
    }

    public static String resolve(InboundRequest request) {
        String forwarded = request.header(SecurityHeaders.X_FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.header(SecurityHeaders.X_REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String cloudflare = request.header(SecurityHeaders.CF_CONNECTING_IP);
        if (cloudflare != null && !cloudflare.isBlank()) {
            return cloudflare.trim();
        }
        String remote = request.remoteAddress();
        return remote == null || remote.isBlank() ? FALLBACK_IP : remote;
    }
}
