package com.astralcore.observability;

/**
 * Immutable per-request metadata captured at the HTTP boundary.
 * <p>
 * The security components read this context when they need caller metadata that is not
 * part of their own inputs: the audit trail stamps IP address, user agent and correlation
 * id onto every event, and log lines pick the same values up through SLF4J MDC.
 *
 * @param correlationId unique ID for the business flow, echoed to the client
 * @param requestId     unique ID for this specific request
 * @param userId        authenticated user (nullable before authentication)
 * @param sessionId     digest of the current session id, never the id itself (nullable)
 * @param clientIp      resolved client IP address (nullable for internal calls)
 * @param userAgent     raw {@code User-Agent} header (nullable)
 */
public record RequestContext(
        String correlationId,
        String requestId,
        String userId,
        String sessionId,
        String clientIp,
        String userAgent
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** MDC key for client IP. */
    public static final String MDC_CLIENT_IP = "clientIp";

    public RequestContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy bound to the given authenticated identity.
     */
    public RequestContext withIdentity(String userId, String sessionId) {
        return new RequestContext(correlationId, requestId, userId, sessionId, clientIp, userAgent);
    }
}
