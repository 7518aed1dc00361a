package com.astralcore.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link RequestContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, requestId, userId, sessionId,
 * clientIp) are populated so that every log statement on this thread includes them.
 * The user agent is deliberately left out of MDC. When cleared, all keys are removed.
 * <p>
 * Work handed to another thread does not inherit the context; capture it with
 * {@link #get()} and use {@link #runWithContext(RequestContext, Runnable)} on the other side.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // Utility class
    }

    /**
     * Sets the request context for the current thread and populates SLF4J MDC.
     *
     * @param context the request context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the request context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Rebinds the current context to an authenticated identity once a session has been
     * validated. No-op when no context is set.
     */
    public static void bindIdentity(String userId, String sessionId) {
        RequestContext current = CONTEXT.get();
        if (current != null) {
            set(current.withIdentity(userId, sessionId));
        }
    }

    /**
     * Executes a {@link Runnable} with the given context set, then restores the previous
     * context (or clears if there was none).
     *
     * @param context  the context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(RequestContext context, Runnable runnable) {
        RequestContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(RequestContext ctx) {
        setMdc(RequestContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(RequestContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(RequestContext.MDC_USER_ID, ctx.userId());
        setMdc(RequestContext.MDC_SESSION_ID, ctx.sessionId());
        setMdc(RequestContext.MDC_CLIENT_IP, ctx.clientIp());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_REQUEST_ID);
        MDC.remove(RequestContext.MDC_USER_ID);
        MDC.remove(RequestContext.MDC_SESSION_ID);
        MDC.remove(RequestContext.MDC_CLIENT_IP);
    }
}
