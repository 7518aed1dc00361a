package com.astralcore.audit;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured payload attached to an audit event.
 * <p>
 * Components define their own record implementations; the trail persists whatever
 * {@link #toMap()} returns after redaction. The generic variants below cover failures,
 * errors, retention purges and free-form attributes.
 */
public interface AuditDetails {

    Map<String, Object> toMap();

    static AuditDetails none() {
        return () -> Map.of();
    }

    static AuditDetails attributes(Map<String, ?> attributes) {
        return new Attributes(attributes);
    }

    /**
     * Reason an operation was refused.
     */
    record Failure(String reason) implements AuditDetails {

        @Override
        public Map<String, Object> toMap() {
            return reason == null ? Map.of() : Map.of("reason", reason);
        }
    }

    /**
     * Unexpected error, normalised to a message and (optionally) a stack trace.
     */
    record ErrorInfo(String message, String stack) implements AuditDetails {

        private static final int MAX_STACK_LENGTH = 4_000;

        public static ErrorInfo from(Throwable throwable, boolean includeStack) {
            String message = throwable.getMessage() != null
                    ? throwable.getMessage()
                    : throwable.getClass().getSimpleName();
            if (!includeStack) {
                return new ErrorInfo(message, null);
            }
            StringWriter writer = new StringWriter();
            throwable.printStackTrace(new PrintWriter(writer));
            String stack = writer.toString();
            if (stack.length() > MAX_STACK_LENGTH) {
                stack = stack.substring(0, MAX_STACK_LENGTH);
            }
            return new ErrorInfo(message, stack);
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("message", message);
            if (stack != null) {
                map.put("stack", stack);
            }
            return map;
        }
    }

    /**
     * Summary of a retention purge.
     */
    record RetentionPurge(long purgedCount, String policy, long retentionDays, Instant cutoff)
            implements AuditDetails {

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("purgedCount", purgedCount);
            map.put("policy", policy);
            map.put("retentionDays", retentionDays);
            map.put("cutoff", cutoff.toString());
            return map;
        }
    }

    /**
     * Free-form attributes, for call sites with no dedicated payload type.
     */
    record Attributes(Map<String, ?> values) implements AuditDetails {

        public Attributes {
            values = values == null ? Map.of() : new LinkedHashMap<>(values);
        }

        @Override
        public Map<String, Object> toMap() {
            return new LinkedHashMap<>(values);
        }
    }
}
