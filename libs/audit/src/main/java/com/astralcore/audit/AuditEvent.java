package com.astralcore.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable audit record as persisted by the {@link AuditStore}.
 *
 * @param id            unique event id
 * @param actorId       user who performed the action (nullable for anonymous or system events)
 * @param action        what happened, see {@link AuditActions}
 * @param entity        type of the affected resource (for example {@code Session})
 * @param entityId      id of the affected resource (nullable)
 * @param outcome       success, failure or error
 * @param details       redacted structured details
 * @param ipAddress     client IP (nullable)
 * @param userAgent     client user agent (nullable)
 * @param correlationId request correlation id (nullable)
 * @param timestamp     when the event was recorded
 */
public record AuditEvent(
        String id,
        String actorId,
        String action,
        String entity,
        String entityId,
        AuditOutcome outcome,
        Map<String, Object> details,
        String ipAddress,
        String userAgent,
        String correlationId,
        Instant timestamp
) {

    public AuditEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("entity must not be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
