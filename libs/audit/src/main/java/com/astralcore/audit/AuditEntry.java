package com.astralcore.audit;

/**
 * What a caller asks the {@link AuditTrail} to record. The trail adds the id, timestamp,
 * outcome and any request metadata the entry leaves unset.
 */
public record AuditEntry(
        String action,
        String entity,
        String entityId,
        String actorId,
        AuditDetails details,
        String ipAddress,
        String userAgent
) {

    public AuditEntry {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("entity must not be null or blank");
        }
        if (details == null) {
            details = AuditDetails.none();
        }
    }

    public static AuditEntry of(String action, String entity) {
        return new AuditEntry(action, entity, null, null, null, null, null);
    }

    public AuditEntry entityId(String entityId) {
        return new AuditEntry(action, entity, entityId, actorId, details, ipAddress, userAgent);
    }

    public AuditEntry actor(String actorId) {
        return new AuditEntry(action, entity, entityId, actorId, details, ipAddress, userAgent);
    }

    public AuditEntry details(AuditDetails details) {
        return new AuditEntry(action, entity, entityId, actorId, details, ipAddress, userAgent);
    }

    public AuditEntry client(String ipAddress, String userAgent) {
        return new AuditEntry(action, entity, entityId, actorId, details, ipAddress, userAgent);
    }
}
