package com.astralcore.audit;

import java.time.Instant;

/**
 * Filters for reading the audit trail. Every filter is optional; results are ordered newest
 * first and paged by {@code limit} and {@code offset}.
 */
public record AuditQuery(
        String actorId,
        String entity,
        String entityId,
        String action,
        AuditOutcome outcome,
        Instant from,
        Instant to,
        int limit,
        int offset
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1_000;

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether an event satisfies every filter (paging is not considered).
     */
    public boolean matches(AuditEvent event) {
        return (actorId == null || actorId.equals(event.actorId()))
                && (entity == null || entity.equals(event.entity()))
                && (entityId == null || entityId.equals(event.entityId()))
                && (action == null || action.equals(event.action()))
                && (outcome == null || outcome == event.outcome())
                && (from == null || !event.timestamp().isBefore(from))
                && (to == null || !event.timestamp().isAfter(to));
    }

    public static final class Builder {

        private String actorId;
        private String entity;
        private String entityId;
        private String action;
        private AuditOutcome outcome;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder between(Instant from, Instant to) {
            this.from = from;
            this.to = to;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public AuditQuery build() {
            return new AuditQuery(actorId, entity, entityId, action, outcome, from, to, limit, offset);
        }
    }
}
