package com.astralcore.audit;

import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only storage for audit events.
 * <p>
 * There is no update operation. The only deletion is
 * {@link #deleteOlderThan(Instant)}, which the trail calls from its audited retention purge.
 * Implementations may block; the trail never calls {@link #append(AuditEvent)} on a
 * request thread.
 */
public interface AuditStore {

    void append(AuditEvent event);

    /**
     * Returns the matching events, newest first, honouring the query's limit and offset.
     */
    List<AuditEvent> find(AuditQuery query);

    /**
     * Counts all matching events, ignoring limit and offset.
     */
    long count(AuditQuery query);

    /**
     * Deletes every event with a timestamp strictly before {@code cutoff}.
     *
     * @return the number of deleted events
     */
    long deleteOlderThan(Instant cutoff);
}
