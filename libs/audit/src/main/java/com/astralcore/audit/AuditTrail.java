package com.astralcore.audit;

import com.astralcore.common.error.ValidationFailureException;
import com.astralcore.observability.PhiRedactor;
import com.astralcore.observability.RequestContext;
import com.astralcore.observability.RequestContextHolder;
import com.astralcore.observability.SecurityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * The compliance audit trail shared by every security component.
 * <p>
 * Writes are asynchronous and fail open: {@link #record} hands the event to the store on
 * the configured executor and returns a future that always completes normally, with
 * {@code false} when the write failed. A failed write is logged in full on the
 * {@value #FALLBACK_LOGGER} channel and counted, so that lost events remain observable.
 * <p>
 * Request metadata (IP, user agent, correlation id, acting user) not given in the entry is
 * captured from {@link RequestContextHolder} on the calling thread, before the hand-off.
 */
public final class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    /** Logger that receives events which could not be persisted. */
    public static final String FALLBACK_LOGGER = "astral.audit.fallback";

    private static final Logger fallback = LoggerFactory.getLogger(FALLBACK_LOGGER);

    /** Default retention: seven years. */
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(2555);

    private static final String AUDIT_ENTITY = "AuditLog";

    private final AuditStore store;
    private final Executor executor;
    private final Clock clock;
    private final SecurityMetrics metrics;
    private final PhiRedactor redactor;
    private final boolean includeStackTraces;

    public AuditTrail(AuditStore store, Executor executor, Clock clock, SecurityMetrics metrics,
                      PhiRedactor redactor, boolean includeStackTraces) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.store = store;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
        this.redactor = redactor;
        this.includeStackTraces = includeStackTraces;
    }

    /**
     * Records an event with the given outcome.
     *
     * @return a future completing with {@code true} once persisted, {@code false} if the
     *         write failed; never completes exceptionally
     */
    public CompletableFuture<Boolean> record(AuditEntry entry, AuditOutcome outcome) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        AuditEvent event = toEvent(entry, outcome, entry.details().toMap());
        try {
            return CompletableFuture
                    .supplyAsync(() -> {
                        store.append(event);
                        return Boolean.TRUE;
                    }, executor)
                    .exceptionally(ex -> writeFailed(event, ex));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(writeFailed(event, e));
        }
    }

    public CompletableFuture<Boolean> recordSuccess(AuditEntry entry) {
        return record(entry, AuditOutcome.SUCCESS);
    }

    /**
     * Records a refused operation; the reason is merged into the entry's details.
     */
    public CompletableFuture<Boolean> recordFailure(AuditEntry entry, String reason) {
        return record(entry.details(merge(entry.details(), new AuditDetails.Failure(reason))),
                AuditOutcome.FAILURE);
    }

    /**
     * Records an unexpected error, normalised to its message (and stack trace when enabled).
     */
    public CompletableFuture<Boolean> recordError(AuditEntry entry, Throwable error) {
        AuditDetails errorDetails = AuditDetails.ErrorInfo.from(error, includeStackTraces);
        return record(entry.details(merge(entry.details(), errorDetails)), AuditOutcome.ERROR);
    }

    /**
     * Reads the trail.
     *
     * @throws ValidationFailureException when limit, offset or time range are invalid
     */
    public AuditPage query(AuditQuery query) {
        if (query == null) {
            throw new ValidationFailureException("query", "query must not be null");
        }
        if (query.limit() < 1 || query.limit() > AuditQuery.MAX_LIMIT) {
            throw new ValidationFailureException("limit",
                    "limit must be between 1 and %d".formatted(AuditQuery.MAX_LIMIT));
        }
        if (query.offset() < 0) {
            throw new ValidationFailureException("offset", "offset must not be negative");
        }
        if (query.from() != null && query.to() != null && query.from().isAfter(query.to())) {
            throw new ValidationFailureException("from", "from must not be after to");
        }
        return new AuditPage(store.find(query), store.count(query));
    }

    /**
     * Deletes events older than the retention period and records the purge itself as an
     * {@link AuditActions#AUDIT_RETENTION_PURGE} event.
     *
     * @return the number of purged events
     */
    public long purgeOlderThan(Duration retention, String policyName, String actorId) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new ValidationFailureException("retention", "retention must be positive");
        }
        if (policyName == null || policyName.isBlank()) {
            throw new ValidationFailureException("policyName", "policyName must not be blank");
        }
        Instant cutoff = clock.instant().minus(retention);
        AuditEntry entry = AuditEntry.of(AuditActions.AUDIT_RETENTION_PURGE, AUDIT_ENTITY)
                .actor(actorId);
        long purged;
        try {
            purged = store.deleteOlderThan(cutoff);
        } catch (RuntimeException e) {
            log.error("Audit retention purge failed for policy {}", policyName, e);
            recordError(entry, e);
            throw e;
        }
        log.info("Purged {} audit events older than {} (policy {})", purged, cutoff, policyName);
        recordSuccess(entry.details(
                new AuditDetails.RetentionPurge(purged, policyName, retention.toDays(), cutoff)));
        return purged;
    }

    private AuditEvent toEvent(AuditEntry entry, AuditOutcome outcome, Map<String, Object> details) {
        Optional<RequestContext> context = RequestContextHolder.get();
        String actorId = entry.actorId() != null
                ? entry.actorId()
                : context.map(RequestContext::userId).orElse(null);
        String ip = entry.ipAddress() != null
                ? entry.ipAddress()
                : context.map(RequestContext::clientIp).orElse(null);
        String userAgent = entry.userAgent() != null
                ? entry.userAgent()
                : context.map(RequestContext::userAgent).orElse(null);
        return new AuditEvent(
                UUID.randomUUID().toString(),
                actorId,
                entry.action(),
                entry.entity(),
                entry.entityId(),
                outcome,
                redactor.redact(details),
                ip,
                userAgent,
                context.map(RequestContext::correlationId).orElse(null),
                clock.instant());
    }

    private Boolean writeFailed(AuditEvent event, Throwable ex) {
        metrics.auditWriteFailure();
        fallback.error("Audit write failed: id={} action={} entity={} entityId={} actor={} "
                        + "outcome={} ip={} correlationId={} timestamp={} details={} cause={}",
                event.id(), event.action(), event.entity(), event.entityId(), event.actorId(),
                event.outcome(), event.ipAddress(), event.correlationId(), event.timestamp(),
                event.details(), ex.toString());
        return Boolean.FALSE;
    }

    private static AuditDetails merge(AuditDetails base, AuditDetails extra) {
        Map<String, Object> merged = new LinkedHashMap<>(base.toMap());
        merged.putAll(extra.toMap());
        return AuditDetails.attributes(merged);
    }
}
