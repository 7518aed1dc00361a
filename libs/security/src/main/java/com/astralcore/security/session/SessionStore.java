package com.astralcore.security.session;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditDetails;
import com.astralcore.audit.AuditEntry;
import com.astralcore.audit.AuditTrail;
import com.astralcore.crypto.HmacSigner;
import com.astralcore.crypto.SecureTokens;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.observability.SecurityMetrics;
import com.astralcore.security.http.SecurityHeaders;
import com.astralcore.security.http.SetCookie;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-process session store with device binding.
 * <p>
 * Sessions expire on absolute age and on idleness. A session is bound to the fingerprint
 * of the request that created it; a validation from a different fingerprint destroys the
 * session and revokes its id, unless the device was marked trusted. The expiry check and
 * the activity update run inside one atomic {@code compute}, so a session can never be
 * touched after it has expired.
 * <p>
 * Revoked ids (renewed, destroyed, hijack-suspected) are remembered for {@code maxAge} so
 * that replaying them reports {@link SessionStatus#REVOKED}.
 */
public final class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final String ENTITY = "Session";
    private static final int SESSION_ID_BYTES = 32;
    private static final int MAX_REVOKED_IDS = 100_000;

    private final SessionPolicy policy;
    private final Clock clock;
    private final AuditTrail audit;
    private final SecurityMetrics metrics;
    private final boolean secureCookies;
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();
    private final Cache<String, Instant> revoked;

    public SessionStore(SessionPolicy policy, Clock clock, AuditTrail audit, SecurityMetrics metrics,
                        boolean secureCookies) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (audit == null) {
            throw new IllegalArgumentException("audit must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.policy = policy;
        this.clock = clock;
        this.audit = audit;
        this.metrics = metrics;
        this.secureCookies = secureCookies;
        this.revoked = Caffeine.newBuilder()
                .maximumSize(MAX_REVOKED_IDS)
                .expireAfterWrite(policy.maxAge())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Creates a session bound to the request fingerprint. When the user already holds the
     * maximum number of sessions, the oldest are evicted first.
     */
    public Session create(String userId, String role, FingerprintInputs inputs, boolean mfaVerified) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (inputs == null) {
            throw new IllegalArgumentException("inputs must not be null");
        }
        Instant now = clock.instant();
        Session session = new Session(SecureTokens.randomToken(SESSION_ID_BYTES), userId, role,
                inputs.fingerprint(), now, now, false, inputs.ipAddress(), inputs.userAgent(),
                mfaVerified);

        List<Session> evicted = new ArrayList<>();
        sessionsByUser.compute(userId, (user, ids) -> {
            Set<String> owned = ids != null ? ids : ConcurrentHashMap.newKeySet();
            owned.removeIf(id -> !sessions.containsKey(id));
            List<Session> oldestFirst = owned.stream()
                    .map(sessions::get)
                    .filter(s -> s != null)
                    .sorted(Comparator.comparing(Session::createdAt))
                    .toList();
            int excess = oldestFirst.size() + 1 - policy.maxSessionsPerUser();
            for (int i = 0; i < excess; i++) {
                Session oldest = oldestFirst.get(i);
                sessions.remove(oldest.sessionId());
                owned.remove(oldest.sessionId());
                evicted.add(oldest);
            }
            sessions.put(session.sessionId(), session);
            owned.add(session.sessionId());
            return owned;
        });

        for (Session old : evicted) {
            log.info("Evicted oldest session of user {} (limit {})", userId, policy.maxSessionsPerUser());
            audit.recordSuccess(entry(AuditActions.SESSION_EVICTED, old)
                    .details(new SessionDetails("concurrent session limit", old.role())));
        }
        audit.recordSuccess(entry(AuditActions.SESSION_CREATED, session)
                .details(new SessionDetails(null, role)));
        log.debug("Created session for user {}", userId);
        return session;
    }

    /**
     * Validates a presented session id and, when valid, slides its idle timer.
     */
    public SessionValidation validate(String sessionId, FingerprintInputs inputs) {
        SessionValidation result = doValidate(sessionId, inputs);
        metrics.sessionValidation(result.status().name());
        return result;
    }

    private SessionValidation doValidate(String sessionId, FingerprintInputs inputs) {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionValidation.of(SessionStatus.NOT_FOUND);
        }
        if (revoked.getIfPresent(sessionId) != null) {
            return SessionValidation.of(SessionStatus.REVOKED);
        }
        Instant now = clock.instant();
        String presented = inputs == null ? null : inputs.fingerprint();
        AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.NOT_FOUND);
        AtomicReference<Session> removed = new AtomicReference<>();

        Session current = sessions.computeIfPresent(sessionId, (id, session) -> {
            SessionStatus verdict = evaluate(session, presented, now);
            status.set(verdict);
            if (verdict != SessionStatus.ACTIVE) {
                removed.set(session);
                return null;
            }
            return session.touch(now);
        });

        Session gone = removed.get();
        if (gone != null) {
            unindex(gone);
            onInvalidated(gone, status.get(), inputs);
        }
        return new SessionValidation(status.get(), current);
    }

    /**
     * Rotates the session id, keeping the session's data, and revokes the old id.
     *
     * @return the renewed session, or empty if the id is unknown, revoked or expired
     */
    public Optional<Session> renew(String sessionId) {
        if (sessionId == null || revoked.getIfPresent(sessionId) != null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Session old = sessions.remove(sessionId);
        if (old == null) {
            return Optional.empty();
        }
        revoked.put(sessionId, now);
        SessionStatus expiry = expiryStatus(old, now);
        if (expiry != null) {
            unindex(old);
            onInvalidated(old, expiry, null);
            return Optional.empty();
        }

        Session renewed = old.rotate(SecureTokens.randomToken(SESSION_ID_BYTES), now);
        sessionsByUser.compute(old.userId(), (user, ids) -> {
            Set<String> owned = ids != null ? ids : ConcurrentHashMap.newKeySet();
            owned.remove(sessionId);
            owned.add(renewed.sessionId());
            sessions.put(renewed.sessionId(), renewed);
            return owned;
        });
        audit.recordSuccess(entry(AuditActions.SESSION_RENEWED, renewed)
                .details(new SessionDetails("rotated", renewed.role())));
        return Optional.of(renewed);
    }

    /**
     * Destroys a session (logout) and revokes its id.
     *
     * @return whether a live session was destroyed
     */
    public boolean destroy(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        revoked.put(sessionId, clock.instant());
        unindex(session);
        audit.recordSuccess(entry(AuditActions.SESSION_DESTROYED, session));
        return true;
    }

    /**
     * Destroys every session of a user, e.g. after a password change.
     *
     * @return the number of destroyed sessions
     */
    public int destroyAllForUser(String userId) {
        Set<String> ids = sessionsByUser.remove(userId);
        if (ids == null) {
            return 0;
        }
        Instant now = clock.instant();
        int destroyed = 0;
        for (String id : ids) {
            if (sessions.remove(id) != null) {
                revoked.put(id, now);
                destroyed++;
            }
        }
        audit.recordSuccess(AuditEntry.of(AuditActions.SESSIONS_REVOKED_FOR_USER, ENTITY)
                .entityId(userId)
                .details(AuditDetails.attributes(Map.of("destroyed", destroyed))));
        log.info("Destroyed {} sessions for user {}", destroyed, userId);
        return destroyed;
    }

    /**
     * Marks the session's device as trusted (or not). A trusted session survives
     * fingerprint changes, e.g. a mobile client switching networks.
     */
    public boolean trustDevice(String sessionId, boolean trust) {
        Session updated = sessions.computeIfPresent(sessionId, (id, s) -> s.withTrustDevice(trust));
        if (updated == null) {
            return false;
        }
        audit.recordSuccess(entry(AuditActions.DEVICE_TRUST_CHANGED, updated)
                .details(AuditDetails.attributes(Map.of("trusted", trust))));
        return true;
    }

    /**
     * Records that the session passed a second factor.
     */
    public boolean markMfaVerified(String sessionId) {
        return sessions.computeIfPresent(sessionId, (id, s) -> s.withMfaVerified()) != null;
    }

    /**
     * Looks a session up without refreshing it.
     */
    public Optional<Session> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * The user's live sessions, oldest first.
     */
    public List<Session> sessionsForUser(String userId) {
        Set<String> ids = sessionsByUser.get(userId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
                .map(sessions::get)
                .filter(s -> s != null)
                .sorted(Comparator.comparing(Session::createdAt))
                .toList();
    }

    public SessionStats stats() {
        Instant now = clock.instant();
        List<Session> live = new ArrayList<>(sessions.values());
        Map<String, Long> byRole = live.stream().collect(Collectors.groupingBy(
                s -> s.role() == null ? "UNKNOWN" : s.role(), TreeMap::new, Collectors.counting()));
        double averageAge = live.stream()
                .mapToLong(s -> s.age(now).toSeconds())
                .average()
                .orElse(0);
        return new SessionStats(live.size(), new LinkedHashMap<>(byRole), averageAge);
    }

    public int activeCount() {
        return sessions.size();
    }

    /**
     * Removes sessions past either timeout and prunes the revocation list.
     *
     * @return the number of removed sessions
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Session session : sessions.values()) {
            SessionStatus expiry = expiryStatus(session, now);
            if (expiry != null && sessions.remove(session.sessionId(), session)) {
                unindex(session);
                audit.recordSuccess(entry(AuditActions.SESSION_EXPIRED, session)
                        .details(new SessionDetails(expiry.name(), session.role())));
                removed++;
            }
        }
        revoked.cleanUp();
        if (removed > 0) {
            log.debug("Session sweep removed {} expired sessions", removed);
        }
        return removed;
    }

    /**
     * The session cookie for {@code session}, lasting at most the session's max age.
     */
    public SetCookie cookie(Session session) {
        return new SetCookie(SecurityHeaders.SESSION_COOKIE, session.sessionId(), policy.maxAge(),
                secureCookies);
    }

    public SessionPolicy policy() {
        return policy;
    }

    private SessionStatus evaluate(Session session, String presentedFingerprint, Instant now) {
        SessionStatus expiry = expiryStatus(session, now);
        if (expiry != null) {
            return expiry;
        }
        if (!session.trustDevice()
                && !HmacSigner.constantTimeEquals(session.fingerprint(), presentedFingerprint)) {
            return SessionStatus.FINGERPRINT_MISMATCH;
        }
        return SessionStatus.ACTIVE;
    }

    private SessionStatus expiryStatus(Session session, Instant now) {
        if (session.age(now).compareTo(policy.maxAge()) > 0) {
            return SessionStatus.EXPIRED_BY_AGE;
        }
        if (session.idle(now).compareTo(policy.idleTimeout()) > 0) {
            return SessionStatus.EXPIRED_BY_IDLE;
        }
        return null;
    }

    private void onInvalidated(Session session, SessionStatus status, FingerprintInputs inputs) {
        if (status == SessionStatus.FINGERPRINT_MISMATCH) {
            revoked.put(session.sessionId(), clock.instant());
            log.error(SecurityMarkers.SECURITY,
                    "Possible session hijacking: fingerprint mismatch for user {}", session.userId());
            AuditEntry hijack = entry(AuditActions.SESSION_HIJACK_SUSPECTED, session)
                    .details(new SessionDetails("fingerprint mismatch", session.role()));
            if (inputs != null) {
                hijack = hijack.client(inputs.ipAddress(), inputs.userAgent());
            }
            audit.recordFailure(hijack, "fingerprint mismatch");
            return;
        }
        log.debug("Session of user {} expired: {}", session.userId(), status);
        audit.recordSuccess(entry(AuditActions.SESSION_EXPIRED, session)
                .details(new SessionDetails(status.name(), session.role())));
    }

    private void unindex(Session session) {
        sessionsByUser.computeIfPresent(session.userId(), (user, ids) -> {
            ids.remove(session.sessionId());
            return ids.isEmpty() ? null : ids;
        });
    }

    private static AuditEntry entry(String action, Session session) {
        // Session ids are bearer credentials; the trail only sees a digest.
        return AuditEntry.of(action, ENTITY)
                .entityId(SecureTokens.sha256Prefix(session.sessionId(), 16))
                .actor(session.userId());
    }

    private record SessionDetails(String reason, String role) implements AuditDetails {

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            if (reason != null) {
                map.put("reason", reason);
            }
            if (role != null) {
                map.put("role", role);
            }
            return map;
        }
    }
}
