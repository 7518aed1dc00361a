package com.astralcore.security.session;

import java.util.Optional;

/**
 * Status of a validated session id and, when active, the refreshed session.
 */
public record SessionValidation(SessionStatus status, Session session) {

    static SessionValidation of(SessionStatus status) {
        return new SessionValidation(status, null);
    }

    public boolean active() {
        return status == SessionStatus.ACTIVE;
    }

    public Optional<Session> activeSession() {
        return Optional.ofNullable(session);
    }
}
