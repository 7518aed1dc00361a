package com.astralcore.securityservice.web;

import com.astralcore.crypto.SecureTokens;
import com.astralcore.observability.RequestContextHolder;
import com.astralcore.security.http.SecurityHeaders;
import com.astralcore.security.http.SetCookie;
import com.astralcore.security.session.FingerprintInputs;
import com.astralcore.security.session.Session;
import com.astralcore.security.session.SessionStore;
import com.astralcore.security.session.SessionValidation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the {@code __session} cookie to an active {@link Session}.
 *
 * <p>A valid session is exposed as the {@link #SESSION_ATTRIBUTE} request attribute and its
 * user is bound to the request context. An invalid one never fails the request here; the
 * cookie is cleared and the request continues anonymously.
 */
public class SessionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionFilter.class);

    public static final String SESSION_ATTRIBUTE = SessionFilter.class.getName() + ".session";

    private static final int SESSION_DIGEST_LENGTH = 16;

    private final SessionStore sessions;
    private final boolean secureCookies;

    public SessionFilter(SessionStore sessions, boolean secureCookies) {
        this.sessions = sessions;
        this.secureCookies = secureCookies;
    }

    /**
     * The digest under which a session id appears in logs, audit events and CSRF bindings.
     */
    public static String sessionDigest(String sessionId) {
        return sessionId == null ? null : SecureTokens.sha256Prefix(sessionId, SESSION_DIGEST_LENGTH);
    }

    public static Session currentSession(HttpServletRequest request) {
        Object session = request.getAttribute(SESSION_ATTRIBUTE);
        return session instanceof Session s ? s : null;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ServletInboundRequest inbound = new ServletInboundRequest(request);
        String sessionId = inbound.cookie(SecurityHeaders.SESSION_COOKIE);
        if (sessionId != null && !sessionId.isBlank()) {
            SessionValidation validation = sessions.validate(sessionId, FingerprintInputs.from(inbound));
            if (validation.active()) {
                Session session = validation.session();
                request.setAttribute(SESSION_ATTRIBUTE, session);
                RequestContextHolder.bindIdentity(session.userId(), sessionDigest(sessionId));
            } else {
                log.debug("Presented session rejected: {}", validation.status());
                response.addHeader(HttpHeaders.SET_COOKIE,
                        SetCookie.expire(SecurityHeaders.SESSION_COOKIE, secureCookies).headerValue());
            }
        }
        filterChain.doFilter(request, response);
    }
}
