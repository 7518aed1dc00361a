package com.astralcore.securityservice.web;

import com.astralcore.audit.AuditActions;
import com.astralcore.audit.AuditDetails;
import com.astralcore.audit.AuditEntry;
import com.astralcore.audit.AuditTrail;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.csrf.CsrfValidationResult;
import com.astralcore.security.http.ClientIpResolver;
import com.astralcore.security.http.SecurityHeaders;
import com.astralcore.security.session.Session;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects state-changing requests that do not carry a valid anti-forgery token.
 *
 * <p>The token is checked against the session resolved by {@link SessionFilter}, so this
 * filter has to run after it.
 */
public class CsrfFilter extends OncePerRequestFilter {

    private static final String ENTITY = "Csrf";

    private final CsrfTokenService csrf;
    private final AuditTrail audit;
    private final ObjectMapper objectMapper;

    public CsrfFilter(CsrfTokenService csrf, AuditTrail audit, ObjectMapper objectMapper) {
        this.csrf = csrf;
        this.audit = audit;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ServletInboundRequest inbound = new ServletInboundRequest(request);
        Session session = SessionFilter.currentSession(request);
        String userId = session == null ? null : session.userId();
        String sessionDigest = session == null ? null : SessionFilter.sessionDigest(session.sessionId());

        CsrfValidationResult result = csrf.validate(inbound, userId, sessionDigest);
        if (result.valid()) {
            filterChain.doFilter(request, response);
            return;
        }

        audit.recordFailure(AuditEntry.of(AuditActions.CSRF_REJECTED, ENTITY)
                        .actor(userId)
                        .client(ClientIpResolver.resolve(inbound), inbound.header(SecurityHeaders.USER_AGENT))
                        .details(AuditDetails.attributes(Map.of(
                                "method", inbound.method(),
                                "path", inbound.path(),
                                "outcome", result.outcome().name()))),
                "CSRF validation failed");

        ProblemDetail problem = ProblemDetails.of(HttpStatus.FORBIDDEN, "csrf", "Forbidden",
                "CSRF validation failed");
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
