package com.astralcore.securityservice.api;

import com.astralcore.security.csrf.CsrfToken;
import com.astralcore.security.csrf.CsrfTokenService;
import com.astralcore.security.session.Session;
import com.astralcore.securityservice.web.SessionFilter;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues anti-forgery tokens to browser clients.
 *
 * <p>The token is bound to the caller's session when one is present and is returned both in
 * the body (for the {@code x-csrf-token} header) and as the {@code __csrf_token} cookie.
 */
@RestController
@RequestMapping("/api")
public class CsrfTokenController {

    private final CsrfTokenService csrf;

    public CsrfTokenController(CsrfTokenService csrf) {
        this.csrf = csrf;
    }

    @GetMapping("/csrf-token")
    public ResponseEntity<Map<String, Object>> issue(HttpServletRequest request) {
        Session session = SessionFilter.currentSession(request);
        CsrfToken token = session == null
                ? csrf.issue(null, null)
                : csrf.issue(session.userId(), SessionFilter.sessionDigest(session.sessionId()));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, csrf.cookie(token).headerValue())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(Map.of(
                        "token", token.token(),
                        "expiresAt", token.expiresAt().toString()));
    }
}
