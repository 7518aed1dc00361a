package com.astralcore.securityservice.web;

import com.astralcore.common.error.ErrorCategory;
import com.astralcore.security.ratelimit.RateLimitDecision;
import com.astralcore.security.ratelimit.RateLimitHeaders;
import com.astralcore.security.ratelimit.RateLimitService;
import com.astralcore.security.session.Session;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the endpoint's rate-limit policy to every request and decorates the response with
 * {@code X-RateLimit-*} headers. Rejected requests end here with a 429 problem response.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimitService rateLimits;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimitService rateLimits, ObjectMapper objectMapper) {
        this.rateLimits = rateLimits;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !rateLimits.enabled() || request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Session session = SessionFilter.currentSession(request);
        RateLimitDecision decision = rateLimits.checkRequest(
                new ServletInboundRequest(request), session == null ? null : session.userId());
        RateLimitHeaders.of(decision).forEach(response::setHeader);

        if (decision.allowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        ProblemDetail problem = ProblemDetails.of(ErrorCategory.RATE_LIMIT_EXCEEDED,
                "Too Many Requests", "Too many requests. Please try again later.");
        problem.setProperty("retryAfter", decision.retryAfterSeconds());
        response.setStatus(ErrorCategory.RATE_LIMIT_EXCEEDED.httpStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
