package com.astralcore.securityservice.web;

import com.astralcore.observability.RequestContext;
import com.astralcore.observability.RequestContextHolder;
import com.astralcore.security.http.ClientIpResolver;
import com.astralcore.security.http.SecurityHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the {@link RequestContext} for every HTTP request: propagates or generates the
 * correlation id, resolves the client IP and echoes the correlation id on the response.
 *
 * <p>Runs first so that the security filters, the audit trail and every log line see the
 * context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        RequestContextHolder.set(new RequestContext(
                correlationId,
                UUID.randomUUID().toString(),
                null,
                null,
                ClientIpResolver.resolve(new ServletInboundRequest(request)),
                request.getHeader(SecurityHeaders.USER_AGENT)));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            RequestContextHolder.clear();
        }
    }
}
