package com.astralcore.securityservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.astralcore.audit.AuditStore;
import com.astralcore.audit.testing.InMemoryAuditStore;
import com.astralcore.security.maintenance.MaintenanceScheduler;
import com.astralcore.security.session.FingerprintInputs;
import com.astralcore.security.session.Session;
import com.astralcore.security.session.SessionStore;
import com.astralcore.securityservice.config.SecurityProperties;
import com.astralcore.securityservice.web.SessionFilter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(SecurityServiceApplicationTest.ProbeController.class)
@DisplayName("Security Service Application")
class SecurityServiceApplicationTest {

    private static final String USER_AGENT = "Mozilla/5.0 (MockMvc)";
    private static final AtomicInteger CLIENTS = new AtomicInteger();

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private SessionStore sessionStore;
    @Autowired private AuditStore auditStore;

    /** Each test calls from its own address so rate-limit budgets never leak between tests. */
    private static String nextClientIp() {
        return "198.51.100." + CLIENTS.incrementAndGet();
    }

    private static MockHttpServletRequestBuilder from(String ip, MockHttpServletRequestBuilder builder) {
        return builder
                .header("x-forwarded-for", ip)
                .header("user-agent", USER_AGENT)
                .header("accept-language", "en-GB")
                .header("accept-encoding", "gzip");
    }

    private JsonNode issueToken(String ip, Cookie... cookies) throws Exception {
        MockHttpServletRequestBuilder request = from(ip, get("/api/csrf-token"));
        if (cookies.length > 0) {
            request.cookie(cookies);
        }
        String body = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Nested
    @DisplayName("context")
    class ContextTests {

        @Test
        @DisplayName("loads with the test profile")
        void contextLoads() {
            var props = context.getBean(SecurityProperties.class);
            assertThat(props.environment()).isEqualTo("test");
            assertThat(props.production()).isFalse();
            assertThat(props.csrf().exemptPaths()).contains("/api/auth");
        }

        @Test
        @DisplayName("falls back to the in-memory audit store")
        void usesInMemoryAuditStore() {
            assertThat(auditStore).isInstanceOf(InMemoryAuditStore.class);
        }

        @Test
        @DisplayName("starts the maintenance scheduler with every sweep")
        void startsMaintenanceScheduler() {
            var scheduler = context.getBean(MaintenanceScheduler.class);
            assertThat(scheduler.isRunning()).isTrue();
            assertThat(scheduler.taskNames())
                    .containsExactly("session-sweep", "rate-limit-sweep", "mfa-sweep", "audit-retention");
        }

        @Test
        @DisplayName("actuator health endpoint is available")
        void actuatorHealthEndpointIsAvailable() throws Exception {
            mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        }
    }

    @Nested
    @DisplayName("request context")
    class RequestContextTests {

        @Test
        @DisplayName("generates a correlation id when none is sent")
        void generatesCorrelationId() throws Exception {
            mockMvc.perform(from(nextClientIp(), get("/api/probe/whoami")))
                    .andExpect(status().isOk())
                    .andExpect(result ->
                            assertThat(result.getResponse().getHeader("X-Correlation-ID")).isNotBlank());
        }

        @Test
        @DisplayName("echoes the caller's correlation id")
        void echoesCorrelationId() throws Exception {
            mockMvc.perform(from(nextClientIp(), get("/api/probe/whoami")).header("X-Correlation-ID", "corr-123"))
                    .andExpect(header().string("X-Correlation-ID", "corr-123"));
        }

        @Test
        @DisplayName("unknown routes produce a 404 problem")
        void unknownRouteIsNotFound() throws Exception {
            mockMvc.perform(from(nextClientIp(), get("/api/probe/missing")))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.status").value(404));
        }
    }

    @Nested
    @DisplayName("CSRF")
    class CsrfTests {

        @Test
        @DisplayName("token endpoint returns the token and sets the cookie")
        void issuesToken() throws Exception {
            mockMvc.perform(from(nextClientIp(), get("/api/csrf-token")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.token").isNotEmpty())
                    .andExpect(jsonPath("$.expiresAt").isNotEmpty())
                    .andExpect(result -> {
                        String cookie = result.getResponse().getHeader(HttpHeaders.SET_COOKIE);
                        assertThat(cookie)
                                .startsWith("__csrf_token=")
                                .contains("HttpOnly", "SameSite=Strict")
                                .doesNotContain("Secure");
                    });
        }

        @Test
        @DisplayName("rejects a state-changing request without a token")
        void rejectsMissingToken() throws Exception {
            mockMvc.perform(from(nextClientIp(), post("/api/probe/echo")))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.title").value("Forbidden"))
                    .andExpect(jsonPath("$.detail").value("CSRF validation failed"));
        }

        @Test
        @DisplayName("accepts a state-changing request carrying a valid token")
        void acceptsValidToken() throws Exception {
            String ip = nextClientIp();
            String token = issueToken(ip).get("token").asText();

            mockMvc.perform(from(ip, post("/api/probe/echo")).header("x-csrf-token", token))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accepted").value(true));
        }

        @Test
        @DisplayName("accepts the token from the cookie when the header is absent")
        void acceptsCookieToken() throws Exception {
            String ip = nextClientIp();
            String token = issueToken(ip).get("token").asText();

            mockMvc.perform(from(ip, post("/api/probe/echo")).cookie(new Cookie("__csrf_token", token)))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("exempt paths need no token")
        void exemptPathsSkipValidation() throws Exception {
            mockMvc.perform(from(nextClientIp(), post("/api/auth/probe")))
                    .andExpect(status().isOk());
        }
    }

    @Nested
    @DisplayName("sessions")
    class SessionTests {

        @Test
        @DisplayName("resolves the session cookie to its user")
        void resolvesSession() throws Exception {
            String ip = nextClientIp();
            Session session = sessionStore.create("user-42", "patient",
                    new FingerprintInputs(USER_AGENT, "en-GB", "gzip", ip), false);

            mockMvc.perform(from(ip, get("/api/probe/whoami"))
                            .cookie(new Cookie("__session", session.sessionId())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.userId").value("user-42"));
        }

        @Test
        @DisplayName("clears the cookie of a session presented from another device")
        void clearsCookieOnFingerprintMismatch() throws Exception {
            String ip = nextClientIp();
            Session session = sessionStore.create("user-43", "patient",
                    new FingerprintInputs("Other/1.0", "fr-FR", "br", ip), false);

            mockMvc.perform(from(ip, get("/api/probe/whoami"))
                            .cookie(new Cookie("__session", session.sessionId())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.userId").value("anonymous"))
                    .andExpect(result -> assertThat(result.getResponse().getHeader(HttpHeaders.SET_COOKIE))
                            .startsWith("__session=;")
                            .contains("Max-Age=0"));
        }

        @Test
        @DisplayName("a session-bound token is refused without the session")
        void sessionBoundTokenNeedsSession() throws Exception {
            String ip = nextClientIp();
            Session session = sessionStore.create("user-44", "patient",
                    new FingerprintInputs(USER_AGENT, "en-GB", "gzip", ip), false);
            Cookie sessionCookie = new Cookie("__session", session.sessionId());
            String token = issueToken(ip, sessionCookie).get("token").asText();

            mockMvc.perform(from(ip, post("/api/probe/echo"))
                            .cookie(sessionCookie)
                            .header("x-csrf-token", token))
                    .andExpect(status().isOk());

            mockMvc.perform(from(ip, post("/api/probe/echo")).header("x-csrf-token", token))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("rate limiting")
    class RateLimitTests {

        @Test
        @DisplayName("decorates allowed responses with rate-limit headers")
        void addsHeaders() throws Exception {
            mockMvc.perform(from(nextClientIp(), get("/api/probe/whoami")))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-RateLimit-Limit", "3"))
                    .andExpect(header().string("X-RateLimit-Remaining", "2"))
                    .andExpect(header().exists("X-RateLimit-Reset"))
                    .andExpect(header().doesNotExist("Retry-After"));
        }

        @Test
        @DisplayName("rejects the request after the budget is spent")
        void rejectsOverBudget() throws Exception {
            String ip = nextClientIp();
            for (int i = 0; i < 3; i++) {
                mockMvc.perform(from(ip, get("/api/probe/whoami"))).andExpect(status().isOk());
            }

            mockMvc.perform(from(ip, get("/api/probe/whoami")))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().string("X-RateLimit-Remaining", "0"))
                    .andExpect(header().exists("Retry-After"))
                    .andExpect(jsonPath("$.title").value("Too Many Requests"));
        }

        @Test
        @DisplayName("budgets are tracked per client")
        void budgetsArePerClient() throws Exception {
            String first = nextClientIp();
            for (int i = 0; i < 4; i++) {
                mockMvc.perform(from(first, get("/api/probe/whoami")));
            }

            mockMvc.perform(from(nextClientIp(), get("/api/probe/whoami")))
                    .andExpect(status().isOk());
        }
    }

    @RestController
    static class ProbeController {

        @GetMapping("/api/probe/whoami")
        public Map<String, Object> whoami(HttpServletRequest request) {
            Session session = SessionFilter.currentSession(request);
            return Map.of("userId", session == null ? "anonymous" : session.userId());
        }

        @PostMapping("/api/probe/echo")
        public Map<String, Object> echo() {
            return Map.of("accepted", true);
        }

        @PostMapping("/api/auth/probe")
        public Map<String, Object> authProbe() {
            return Map.of("accepted", true);
        }
    }
}
