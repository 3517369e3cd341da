package com.github.dimitryivaniuta.labelbridge.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.auth.AccessTokenService;
import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.CredentialStore;
import com.github.dimitryivaniuta.labelbridge.credential.RoleGrant;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.ratelimit.ClientRateLimiter;
import com.github.dimitryivaniuta.labelbridge.support.MutableClock;
import com.github.dimitryivaniuta.labelbridge.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class GatewayFilterTest {

    private MutableClock clock;
    private AccessTokenService tokens;
    private CredentialStore credentialStore;
    private AuditLog auditLog;
    private SimpleMeterRegistry registry;
    private GatewayFilter filter;

    private final AuthenticatedPrincipal alice = new AuthenticatedPrincipal(5L, "alice@example.com", "Alice",
            false, 2L, Set.of(RoleGrant.organizationWide(1L, Role.MANAGER)));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
        LabelBridgeProperties props = TestProperties.create();
        props.getRateLimit().setLimit(3);
        props.getRateLimit().setWindow(Duration.ofHours(1));
        props.getRateLimit().setLoginLimit(2);
        registry = new SimpleMeterRegistry();
        LabelBridgeMetrics metrics = new LabelBridgeMetrics(registry);
        tokens = new AccessTokenService(props, clock);
        credentialStore = mock(CredentialStore.class);
        auditLog = mock(AuditLog.class);
        filter = new GatewayFilter(new ClientKeyResolver(tokens), new ClientRateLimiter(props, metrics), tokens,
                credentialStore, auditLog, metrics, new ObjectMapper().registerModule(new JavaTimeModule()));
        when(credentialStore.snapshot(5L)).thenReturn(Optional.of(alice));
    }

    private MockHttpServletRequest request(String method, String uri, String ip) {
        MockHttpServletRequest req = new MockHttpServletRequest(method, uri);
        req.setRemoteAddr(ip);
        return req;
    }

    private MockHttpServletResponse run(MockHttpServletRequest req, MockFilterChain chain) throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(req, res, chain);
        return res;
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse res = run(request("GET", "/api/dashboard/stats", "10.0.0.1"), chain);

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getContentAsString()).contains("Authentication failed");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void validTokenExposesPrincipal() throws Exception {
        MockHttpServletRequest req = request("GET", "/api/dashboard/stats", "10.0.0.1");
        req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tokens.issue(5L, 2L).token());
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse res = run(req, chain);

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isNotNull();
        assertThat(req.getAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE)).isEqualTo(alice);
    }

    @Test
    void tokenOfOlderGenerationIsRejected() throws Exception {
        MockHttpServletRequest req = request("GET", "/api/auth/me", "10.0.0.1");
        req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tokens.issue(5L, 1L).token());

        MockHttpServletResponse res = run(req, new MockFilterChain());

        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(registry.get("label_bridge_authentication_failures_total").tag("kind", "stale_token")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void deactivatedPrincipalIsRejected() throws Exception {
        when(credentialStore.snapshot(5L)).thenReturn(Optional.empty());
        MockHttpServletRequest req = request("GET", "/api/auth/me", "10.0.0.1");
        req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tokens.issue(5L, 2L).token());

        assertThat(run(req, new MockFilterChain()).getStatus()).isEqualTo(401);
    }

    @Test
    void exhaustedAddressGetsRetryAfter() throws Exception {
        for (int i = 0; i < 3; i++) {
            assertThat(run(request("GET", "/api/dashboard/stats", "10.0.0.2"), new MockFilterChain()).getStatus())
                    .isEqualTo(401);
        }

        MockHttpServletResponse res = run(request("GET", "/api/dashboard/stats", "10.0.0.2"), new MockFilterChain());

        assertThat(res.getStatus()).isEqualTo(429);
        assertThat(Long.parseLong(res.getHeader("Retry-After"))).isBetween(1L, 3600L);
        verify(auditLog).record(argThat(e -> e.kind() == AuditEventKind.RATE_LIMITED && "ip".equals(e.reason())));
    }

    @Test
    void authenticatedCallersAreKeyedByPrincipalNotAddress() throws Exception {
        String token = tokens.issue(5L, 2L).token();
        for (int i = 0; i < 3; i++) {
            MockHttpServletRequest req = request("GET", "/api/auth/me", "10.0.0." + i);
            req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
            assertThat(run(req, new MockFilterChain()).getStatus()).isEqualTo(200);
        }
        MockHttpServletRequest fourth = request("GET", "/api/auth/me", "10.0.0.99");
        fourth.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        assertThat(run(fourth, new MockFilterChain()).getStatus()).isEqualTo(429);

        // the address itself still has its own budget
        assertThat(run(request("GET", "/api/auth/me", "10.0.0.99"), new MockFilterChain()).getStatus())
                .isEqualTo(401);
    }

    @Test
    void expiredButSignedTokenStillCountsAgainstThePrincipal() throws Exception {
        String token = tokens.issue(5L, 2L).token();
        clock.advance(Duration.ofHours(2));
        MockHttpServletRequest req = request("GET", "/api/auth/me", "10.0.0.3");
        req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);

        assertThat(run(req, new MockFilterChain()).getStatus()).isEqualTo(401);
        assertThat(registry.get("label_bridge_ratelimit_allowed_total").tag("subject", "principal")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void loginHasItsOwnBudget() throws Exception {
        for (int i = 0; i < 2; i++) {
            MockFilterChain chain = new MockFilterChain();
            run(request("POST", "/api/auth/login", "10.0.0.4"), chain);
            assertThat(chain.getRequest()).isNotNull();
        }

        MockHttpServletResponse res = run(request("POST", "/api/auth/login", "10.0.0.4"), new MockFilterChain());

        assertThat(res.getStatus()).isEqualTo(429);
        assertThat(res.getHeader("Retry-After")).isNotNull();
    }

    @Test
    void publicRoutesSkipAuthentication() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        run(request("POST", "/api/auth/register", "10.0.0.5"), chain);

        assertThat(chain.getRequest()).isNotNull();
        verifyNoInteractions(credentialStore);
    }

    @Test
    void healthAndActuatorBypassTheFilter() throws Exception {
        for (int i = 0; i < 10; i++) {
            MockFilterChain chain = new MockFilterChain();
            run(request("GET", "/api/health", "10.0.0.6"), chain);
            assertThat(chain.getRequest()).isNotNull();
        }
        MockFilterChain chain = new MockFilterChain();
        run(request("GET", "/actuator/health", "10.0.0.6"), chain);
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void forwardingHeadersDoNotChangeAnonymousKey() {
        MockHttpServletRequest req = request("GET", "/api/x", "203.0.113.9");
        req.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
        req.addHeader("X-Real-IP", "10.0.0.3");

        ClientKeyResolver.ResolvedClient client = new ClientKeyResolver(tokens).resolve(req);

        assertThat(client.subjectKey()).isEqualTo("ip:203.0.113.9");
        assertThat(client.clientIp()).isEqualTo("203.0.113.9");
        assertThat(client.subjectType()).isEqualTo(ClientKeyResolver.SubjectType.IP);
    }

    @Test
    void rotatingForwardedForCannotEscapeLoginBudget() throws Exception {
        int throttled = 0;
        for (int i = 0; i < 20; i++) {
            MockHttpServletRequest req = request("POST", "/api/auth/login", "203.0.113.9");
            req.addHeader("X-Forwarded-For", "10.0.0." + i);
            MockHttpServletResponse res = run(req, new MockFilterChain());
            if (res.getStatus() == 429) {
                throttled++;
            }
        }

        assertThat(throttled).isEqualTo(18);
    }
}
