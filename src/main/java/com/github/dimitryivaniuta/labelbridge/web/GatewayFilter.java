package com.github.dimitryivaniuta.labelbridge.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEvent;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.audit.AuditOutcome;
import com.github.dimitryivaniuta.labelbridge.auth.AccessTokenService;
import com.github.dimitryivaniuta.labelbridge.auth.TokenClaims;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticationFailedException;
import com.github.dimitryivaniuta.labelbridge.credential.CredentialStore;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.ratelimit.Admission;
import com.github.dimitryivaniuta.labelbridge.ratelimit.ClientRateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * Admission and authentication for every API request, in that order:
 * <ol>
 *   <li>resolve the client key and consult the rate limiter (login also has its own budget);</li>
 *   <li>for non-public routes verify the bearer token, the principal's status and its token generation;</li>
 *   <li>expose the {@link AuthenticatedPrincipal} as a request attribute.</li>
 * </ol>
 * Rejections are written here as {@link ApiError} bodies; nothing downstream runs.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20) // after CorrelationIdFilter, before controllers
@RequiredArgsConstructor
public class GatewayFilter extends OncePerRequestFilter {

    static final String LOGIN_PATH = "/api/auth/login";
    static final String HEALTH_PATH = "/api/health";
    private static final Set<String> PUBLIC_PATHS = Set.of(LOGIN_PATH, "/api/auth/register", HEALTH_PATH);

    private final ClientKeyResolver keyResolver;
    private final ClientRateLimiter rateLimiter;
    private final AccessTokenService tokens;
    private final CredentialStore credentialStore;
    private final AuditLog auditLog;
    private final LabelBridgeMetrics metrics;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = path(request);
        return HttpMethod.OPTIONS.matches(request.getMethod())
                || HEALTH_PATH.equals(path)
                || path.startsWith("/actuator")
                || !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String path = path(request);
        ClientKeyResolver.ResolvedClient client = keyResolver.resolve(request);

        Admission admission = rateLimiter.admit(client.subjectKey());
        if (admission.allowed() && LOGIN_PATH.equals(path)) {
            admission = rateLimiter.admitLogin(client.clientIp());
        }
        if (!admission.allowed()) {
            auditLog.record(new AuditEvent(actorOf(client), AuditEventKind.RATE_LIMITED, path,
                    AuditOutcome.DENY, client.subjectType().tag()));
            response.setHeader(GlobalExceptionHandler.RETRY_AFTER, String.valueOf(admission.retryAfterSeconds()));
            writeError(response, HttpStatus.TOO_MANY_REQUESTS, "Too many requests", path);
            return;
        }

        if (PUBLIC_PATHS.contains(path)) {
            chain.doFilter(request, response);
            return;
        }

        AuthenticatedPrincipal principal;
        try {
            principal = authenticate(ClientKeyResolver.bearerToken(request));
        } catch (AuthenticationFailedException ex) {
            metrics.authenticationFailed(ex.kind());
            log.debug("Rejected request to {}: {}", path, ex.getMessage());
            writeError(response, HttpStatus.UNAUTHORIZED, "Authentication failed", path);
            return;
        }

        request.setAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE, principal);
        MDC.put(RequestContextKeys.PRINCIPAL_MDC_KEY, principal.id().toString());
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.PRINCIPAL_MDC_KEY);
        }
    }

    private AuthenticatedPrincipal authenticate(String bearer) {
        TokenClaims claims = tokens.verify(bearer);
        Optional<AuthenticatedPrincipal> snapshot = credentialStore.snapshot(claims.principalId());
        if (snapshot.isEmpty()) {
            throw new StaleTokenException("Principal " + claims.principalId() + " is unknown or deactivated");
        }
        if (snapshot.get().tokenGeneration() != claims.generation()) {
            throw new StaleTokenException("Token generation " + claims.generation() + " is no longer current");
        }
        return snapshot.get();
    }

    private void writeError(HttpServletResponse response, HttpStatus status, String message, String path)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ApiError.of(status, message, path));
    }

    private static String actorOf(ClientKeyResolver.ResolvedClient client) {
        if (client.subjectType() == ClientKeyResolver.SubjectType.PRINCIPAL) {
            return client.subjectKey().substring("principal:".length());
        }
        return AuditEvent.ANONYMOUS;
    }

    private static String path(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String ctx = request.getContextPath();
        if (uri == null) return "";
        return (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) ? uri.substring(ctx.length()) : uri;
    }

    static final class StaleTokenException extends AuthenticationFailedException {
        StaleTokenException(String message) {
            super(message);
        }

        @Override
        public String kind() {
            return "stale_token";
        }
    }
}
