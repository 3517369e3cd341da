package com.github.dimitryivaniuta.labelbridge.web;

import com.github.dimitryivaniuta.labelbridge.auth.AccessTokenService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Derives the rate-limit key of a request.
 *
 * <p>Key format is stable:
 * <ul>
 *   <li>{@code principal:<id>} when the bearer token has a valid signature (expiry is not checked);</li>
 *   <li>{@code ip:<address>} otherwise.</li>
 * </ul>
 *
 * <p>The address is the servlet remote address only. Forwarding headers are honoured solely through
 * {@code server.forward-headers-strategy: native}, where Tomcat's RemoteIpValve rewrites the remote
 * address for requests arriving from its trusted internal proxies. Raw {@code X-Forwarded-For} from
 * anyone else is client-controlled and never becomes a key.
 */
@Component
public class ClientKeyResolver {

    public enum SubjectType {
        PRINCIPAL("principal"),
        IP("ip");

        private final String tag;
        SubjectType(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public record ResolvedClient(SubjectType subjectType, String subjectKey, String clientIp) {}

    private final AccessTokenService tokens;

    public ClientKeyResolver(AccessTokenService tokens) {
        this.tokens = tokens;
    }

    public ResolvedClient resolve(HttpServletRequest req) {
        String ip = clientIp(req);

        String bearer = bearerToken(req);
        if (bearer != null) {
            Long principalId = tokens.signedSubject(bearer);
            if (principalId != null) {
                return new ResolvedClient(SubjectType.PRINCIPAL, "principal:" + principalId, ip);
            }
        }
        return new ResolvedClient(SubjectType.IP, "ip:" + ip, ip);
    }

    public static String bearerToken(HttpServletRequest req) {
        String auth = header(req, HttpHeaders.AUTHORIZATION);
        if (auth == null || auth.length() <= 7 || !auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = auth.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    public static String clientIp(HttpServletRequest req) {
        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? "unknown" : ra;
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
