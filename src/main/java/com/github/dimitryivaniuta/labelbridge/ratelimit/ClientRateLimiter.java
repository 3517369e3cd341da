package com.github.dimitryivaniuta.labelbridge.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fixed-window admission control per client key.
 *
 * <p>Each key gets its own Resilience4j limiter (limit per refresh period, zero wait). Limiters sit in
 * a bounded Caffeine cache that forgets a key after one idle window; an evicted key simply starts a
 * fresh window. Login attempts are counted against a separate, stricter budget keyed by address.
 */
@Component
public class ClientRateLimiter {

    private static final String LOGIN_PREFIX = "login:";

    private final LabelBridgeMetrics metrics;
    private final boolean enabled;
    private final Budget general;
    private final Budget login;

    public ClientRateLimiter(LabelBridgeProperties props, LabelBridgeMetrics metrics) {
        LabelBridgeProperties.RateLimit cfg = props.getRateLimit();
        this.metrics = metrics;
        this.enabled = cfg.isEnabled();
        this.general = new Budget("rl", cfg.getLimit(), cfg.getWindow(), cfg.getMaxTrackedKeys());
        this.login = new Budget("rl-login", cfg.getLoginLimit(), cfg.getLoginWindow(), cfg.getMaxTrackedKeys());
    }

    /**
     * @param clientKey {@code principal:<id>} or {@code ip:<address>}
     */
    public Admission admit(String clientKey) {
        return admit(general, clientKey, subjectType(clientKey));
    }

    /** Login budget, keyed by the caller's address regardless of any token it presents. */
    public Admission admitLogin(String clientIp) {
        return admit(login, LOGIN_PREFIX + clientIp, "login");
    }

    public Duration window() {
        return general.window;
    }

    private Admission admit(Budget budget, String key, String subjectType) {
        if (!enabled) {
            return Admission.allow();
        }
        RateLimiter limiter = budget.limiterFor(key);
        if (limiter.acquirePermission()) {
            metrics.rateLimitAllowed(subjectType);
            return Admission.allow();
        }
        metrics.rateLimitRejected(subjectType);
        return Admission.throttled(budget.retryAfter(limiter));
    }

    static String subjectType(String clientKey) {
        int colon = clientKey == null ? -1 : clientKey.indexOf(':');
        return colon > 0 ? clientKey.substring(0, colon) : "unknown";
    }

    private static final class Budget {
        final String name;
        final Duration window;
        final RateLimiterConfig config;
        final Cache<String, RateLimiter> limiters;

        Budget(String name, int limit, Duration window, long maxKeys) {
            this.name = name;
            this.window = window;
            this.config = RateLimiterConfig.custom()
                    .limitForPeriod(Math.max(1, limit))
                    .limitRefreshPeriod(window)
                    .timeoutDuration(Duration.ZERO) // never block the request thread
                    .build();
            this.limiters = Caffeine.newBuilder()
                    .maximumSize(Math.max(1, maxKeys))
                    .expireAfterAccess(window)
                    .build();
        }

        RateLimiter limiterFor(String key) {
            return limiters.get(key, k -> RateLimiter.of(name + ":" + k, config));
        }

        Duration retryAfter(RateLimiter limiter) {
            if (limiter instanceof AtomicRateLimiter atomic) {
                long nanos = atomic.getDetailedMetrics().getNanosToWait();
                if (nanos > 0) {
                    Duration d = Duration.ofNanos(nanos);
                    return d.compareTo(window) > 0 ? window : d;
                }
            }
            return window;
        }
    }
}
