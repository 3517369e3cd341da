package com.github.dimitryivaniuta.labelbridge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class LabelBridgeMetrics {

    private final MeterRegistry registry;

    public LabelBridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed(String subjectType) {
        counter("label_bridge_ratelimit_allowed_total", "subject", subjectType); // principal | ip | login
    }

    public void rateLimitRejected(String subjectType) {
        counter("label_bridge_ratelimit_rejected_total", "subject", subjectType);
    }

    // ---- Authentication / authorization ----
    public void authenticationFailed(String kind) {
        counter("label_bridge_authentication_failures_total", "kind", kind);
    }

    public void authorizationDenied(String reason) {
        counter("label_bridge_authorization_denied_total", "reason", reason);
    }

    // ---- Session bridge ----
    public void sessionIssued(String scope) {
        counter("label_bridge_bridge_sessions_issued_total", "scope", scope);
    }

    public void sessionReused() {
        counter("label_bridge_bridge_sessions_reused_total");
    }

    public void sessionFlightJoined() {
        counter("label_bridge_bridge_flight_joined_total");
    }

    public void sessionRevoked(String cause) {
        counter("label_bridge_bridge_sessions_revoked_total", "cause", cause);
    }

    public void engineRetry() {
        counter("label_bridge_engine_retries_total");
    }

    public void engineFailure(String kind) {
        counter("label_bridge_engine_failures_total", "kind", kind);
    }

    public void upstreamInvalidationFailed() {
        counter("label_bridge_engine_invalidation_failures_total");
    }

    // ---- Audit ----
    public void auditFailure(String stage) {
        counter("label_bridge_audit_failures_total", "stage", stage); // rejected | write
    }

    // ---- Duration ----
    public void recordDuration(String metricName, String operation, long nanos) {
        Timer.builder(metricName)
                .tag("operation", operation)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    private void counter(String name, String... tags) {
        Counter.builder(name)
                .tags(tags)
                .register(registry)
                .increment();
    }
}
