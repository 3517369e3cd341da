package com.github.dimitryivaniuta.labelbridge.bridge;

import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.github.dimitryivaniuta.labelbridge.credential.PrincipalPrivilegesChangedEvent;
import com.github.dimitryivaniuta.labelbridge.credential.PrivilegeChange;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.support.MutableClock;
import com.github.dimitryivaniuta.labelbridge.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SessionBridgeTest {

    private static final Long ALICE = 42L;
    private static final Long PROJECT = 7L;
    private static final Long ENGINE_PROJECT = 700L;

    private MutableClock clock;
    private FakeEngineClient engine;
    private SimpleMeterRegistry registry;
    private LabelBridgeProperties props;
    private SessionBridge bridge;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        engine = new FakeEngineClient(clock);
        registry = new SimpleMeterRegistry();
        props = TestProperties.create();
        bridge = newBridge();
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        CountDownLatch gate = engine.gate;
        if (gate != null) gate.countDown();
        pool.shutdownNow();
    }

    private SessionBridge newBridge() {
        return new SessionBridge(engine, props, new LabelBridgeMetrics(registry), mock(AuditLog.class), clock);
    }

    private BridgedSession acquire(Role role) {
        return bridge.acquire(ALICE, role, PROJECT, ENGINE_PROJECT);
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    private void awaitCounter(String name, double expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (registry.find(name).counter() == null || counter(name) < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("counter " + name + " never reached " + expected);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void secondAcquireReusesLiveSession() {
        BridgedSession first = acquire(Role.ANNOTATOR);
        BridgedSession second = acquire(Role.ANNOTATOR);

        assertThat(second).isSameAs(first);
        assertThat(first.sequence()).isEqualTo(1L);
        assertThat(engine.issueCalls.get()).isEqualTo(1);
        assertThat(counter("label_bridge_bridge_sessions_reused_total")).isEqualTo(1.0);
    }

    @Test
    void requestsLeastPrivilegeScopeForRole() {
        BridgedSession session = acquire(Role.VIEWER);

        EngineCredentialRequest request = engine.requests.get(0);
        assertThat(session.scope()).isEqualTo(EngineScope.READ_ONLY);
        assertThat(request.scope()).containsExactly("tasks:read", "annotations:read");
        assertThat(request.project()).isEqualTo(ENGINE_PROJECT);
        assertThat(request.subject()).isEqualTo("label-bridge:principal:42");
        assertThat(request.ttlSeconds()).isEqualTo(props.getEngine().getMaxSessionTtl().toSeconds());
    }

    @Test
    void concurrentAcquiresShareOneUpstreamCall() throws Exception {
        engine.gate = new CountDownLatch(1);
        int callers = 20;
        List<Future<BridgedSession>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> acquire(Role.ANNOTATOR)));
        }
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        engine.gate.countDown();

        List<String> credentialIds = new ArrayList<>();
        for (Future<BridgedSession> f : futures) {
            credentialIds.add(f.get(5, TimeUnit.SECONDS).credentialId());
        }

        assertThat(engine.issueCalls.get()).isEqualTo(1);
        assertThat(credentialIds).containsOnly("cred-1");
    }

    @Test
    void callerNeedingAnotherScopeWaitsForTheFlightThenIssues() throws Exception {
        engine.gate = new CountDownLatch(1);
        Future<BridgedSession> viewer = pool.submit(() -> acquire(Role.VIEWER));
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<BridgedSession> annotator = pool.submit(() -> acquire(Role.ANNOTATOR));
        awaitCounter("label_bridge_bridge_flight_joined_total", 1.0);

        assertThat(engine.issueCalls.get()).isEqualTo(1);
        engine.gate.countDown();

        BridgedSession readOnly = viewer.get(5, TimeUnit.SECONDS);
        BridgedSession annotate = annotator.get(5, TimeUnit.SECONDS);
        assertThat(readOnly.scope()).isEqualTo(EngineScope.READ_ONLY);
        assertThat(annotate.scope()).isEqualTo(EngineScope.ANNOTATE);
        assertThat(annotate.sequence()).isEqualTo(2L);
        assertThat(engine.maxConcurrentIssues.get()).isEqualTo(1);
        assertThat(engine.invalidated).containsExactly(readOnly.credentialId());
        assertThat(bridge.peek(ALICE, PROJECT)).isSameAs(annotate);
    }

    @Test
    void sweepRetiresIdleSlotsWithoutResettingSequences() {
        BridgedSession first = acquire(Role.ANNOTATOR);
        bridge.revoke(ALICE, PROJECT);

        bridge.sweepExpired();
        assertThat(bridge.trackedSlots()).isZero();

        BridgedSession next = acquire(Role.ANNOTATOR);
        assertThat(next.sequence()).isGreaterThan(first.sequence());
        assertThat(bridge.trackedSlots()).isEqualTo(1);
    }

    @Test
    void sweepKeepsSlotWhileIssuanceIsInFlight() throws Exception {
        engine.gate = new CountDownLatch(1);
        Future<BridgedSession> inFlight = pool.submit(() -> acquire(Role.ANNOTATOR));
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();

        bridge.sweepExpired();
        assertThat(bridge.trackedSlots()).isEqualTo(1);

        engine.gate.countDown();
        BridgedSession session = inFlight.get(5, TimeUnit.SECONDS);
        assertThat(bridge.peek(ALICE, PROJECT)).isSameAs(session);

        // a revoke still reaches the slot the issuance committed to
        assertThat(bridge.revoke(ALICE, PROJECT)).isTrue();
    }

    @Test
    void revokeThenAcquireIssuesNextSequence() {
        BridgedSession first = acquire(Role.ANNOTATOR);

        assertThat(bridge.revoke(ALICE, PROJECT)).isTrue();
        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
        assertThat(engine.invalidated).containsExactly(first.credentialId());

        BridgedSession second = acquire(Role.ANNOTATOR);
        assertThat(second.sequence()).isEqualTo(2L);
        assertThat(second.credentialId()).isNotEqualTo(first.credentialId());
        assertThat(bridge.revoke(ALICE, 999L)).isFalse();
    }

    @Test
    void revokeSucceedsLocallyWhenUpstreamInvalidationFails() {
        acquire(Role.ANNOTATOR);
        engine.failInvalidation = true;

        assertThat(bridge.revoke(ALICE, PROJECT)).isTrue();
        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
        assertThat(counter("label_bridge_engine_invalidation_failures_total")).isEqualTo(1.0);
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        engine.failNext(new BridgeUnavailableException("503"));
        engine.failNext(new BridgeUnavailableException("timeout"));

        BridgedSession session = acquire(Role.ANNOTATOR);

        assertThat(engine.issueCalls.get()).isEqualTo(3);
        assertThat(session.sequence()).isEqualTo(1L);
        assertThat(counter("label_bridge_engine_retries_total")).isEqualTo(2.0);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 5; i++) engine.failNext(new BridgeUnavailableException("down"));

        assertThatThrownBy(() -> acquire(Role.ANNOTATOR)).isInstanceOf(BridgeUnavailableException.class);
        assertThat(engine.issueCalls.get()).isEqualTo(props.getEngine().getMaxAttempts());
        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
    }

    @Test
    void refusalIsNeverRetried() {
        engine.failNext(new BridgeUnauthorizedException("no", 403));

        assertThatThrownBy(() -> acquire(Role.ANNOTATOR)).isInstanceOf(BridgeUnauthorizedException.class);
        assertThat(engine.issueCalls.get()).isEqualTo(1);
    }

    @Test
    void failedIssuanceDoesNotPoisonLaterAttempts() {
        engine.failNext(new BridgeUnauthorizedException("no", 403));
        assertThatThrownBy(() -> acquire(Role.ANNOTATOR)).isInstanceOf(BridgeUnauthorizedException.class);

        assertThat(acquire(Role.ANNOTATOR).sequence()).isEqualTo(1L);
    }

    @Test
    void revokeDuringIssuanceDiscardsTheResult() throws Exception {
        engine.gate = new CountDownLatch(1);
        Future<BridgedSession> inFlight = pool.submit(() -> acquire(Role.ANNOTATOR));
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();

        bridge.revoke(ALICE, PROJECT, "role_changed");
        engine.gate.countDown();

        assertThatThrownBy(() -> inFlight.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BridgeUnavailableException.class);
        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
        assertThat(engine.invalidated).containsExactly("cred-1");
    }

    @Test
    void waiterTimesOutWhileAnotherCallerIsIssuing() throws Exception {
        props.getEngine().setAcquireTimeout(Duration.ofMillis(200));
        bridge = newBridge();
        engine.gate = new CountDownLatch(1);
        Future<BridgedSession> owner = pool.submit(() -> acquire(Role.ANNOTATOR));
        assertThat(engine.entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> acquire(Role.ANNOTATOR))
                .isInstanceOf(BridgeUnavailableException.class)
                .hasMessageContaining("Timed out");

        engine.gate.countDown();
        assertThat(owner.get(5, TimeUnit.SECONDS).sequence()).isEqualTo(1L);
    }

    @Test
    void expiryIsCappedByLocalMaximum() {
        BridgedSession session = acquire(Role.ANNOTATOR);

        assertThat(session.expiresAt()).isEqualTo(clock.instant().plus(props.getEngine().getMaxSessionTtl()));
    }

    @Test
    void expiryHonoursEngineExpiryMinusSkew() {
        engine.credentialTtl = Duration.ofMinutes(10);

        BridgedSession session = acquire(Role.ANNOTATOR);

        assertThat(session.expiresAt())
                .isEqualTo(clock.instant().plus(Duration.ofMinutes(10)).minus(props.getEngine().getExpirySkew()));
    }

    @Test
    void credentialExpiringWithinSkewIsRejected() {
        engine.credentialTtl = Duration.ofSeconds(10);

        assertThatThrownBy(() -> acquire(Role.ANNOTATOR)).isInstanceOf(BridgeUnavailableException.class);
        assertThat(engine.invalidated).containsExactly("cred-1");
        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
    }

    @Test
    void expiredSessionIsReissued() {
        acquire(Role.ANNOTATOR);
        clock.advance(Duration.ofMinutes(31));

        BridgedSession next = acquire(Role.ANNOTATOR);

        assertThat(next.sequence()).isEqualTo(2L);
        assertThat(engine.issueCalls.get()).isEqualTo(2);
    }

    @Test
    void scopeChangeReplacesAndInvalidatesOldCredential() {
        BridgedSession annotate = acquire(Role.ANNOTATOR);
        BridgedSession manage = acquire(Role.MANAGER);

        assertThat(manage.scope()).isEqualTo(EngineScope.MANAGE);
        assertThat(manage.sequence()).isEqualTo(2L);
        assertThat(engine.invalidated).containsExactly(annotate.credentialId());
        assertThat(bridge.peek(ALICE, PROJECT)).isSameAs(manage);
    }

    @Test
    void privilegeChangeRevokesEverySessionOfThePrincipal() {
        bridge.acquire(ALICE, Role.MANAGER, 7L, 700L);
        bridge.acquire(ALICE, Role.MANAGER, 8L, 800L);
        bridge.acquire(99L, Role.MANAGER, 7L, 700L);

        bridge.onPrivilegesChanged(new PrincipalPrivilegesChangedEvent(ALICE, PrivilegeChange.ROLE_CHANGED));

        assertThat(bridge.peek(ALICE, 7L)).isNull();
        assertThat(bridge.peek(ALICE, 8L)).isNull();
        assertThat(bridge.peek(99L, 7L)).isNotNull();
        assertThat(registry.get("label_bridge_bridge_sessions_revoked_total").tag("cause", "role_changed")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void sweeperDropsExpiredSessions() {
        acquire(Role.ANNOTATOR);
        bridge.acquire(ALICE, Role.ANNOTATOR, 8L, 800L);
        clock.advance(Duration.ofMinutes(31));

        new BridgedSessionSweeper(bridge).sweepExpired();

        assertThat(bridge.peek(ALICE, PROJECT)).isNull();
        assertThat(engine.invalidated).containsExactlyInAnyOrder("cred-1", "cred-2");
        assertThat(bridge.sweepExpired()).isZero();
    }

    @Test
    void sessionToStringNeverShowsToken() {
        assertThat(acquire(Role.ANNOTATOR).toString()).doesNotContain("tok-1");
    }
}
