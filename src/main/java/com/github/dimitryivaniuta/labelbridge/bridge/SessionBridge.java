package com.github.dimitryivaniuta.labelbridge.bridge;

import com.github.dimitryivaniuta.labelbridge.audit.AuditEvent;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.audit.AuditOutcome;
import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.config.LabelBridgeProperties;
import com.github.dimitryivaniuta.labelbridge.credential.PrincipalPrivilegesChangedEvent;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds scoped annotation-engine sessions on behalf of principals.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li>one {@link Slot} per (principal, project); its monitor guards the live session, the last
 *       issued sequence and the revocation epoch;</li>
 *   <li>at most one upstream issuance per (principal, project) at a time. Late callers join the
 *       pending future instead of calling the engine, and issue after it if they need another scope;</li>
 *   <li>the sweeper retires slots with no session and no caller inside. A replacement slot starts
 *       above the highest sequence any retired slot reached, so per-pair sequences keep growing;</li>
 *   <li>no lock is held while the engine is called. An issuance commits only if the slot's epoch is
 *       unchanged, so a revoke that races an issuance always wins.</li>
 * </ul>
 */
@Service
public class SessionBridge {

    private static final Logger log = LoggerFactory.getLogger(SessionBridge.class);

    private final AnnotationEngineClient client;
    private final LabelBridgeMetrics metrics;
    private final AuditLog auditLog;
    private final Clock clock;

    private final Duration maxSessionTtl;
    private final Duration expirySkew;
    private final Duration acquireTimeout;
    private final Retry retry;

    private final ConcurrentHashMap<SessionKey, Slot> slots = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SessionKey, CompletableFuture<BridgedSession>> flights = new ConcurrentHashMap<>();
    private final AtomicLong retiredSequence = new AtomicLong();

    public SessionBridge(AnnotationEngineClient client,
                         LabelBridgeProperties props,
                         LabelBridgeMetrics metrics,
                         AuditLog auditLog,
                         Clock clock) {
        LabelBridgeProperties.Engine engine = props.getEngine();
        this.client = client;
        this.metrics = metrics;
        this.auditLog = auditLog;
        this.clock = clock;
        this.maxSessionTtl = engine.getMaxSessionTtl();
        this.expirySkew = engine.getExpirySkew();
        this.acquireTimeout = engine.getAcquireTimeout();
        this.retry = buildRetry(engine);
    }

    /**
     * Returns a live session for the principal on the project, issuing one upstream if needed.
     *
     * @param role            the caller's effective role on the project; decides the engine scope
     * @param engineProjectId the project's id inside the engine
     * @throws BridgeUnavailableException  transient engine failure, or revoked while issuing
     * @throws BridgeUnauthorizedException the engine refused to issue
     */
    public BridgedSession acquire(Long principalId, Role role, Long projectId, Long engineProjectId) {
        SessionKey key = new SessionKey(principalId, projectId);
        EngineScope scope = EngineScope.forRole(role);
        long deadline = System.nanoTime() + acquireTimeout.toNanos();
        Slot slot = enter(key);
        try {
            while (true) {
                // captured before anything else so a revoke racing this call discards its result
                long epoch = slot.epoch();

                BridgedSession live = slot.live(clock.instant(), scope);
                if (live != null) {
                    metrics.sessionReused();
                    return live;
                }

                CompletableFuture<BridgedSession> mine = new CompletableFuture<>();
                CompletableFuture<BridgedSession> pending = flights.putIfAbsent(key, mine);
                if (pending == null) {
                    return fly(key, slot, epoch, scope, engineProjectId, mine);
                }
                metrics.sessionFlightJoined();
                BridgedSession joined = await(pending, key, deadline);
                if (joined.scope() == scope) {
                    return joined;
                }
                // the flight issued another scope; go round again and issue ours after it
                log.debug("Flight for {} issued scope {}, {} still needed", key, joined.scope(), scope);
            }
        } finally {
            slot.exit();
        }
    }

    /**
     * Drops the local session first, then invalidates it upstream on a best-effort basis.
     * Any issuance in flight for the pair is discarded.
     *
     * @return true if a session was removed
     */
    public boolean revoke(Long principalId, Long projectId, String cause) {
        Slot slot = slots.get(new SessionKey(principalId, projectId));
        if (slot == null) {
            return false;
        }
        BridgedSession removed = slot.revoke();
        if (removed == null) {
            return false;
        }
        metrics.sessionRevoked(cause);
        auditLog.record(new AuditEvent(principalId.toString(), AuditEventKind.SESSION_REVOKED,
                "project:" + projectId + " credential:" + removed.credentialId(),
                AuditOutcome.ALLOW, cause));
        invalidateQuietly(removed.credentialId());
        return true;
    }

    public boolean revoke(Long principalId, Long projectId) {
        return revoke(principalId, projectId, "explicit");
    }

    /**
     * Revokes every session of the principal.
     *
     * @return number of sessions removed
     */
    public int revokeAll(Long principalId, String cause) {
        List<SessionKey> keys = new ArrayList<>();
        for (SessionKey key : slots.keySet()) {
            if (key.principalId().equals(principalId)) {
                keys.add(key);
            }
        }
        int removed = 0;
        for (SessionKey key : keys) {
            if (revoke(key.principalId(), key.projectId(), cause)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Revoked {} bridged session(s) of principal {} ({})", removed, principalId, cause);
        }
        return removed;
    }

    @Order(PrincipalPrivilegesChangedEvent.REVOKE_SESSIONS_ORDER)
    @TransactionalEventListener(fallbackExecution = true)
    public void onPrivilegesChanged(PrincipalPrivilegesChangedEvent event) {
        revokeAll(event.principalId(), event.cause().tag());
    }

    /**
     * Removes expired sessions from their slots.
     *
     * @return number of sessions dropped
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int dropped = 0;
        int retired = 0;
        for (Map.Entry<SessionKey, Slot> e : slots.entrySet()) {
            Slot slot = e.getValue();
            BridgedSession expired = slot.dropIfExpired(now);
            if (expired != null) {
                dropped++;
                metrics.sessionRevoked("expired");
                invalidateQuietly(expired.credentialId());
            }
            if (slot.retireIfIdle(retiredSequence)) {
                slots.remove(e.getKey(), slot);
                retired++;
            }
        }
        if (retired > 0) {
            log.debug("Retired {} idle session slot(s)", retired);
        }
        return dropped;
    }

    /** Number of (principal, project) slots currently tracked. */
    int trackedSlots() {
        return slots.size();
    }

    /** Current live session, if any, without touching the engine. */
    public BridgedSession peek(Long principalId, Long projectId) {
        Slot slot = slots.get(new SessionKey(principalId, projectId));
        return slot == null ? null : slot.live(clock.instant(), null);
    }

    private Slot enter(SessionKey key) {
        while (true) {
            Slot slot = slots.computeIfAbsent(key, k -> new Slot(retiredSequence.get()));
            if (slot.enter()) {
                return slot;
            }
            slots.remove(key, slot);
        }
    }

    private BridgedSession issue(SessionKey key, Slot slot, long epoch, EngineScope scope, Long engineProjectId) {
        EngineCredentialRequest request = new EngineCredentialRequest(
                subject(key.principalId()),
                engineProjectId,
                scope.permissions(),
                maxSessionTtl.toSeconds());

        EngineCredential credential = retry.executeSupplier(() -> client.issue(request));

        Instant now = clock.instant();
        Instant engineBound = credential.expiresAt().minus(expirySkew);
        Instant localBound = now.plus(maxSessionTtl);
        Instant expiresAt = engineBound.isBefore(localBound) ? engineBound : localBound;
        if (!expiresAt.isAfter(now)) {
            invalidateQuietly(credential.credentialId());
            throw new BridgeUnavailableException("Engine issued a credential that is already expired");
        }

        Commit commit = slot.commit(epoch, key, credential, scope, now, expiresAt);
        if (commit == null) {
            log.info("Discarding session for {} issued while it was being revoked", key);
            invalidateQuietly(credential.credentialId());
            throw new BridgeUnavailableException("Session was revoked while being issued");
        }
        if (commit.replaced() != null) {
            invalidateQuietly(commit.replaced().credentialId());
        }

        BridgedSession session = commit.session();
        metrics.sessionIssued(scope.tag());
        auditLog.record(AuditEvent.allow(key.principalId(), AuditEventKind.SESSION_ISSUED,
                "project:" + key.projectId() + " scope:" + scope.tag() + " seq:" + session.sequence()));
        log.debug("Issued {}", session);
        return session;
    }

    private BridgedSession fly(SessionKey key, Slot slot, long epoch, EngineScope scope, Long engineProjectId,
                               CompletableFuture<BridgedSession> mine) {
        BridgedSession result = null;
        RuntimeException failure = null;
        try {
            // another flight may have committed between the first check and winning this one
            BridgedSession live = slot.live(clock.instant(), scope);
            result = live != null ? live : issue(key, slot, epoch, scope, engineProjectId);
            return result;
        } catch (RuntimeException ex) {
            failure = ex;
            throw ex;
        } finally {
            // unregister before completing so woken waiters never rejoin a finished flight
            flights.remove(key, mine);
            if (result != null) {
                mine.complete(result);
            } else {
                mine.completeExceptionally(failure != null
                        ? failure
                        : new BridgeUnavailableException("Session issuance aborted for " + key));
            }
        }
    }

    private BridgedSession await(CompletableFuture<BridgedSession> pending, SessionKey key, long deadline) {
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException();
            }
            return pending.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            throw new BridgeUnavailableException("Timed out waiting for session issuance of " + key);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BridgeUnavailableException("Interrupted while waiting for session issuance", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof BridgeException bridge) {
                throw bridge;
            }
            throw new BridgeUnavailableException("Session issuance failed", cause);
        }
    }

    private void invalidateQuietly(String credentialId) {
        try {
            client.invalidate(credentialId);
        } catch (RuntimeException ex) {
            metrics.upstreamInvalidationFailed();
            log.warn("Upstream invalidation of credential {} failed: {}", credentialId, ex.getMessage());
        }
    }

    private Retry buildRetry(LabelBridgeProperties.Engine engine) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, engine.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(engine.getBackoff(), 2.0, 0.2))
                .retryOnException(ex -> ex instanceof BridgeUnavailableException)
                .build();
        Retry r = Retry.of("annotation-engine", config);
        r.getEventPublisher().onRetry(e -> {
            metrics.engineRetry();
            log.debug("Retrying engine issuance, attempt {}: {}", e.getNumberOfRetryAttempts(),
                    e.getLastThrowable() == null ? "" : e.getLastThrowable().getMessage());
        });
        return r;
    }

    private static String subject(Long principalId) {
        return "label-bridge:principal:" + principalId;
    }

    private record Commit(BridgedSession session, BridgedSession replaced) {}

    private static final class Slot {
        private BridgedSession session;
        private long lastSequence;
        private long epoch;
        private int callers;
        private boolean retired;

        Slot(long startSequence) {
            this.lastSequence = startSequence;
        }

        synchronized boolean enter() {
            if (retired) {
                return false;
            }
            callers++;
            return true;
        }

        synchronized void exit() {
            callers--;
        }

        /**
         * Marks the slot unusable when nobody holds it. The high-water mark is raised under the monitor,
         * so a caller that finds the slot retired always seeds its replacement above this slot's sequences.
         */
        synchronized boolean retireIfIdle(AtomicLong highWater) {
            if (retired || session != null || callers > 0) {
                return false;
            }
            highWater.accumulateAndGet(lastSequence, Math::max);
            retired = true;
            return true;
        }

        synchronized long epoch() {
            return epoch;
        }

        /** Live session matching the scope; any scope when {@code scope} is null. */
        synchronized BridgedSession live(Instant now, EngineScope scope) {
            if (session == null || !session.isLive(now)) {
                return null;
            }
            return (scope == null || session.scope() == scope) ? session : null;
        }

        synchronized Commit commit(long expectedEpoch, SessionKey key, EngineCredential credential,
                                   EngineScope scope, Instant issuedAt, Instant expiresAt) {
            if (epoch != expectedEpoch) {
                return null;
            }
            BridgedSession replaced = session;
            session = new BridgedSession(key.principalId(), key.projectId(), credential.credentialId(),
                    credential.token(), scope, issuedAt, expiresAt, ++lastSequence);
            return new Commit(session, replaced);
        }

        synchronized BridgedSession revoke() {
            epoch++;
            BridgedSession removed = session;
            session = null;
            return removed;
        }

        synchronized BridgedSession dropIfExpired(Instant now) {
            if (session != null && !session.isLive(now)) {
                BridgedSession expired = session;
                session = null;
                return expired;
            }
            return null;
        }
    }
}
