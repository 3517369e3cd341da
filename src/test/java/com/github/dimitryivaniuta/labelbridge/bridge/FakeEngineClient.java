package com.github.dimitryivaniuta.labelbridge.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory engine. Issued credentials live for {@link #credentialTtl}; queued failures
 * are thrown before a credential is handed out.
 */
class FakeEngineClient implements AnnotationEngineClient {

    final AtomicInteger issueCalls = new AtomicInteger();
    final AtomicInteger maxConcurrentIssues = new AtomicInteger();
    private final AtomicInteger concurrentIssues = new AtomicInteger();
    final List<EngineCredentialRequest> requests = new CopyOnWriteArrayList<>();
    final List<String> invalidated = new CopyOnWriteArrayList<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private final Clock clock;

    volatile Duration credentialTtl = Duration.ofHours(1);
    volatile boolean failInvalidation;
    /** When set, issue blocks until released. */
    volatile CountDownLatch gate;
    final CountDownLatch entered = new CountDownLatch(1);

    FakeEngineClient(Clock clock) {
        this.clock = clock;
    }

    synchronized void failNext(RuntimeException ex) {
        failures.add(ex);
    }

    @Override
    public EngineCredential issue(EngineCredentialRequest request) {
        maxConcurrentIssues.accumulateAndGet(concurrentIssues.incrementAndGet(), Math::max);
        try {
            return doIssue(request);
        } finally {
            concurrentIssues.decrementAndGet();
        }
    }

    private EngineCredential doIssue(EngineCredentialRequest request) {
        int n = issueCalls.incrementAndGet();
        requests.add(request);
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                if (!g.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("gate never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BridgeUnavailableException("interrupted", e);
            }
        }
        RuntimeException failure;
        synchronized (this) {
            failure = failures.poll();
        }
        if (failure != null) {
            throw failure;
        }
        return new EngineCredential("cred-" + n, "tok-" + n, clock.instant().plus(credentialTtl));
    }

    @Override
    public void invalidate(String credentialId) {
        invalidated.add(credentialId);
        if (failInvalidation) {
            throw new BridgeUnavailableException("engine down");
        }
    }

    @Override
    public JsonNode listTasks(Long engineProjectId, String sessionToken) {
        return JsonNodeFactory.instance.arrayNode();
    }

    @Override
    public int importTasks(Long engineProjectId, String sessionToken, JsonNode tasks) {
        return tasks.size();
    }
}
