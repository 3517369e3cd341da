package com.github.dimitryivaniuta.labelbridge.audit;

import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only audit trail for authentication, authorization and session events.
 *
 * <p>Recording never fails the caller: writes run on a bounded executor, and both a full queue
 * and a failed write are only logged and counted.
 */
@Component
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final AuditRecordWriter writer;
    private final Executor executor;
    private final LabelBridgeMetrics metrics;
    private final Clock clock;

    public AuditLog(AuditRecordWriter writer,
                    @Qualifier("auditExecutor") Executor executor,
                    LabelBridgeMetrics metrics,
                    Clock clock) {
        this.writer = writer;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void record(AuditEvent event) {
        // MDC is thread-bound; capture request context before handing off
        AuditRecord row = AuditRecord.builder()
                .createdAt(clock.instant())
                .actorId(event.actorId())
                .eventKind(event.kind())
                .resourceRef(truncate(event.resourceRef()))
                .outcome(event.outcome())
                .reason(truncate(event.reason()))
                .correlationId(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY))
                .clientIp(MDC.get(RequestContextKeys.CLIENT_IP_MDC_KEY))
                .build();

        try {
            executor.execute(() -> writeSafe(row));
        } catch (RejectedExecutionException ex) {
            metrics.auditFailure("rejected");
            log.warn("Audit queue full, dropped event kind={} actor={} outcome={}",
                    row.getEventKind(), row.getActorId(), row.getOutcome());
        }
    }

    private void writeSafe(AuditRecord row) {
        try {
            writer.write(row);
        } catch (Exception ex) {
            metrics.auditFailure("write");
            log.warn("Audit persistence failed for kind={} actor={}, reason={}",
                    row.getEventKind(), row.getActorId(), ex.toString());
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= 255) return s;
        return s.substring(0, 255);
    }
}
