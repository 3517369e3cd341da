package com.github.dimitryivaniuta.labelbridge.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists audit rows in an isolated transaction so business flows are not affected
 * by audit storage latency/failures.
 */
@Service
@RequiredArgsConstructor
public class AuditRecordWriter {

    private final AuditRecordRepository repo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void write(AuditRecord row) {
        repo.save(row);
    }
}
