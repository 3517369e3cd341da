package com.github.dimitryivaniuta.labelbridge.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {

    List<AuditRecord> findByActorIdOrderByIdAsc(String actorId);

    long countByEventKindAndOutcome(AuditEventKind eventKind, AuditOutcome outcome);
}
