package com.sky.association.audit;

import java.util.List;

/**
 * Storage backend for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByRunId(String runId);

    int count();
}
