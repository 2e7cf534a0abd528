package com.sky.association.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records and queries audit entries. Append-only.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} in run {}", entry.action(), entry.subjectId(), entry.runId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String runId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .runId(runId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String subjectId, String runId) {
        return record(action, subjectId, runId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return repository.findByRunId(runId);
    }

    public int size() {
        return repository.count();
    }
}
