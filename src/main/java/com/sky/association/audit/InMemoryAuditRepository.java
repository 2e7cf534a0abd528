package com.sky.association.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory implementation of AuditRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return select(e -> subjectId.equals(e.subjectId()));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return select(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findByRunId(String runId) {
        return select(e -> runId.equals(e.runId()));
    }

    @Override
    public int count() {
        return entries.size();
    }

    private List<AuditEntry> select(Predicate<AuditEntry> filter) {
        return entries.stream().filter(filter).toList();
    }
}
