package com.lesson.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, in-memory trail of reconciliation runs and alignment attempts.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} by {}", entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    /**
     * Records an audit entry built from its parts.
     */
    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    /**
     * Gets all entries in the order they were recorded.
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Gets the entries recorded for a lesson or tenant id.
     */
    public List<AuditEntry> getEntriesFor(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .toList();
    }

    /**
     * Gets the entries of one reconciliation run or alignment attempt.
     */
    public List<AuditEntry> getEntriesForCorrelation(String correlationId) {
        return entries.stream()
                .filter(e -> correlationId.equals(e.correlationId()))
                .toList();
    }

    /**
     * Gets the entries of one action type.
     */
    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    /**
     * Gets the number of recorded entries.
     */
    public int size() {
        return entries.size();
    }
}
