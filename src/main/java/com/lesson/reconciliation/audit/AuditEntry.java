package com.lesson.reconciliation.audit;

import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One step of a reconciliation run or alignment attempt, as kept in the audit trail.
 *
 * <p>Entries built inside a {@link com.lesson.reconciliation.logging.LogContext} pick up
 * its correlation id, so the trail can be joined with the log lines of the same run.</p>
 *
 * @param id            entry id
 * @param action        what happened
 * @param subjectId     the DB lesson id, or the tenant id for whole-run entries
 * @param actorId       component that recorded the entry
 * @param correlationId correlation id of the surrounding run or alignment, or null
 * @param details       free-form details
 * @param timestamp     when it happened
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        String correlationId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        id = id != null ? id : UUID.randomUUID().toString();
        timestamp = timestamp != null ? timestamp : Instant.now();
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private AuditAction action;
        private String subjectId;
        private String actorId;
        private String correlationId = MDC.get("correlationId");
        private Map<String, Object> details;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subjectId, actorId, correlationId, details, timestamp);
        }
    }
}
