package com.lesson.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC.
 * Keys added through this context are removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forReconciliation(correlationId, tenantId)) {
 *     log.info("reconciliation.completed matched={}", matched);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a context for a reconciliation run of one tenant.
     */
    public static LogContext forReconciliation(String correlationId, String tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("tenantId", tenantId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Creates a context for one alignment attempt.
     */
    public static LogContext forAlignment(String correlationId, String lessonId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("lessonId", lessonId);
        ctx.put("operation", "align");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds a key to this context. Null values are ignored.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    /**
     * Removes the keys this context added.
     */
    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
