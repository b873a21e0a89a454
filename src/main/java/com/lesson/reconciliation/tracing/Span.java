package com.lesson.reconciliation.tracing;

/**
 * A traced unit of work, ended on {@link #close()}.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("lesson.reconcile", Map.of("tenantId", tenantId))) {
 *     span.setAttribute("matched", result.count(OutcomeType.MATCHED));
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the span as failed with a short description.
     */
    void markError(String description);

    @Override
    void close();
}
