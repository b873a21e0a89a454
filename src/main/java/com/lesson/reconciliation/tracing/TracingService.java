package com.lesson.reconciliation.tracing;

import java.util.Map;

/**
 * Starts spans around reconciliation runs and alignments.
 * The default {@link NoOpTracingService} does nothing, so the library works without
 * any tracing dependency on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
