package com.lesson.reconciliation.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("lesson.reconcile")) {
                    span.setAttribute("tenantId", "school-1");
                    span.setAttribute("matched", 42L);
                    span.markError("boom");
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2", Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        @Test
        @DisplayName("Should create span with name and attributes")
        void createSpan() {
            Tracer mockTracer = mock(Tracer.class);
            SpanBuilder mockBuilder = mock(SpanBuilder.class);
            io.opentelemetry.api.trace.Span mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(mockTracer.spanBuilder("lesson.align")).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);

            OpenTelemetryTracingService service = new OpenTelemetryTracingService(mockTracer);
            Span span = service.startSpan("lesson.align", Map.of("lessonId", "L1"));

            assertNotNull(span);
            verify(mockBuilder).setAttribute("lessonId", "L1");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes, errors and end")
        void forwardToDelegate() {
            Tracer mockTracer = mock(Tracer.class);
            SpanBuilder mockBuilder = mock(SpanBuilder.class);
            io.opentelemetry.api.trace.Span mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);

            OpenTelemetryTracingService service = new OpenTelemetryTracingService(mockTracer);
            try (Span span = service.startSpan("lesson.reconcile")) {
                span.setAttribute("tenantId", "school-1");
                span.setAttribute("matched", 3L);
                span.markError("feed unreachable");
            }

            verify(mockOtelSpan).setAttribute("tenantId", "school-1");
            verify(mockOtelSpan).setAttribute("matched", 3L);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR, "feed unreachable");
            verify(mockOtelSpan).end();
        }
    }
}
