package com.hoa.retention.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
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
        @DisplayName("A run span should accept every call")
        void runLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startRun("retention.sweep", Map.of("sweepId", "s-1"))) {
                    span.recordCount("deleted", 12);
                    span.fail(new IllegalStateException("boom"));
                    span.succeed();
                }
            });
        }

        @Test
        @DisplayName("Should hand out one shared span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startRun("retention.sweep"), noOp.startRun("retention.purge"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class, RETURNS_SELF);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should start an internal span with prefixed attributes")
        void startRun() {
            service.startRun("retention.purge", Map.of("actorId", "admin"));

            verify(tracer).spanBuilder("retention.purge");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute("retention.actorId", "admin");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Should record counts as long attributes")
        void recordCount() {
            Span span = service.startRun("retention.sweep");
            span.recordCount("deleted", 7);

            verify(otelSpan).setAttribute(AttributeKey.longKey("retention.deleted"), 7L);
        }

        @Test
        @DisplayName("Should mark success")
        void succeed() {
            service.startRun("retention.sweep").succeed();

            verify(otelSpan).setStatus(StatusCode.OK);
        }

        @Test
        @DisplayName("Should record the failure cause")
        void fail() {
            IllegalStateException cause = new IllegalStateException("store down");
            service.startRun("retention.sweep").fail(cause);

            verify(otelSpan).recordException(cause);
            verify(otelSpan).setStatus(StatusCode.ERROR, "store down");
        }

        @Test
        @DisplayName("Should end the span on close")
        void close() {
            service.startRun("retention.sweep").close();

            verify(otelSpan).end();
        }
    }
}
