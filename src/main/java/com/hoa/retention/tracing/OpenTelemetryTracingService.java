package com.hoa.retention.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-backed {@link TracingService}. Retention runs are internal
 * spans whose attribute keys are prefixed with {@code retention.}.
 */
public class OpenTelemetryTracingService implements TracingService {

    private static final String ATTRIBUTE_PREFIX = "retention.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRun(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new RunSpan(builder.startSpan());
    }

    private static final class RunSpan implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        RunSpan(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void recordCount(String key, long value) {
            otelSpan.setAttribute(AttributeKey.longKey(ATTRIBUTE_PREFIX + key), value);
        }

        @Override
        public void succeed() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR, cause.getMessage() == null ? "" : cause.getMessage());
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
