package com.hoa.retention.tracing;

import java.util.Map;

/**
 * Starts spans for retention runs.
 * The default {@link NoOpTracingService} keeps the engine free of any tracing backend.
 */
public interface TracingService {

    Span startRun(String operationName, Map<String, String> attributes);

    default Span startRun(String operationName) {
        return startRun(operationName, Map.of());
    }
}
