package com.franchise.resolution.tracing;

import java.util.Map;

/**
 * Distributed tracing seam. {@link NoOpTracingService} is the default;
 * {@link OpenTelemetryTracingService} adapts an OpenTelemetry tracer.
 */
public interface TracingService {

    /** Span covering one {@code resolveBatch} call. */
    String BATCH_SPAN = "franchise.batch";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span of one resolution batch, tagged with its batch id so it can be joined
     * with the batch's log lines.
     */
    default Span startBatchSpan(String batchId) {
        return startSpan(BATCH_SPAN, Map.of("batchId", batchId));
    }
}
