package com.franchise.resolution.tracing;

import java.util.Map;

/**
 * A unit of work in a distributed trace. Usable in try-with-resources, which ends the span.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("franchise.batch")) {
 *     span.setAttribute("records", 42L);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Adds a timestamped event, e.g. one failed write among many successful ones.
     */
    void addEvent(String name, Map<String, String> attributes);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
