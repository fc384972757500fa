package com.franchise.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(batchId)) {
 *     log.info("batch.resolved records={} lookups={}", records, lookups);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: contexts opened on a worker thread must be closed on that thread.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole resolution batch.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "resolve-batch");
        return ctx;
    }

    /**
     * Context for the single lookup of one key.
     */
    public static LogContext forLookup(String batchId, String resolutionKey) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("resolutionKey", resolutionKey);
        ctx.put("operation", "lookup");
        return ctx;
    }

    /**
     * Context for persisting resolved names of one record.
     */
    public static LogContext forBackfill(String batchId, long recordId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("recordId", Long.toString(recordId));
        ctx.put("operation", "backfill");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
