package com.franchise.resolution.api;

import com.franchise.resolution.core.model.ResolutionResult;
import com.franchise.resolution.logging.LogContext;
import com.franchise.resolution.metrics.MetricsService;
import com.franchise.resolution.metrics.MetricsService.BackfillOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;

/**
 * Tracks the backfill writes of one batch so none is left unobserved.
 *
 * <p>Each record gets at most one write. Writes run on the backfill executor and never
 * throw back into the batch; failures are logged and collected. {@link #drain(Duration)}
 * joins all writes and cancels the ones that have not settled in time, reporting them
 * as abandoned. A cancelled write that had not started is never applied; one already
 * running completes its single atomic update.</p>
 */
class BackfillTracker {
    private static final Logger log = LoggerFactory.getLogger(BackfillTracker.class);

    private final String batchId;
    private final Executor executor;
    private final MetricsService metricsService;
    private final IntConsumer abandonedListener;

    private final Map<Long, CompletableFuture<Void>> tasks = new LinkedHashMap<>();
    private final Set<Long> succeeded = ConcurrentHashMap.newKeySet();
    private final Map<Long, String> failed = new ConcurrentHashMap<>();
    private BackfillReport finalReport;

    BackfillTracker(String batchId, Executor executor, MetricsService metricsService,
                    IntConsumer abandonedListener) {
        this.batchId = batchId;
        this.executor = executor;
        this.metricsService = metricsService;
        this.abandonedListener = abandonedListener;
    }

    /**
     * Schedules the write of a positive result for one record.
     *
     * @throws IllegalStateException if a write was already dispatched for the record,
     *                               or the tracker has been drained
     */
    synchronized void dispatch(long recordId, ResolutionResult result, ResolutionWriter writer) {
        if (finalReport != null) {
            throw new IllegalStateException("Backfill for batch " + batchId + " already drained");
        }
        if (tasks.containsKey(recordId)) {
            throw new IllegalStateException("Backfill already dispatched for record " + recordId);
        }
        String franchiseName = result.franchiseName();
        String outletName = result.outletName();
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(
                    () -> write(recordId, franchiseName, outletName, writer), executor);
        } catch (RejectedExecutionException e) {
            failed.put(recordId, "backfill executor rejected the write");
            metricsService.incrementBackfill(BackfillOutcome.FAILURE);
            log.warn("backfill.rejected recordId={}", recordId);
            task = CompletableFuture.completedFuture(null);
        }
        tasks.put(recordId, task);
    }

    private void write(long recordId, String franchiseName, String outletName, ResolutionWriter writer) {
        try (LogContext ctx = LogContext.forBackfill(batchId, recordId)) {
            try {
                writer.storeResolution(recordId, franchiseName, outletName);
                succeeded.add(recordId);
                metricsService.incrementBackfill(BackfillOutcome.SUCCESS);
                log.debug("backfill.stored recordId={}", recordId);
            } catch (RuntimeException e) {
                failed.put(recordId, describe(e));
                metricsService.incrementBackfill(BackfillOutcome.FAILURE);
                log.warn("backfill.failed recordId={} reason={}", recordId, describe(e), e);
            }
        }
    }

    synchronized int dispatchedCount() {
        return tasks.size();
    }

    synchronized int pendingCount() {
        return (int) tasks.values().stream().filter(task -> !task.isDone()).count();
    }

    /**
     * Waits up to {@code timeout} for every dispatched write, then reports.
     * Subsequent calls return the same report.
     */
    synchronized BackfillReport drain(Duration timeout) {
        if (finalReport != null) {
            return finalReport;
        }
        if (!tasks.isEmpty()) {
            CompletableFuture<Void> all = CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0]));
            try {
                all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug("backfill.drain.timeout batchId={} timeout={}", batchId, timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("backfill.drain.interrupted batchId={}", batchId);
            } catch (ExecutionException e) {
                // writes catch their own failures
                log.warn("backfill.drain.error batchId={} reason={}", batchId, describe(e.getCause()));
            }
        }

        List<Long> succeededIds = new ArrayList<>();
        Map<Long, String> failedIds = new LinkedHashMap<>();
        List<Long> abandonedIds = new ArrayList<>();
        for (Map.Entry<Long, CompletableFuture<Void>> entry : tasks.entrySet()) {
            long recordId = entry.getKey();
            CompletableFuture<Void> task = entry.getValue();
            if (!task.isDone()) {
                task.cancel(false);
                abandonedIds.add(recordId);
                metricsService.incrementBackfill(BackfillOutcome.ABANDONED);
            } else if (succeeded.contains(recordId)) {
                succeededIds.add(recordId);
            } else if (failed.containsKey(recordId)) {
                failedIds.put(recordId, failed.get(recordId));
            } else {
                failedIds.put(recordId, task.isCancelled() ? "cancelled" : "write not executed");
            }
        }

        if (!abandonedIds.isEmpty()) {
            log.error("backfill.abandoned batchId={} records={}", batchId, abandonedIds);
            abandonedListener.accept(abandonedIds.size());
        }

        finalReport = new BackfillReport(tasks.size(), succeededIds, failedIds, abandonedIds);
        return finalReport;
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
