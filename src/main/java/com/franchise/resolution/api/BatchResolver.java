package com.franchise.resolution.api;

import com.franchise.resolution.core.model.NameRecord;
import com.franchise.resolution.core.model.ResolutionKey;
import com.franchise.resolution.core.model.ResolutionResult;
import com.franchise.resolution.core.model.ResolutionSource;
import com.franchise.resolution.logging.LogContext;
import com.franchise.resolution.metrics.MetricsService;
import com.franchise.resolution.metrics.MetricsService.LookupOutcome;
import com.franchise.resolution.metrics.NoOpMetricsService;
import com.franchise.resolution.tracing.NoOpTracingService;
import com.franchise.resolution.tracing.Span;
import com.franchise.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves franchise and outlet display names for a batch of records.
 *
 * <p>Per batch:</p>
 * <ol>
 *   <li>Records that already carry a persisted name are answered from it (fast path).</li>
 *   <li>The remaining records are grouped by normalized {@link ResolutionKey}; records without
 *       a key resolve to not-found.</li>
 *   <li>Exactly one lookup is issued per distinct key, concurrently across keys, and its result
 *       is assigned to every record of the group. A failed or timed-out lookup yields not-found
 *       for the whole group.</li>
 *   <li>Every record that newly resolved to a positive result gets one backfill write.</li>
 * </ol>
 *
 * <p>Grouping completes before any lookup is dispatched, so the batch-scoped key map needs no
 * locking. Nothing is cached across batches.</p>
 *
 * <pre>
 * try (BatchResolver resolver = BatchResolver.builder().build()) {
 *     BatchResolution resolution = resolver.resolveBatch(records, lookupClient, recordStore);
 *     String franchise = resolution.franchiseDisplayName(ticketId);
 * }
 * </pre>
 */
public class BatchResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchResolver.class);

    private final ResolverOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService lookupExecutor;
    private final ExecutorService backfillExecutor;
    private final AtomicLong abandonedBackfills = new AtomicLong();

    private BatchResolver(Builder builder) {
        this.options = builder.options != null ? builder.options : ResolverOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.lookupExecutor = Executors.newFixedThreadPool(options.getMaxConcurrentLookups(),
                namedThreadFactory("franchise-lookup"));
        this.backfillExecutor = Executors.newFixedThreadPool(options.getMaxConcurrentBackfills(),
                namedThreadFactory("franchise-backfill"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResolverOptions getOptions() {
        return options;
    }

    /**
     * Total backfill writes reported as abandoned since this resolver was created.
     */
    public long getAbandonedBackfillCount() {
        return abandonedBackfills.get();
    }

    /**
     * Resolves names for every record of the batch.
     *
     * @param records batch of records with unique ids
     * @param lookup  external name lookup, called at most once per distinct key
     * @param writer  receives one write per newly and positively resolved record
     * @return per-record results; present for every input record
     * @throws NullPointerException         if an argument or a record is null
     * @throws IllegalArgumentException     on duplicate record ids or an oversized batch
     * @throws ResolutionCancelledException if the calling thread is interrupted while waiting for lookups
     */
    public BatchResolution resolveBatch(List<NameRecord> records, FranchiseLookup lookup, ResolutionWriter writer) {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(lookup, "lookup is required");
        Objects.requireNonNull(writer, "writer is required");
        validateBatch(records);

        String batchId = LogContext.generateBatchId();
        try (LogContext logCtx = LogContext.forBatch(batchId);
             Span span = tracingService.startBatchSpan(batchId)) {

            metricsService.recordBatchSize(records.size());

            Map<Long, ResolutionResult> results = new LinkedHashMap<>();
            Map<Long, ResolutionSource> sources = new LinkedHashMap<>();
            Map<ResolutionKey, List<NameRecord>> groups = new LinkedHashMap<>();
            int fastPath = 0;

            for (NameRecord record : records) {
                if (record.hasExistingNames()) {
                    results.put(record.id(), ResolutionResult.fromExisting(
                            record.existingFranchiseName(), record.existingOutletName()));
                    sources.put(record.id(), ResolutionSource.EXISTING);
                    metricsService.incrementFastPath();
                    fastPath++;
                } else if (!record.isResolvable()) {
                    results.put(record.id(), ResolutionResult.notFound());
                    sources.put(record.id(), ResolutionSource.INVALID_KEY);
                    log.debug("record.unresolvable recordId={}", record.id());
                } else {
                    // reserve the slot so results keep input order
                    results.put(record.id(), null);
                    groups.computeIfAbsent(record.key(), k -> new ArrayList<>()).add(record);
                }
            }

            Map<ResolutionKey, PendingLookup> inFlight;
            try {
                inFlight = lookupAll(batchId, groups.keySet(), lookup);
            } catch (ResolutionCancelledException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }

            BackfillTracker backfill = new BackfillTracker(batchId, backfillExecutor, metricsService,
                    abandonedBackfills::addAndGet);
            int failedLookups = 0;
            for (Map.Entry<ResolutionKey, List<NameRecord>> group : groups.entrySet()) {
                KeyOutcome outcome = inFlight.get(group.getKey()).outcome().join();
                if (outcome.source() == ResolutionSource.LOOKUP_FAILED) {
                    failedLookups++;
                }
                for (NameRecord record : group.getValue()) {
                    results.put(record.id(), outcome.result());
                    sources.put(record.id(), outcome.source());
                    if (outcome.source() == ResolutionSource.LOOKUP && outcome.result().isBackfillable()) {
                        backfill.dispatch(record.id(), outcome.result(), writer);
                    }
                }
                metricsService.incrementSharedLookups(group.getValue().size() - 1);
            }

            span.setAttribute("records", records.size());
            span.setAttribute("fastPath", fastPath);
            span.setAttribute("lookups", groups.size());
            span.setAttribute("failedLookups", failedLookups);
            span.setAttribute("backfillsDispatched", backfill.dispatchedCount());

            BatchResolution resolution = new BatchResolution(batchId, results, sources, groups.size(),
                    backfill, options);

            if (options.getBackfillMode() == ResolverOptions.BackfillMode.AWAIT) {
                BackfillReport report = resolution.awaitBackfill(options.getBackfillTimeout());
                span.setAttribute("backfillsFailed", report.failed().size());
                span.setAttribute("backfillsAbandoned", report.abandoned().size());
                report.failed().forEach((recordId, reason) -> span.addEvent("backfill.failed",
                        Map.of("recordId", Long.toString(recordId), "reason", reason)));
            }

            span.setStatus(Span.SpanStatus.OK);
            log.info("batch.resolved records={} fastPath={} lookups={} failedLookups={} backfillsDispatched={}",
                    records.size(), fastPath, groups.size(), failedLookups, backfill.dispatchedCount());
            return resolution;
        }
    }

    /**
     * Resolves one result per distinct key without writing anything back.
     *
     * <p>A key for which any record already carries persisted names is answered from those
     * names; every other key gets a single lookup. Records without a key are skipped.</p>
     *
     * @return normalized key to result, in first-seen order
     */
    public Map<ResolutionKey, ResolutionResult> resolveKeys(List<NameRecord> records, FranchiseLookup lookup) {
        Objects.requireNonNull(records, "records is required");
        Objects.requireNonNull(lookup, "lookup is required");

        String batchId = LogContext.generateBatchId();
        try (LogContext logCtx = LogContext.forBatch(batchId)) {
            Map<ResolutionKey, ResolutionResult> resolved = new LinkedHashMap<>();
            Set<ResolutionKey> pending = new LinkedHashSet<>();
            for (NameRecord record : records) {
                Objects.requireNonNull(record, "records must not contain null");
                if (!record.isResolvable()) {
                    continue;
                }
                ResolutionKey key = record.key();
                if (record.hasExistingNames()) {
                    if (!resolved.containsKey(key) || resolved.get(key) == null) {
                        resolved.put(key, ResolutionResult.fromExisting(
                                record.existingFranchiseName(), record.existingOutletName()));
                        pending.remove(key);
                        metricsService.incrementFastPath();
                    }
                } else if (!resolved.containsKey(key)) {
                    resolved.put(key, null);
                    pending.add(key);
                }
            }

            Map<ResolutionKey, PendingLookup> inFlight = lookupAll(batchId, pending, lookup);
            inFlight.forEach((key, call) -> resolved.put(key, call.outcome().join().result()));

            log.info("keys.resolved keys={} lookups={}", resolved.size(), inFlight.size());
            return resolved;
        }
    }

    private void validateBatch(List<NameRecord> records) {
        if (records.size() > options.getMaxBatchSize()) {
            throw new IllegalArgumentException("Batch of " + records.size() +
                    " records exceeds maxBatchSize " + options.getMaxBatchSize());
        }
        Set<Long> ids = new HashSet<>();
        for (NameRecord record : records) {
            Objects.requireNonNull(record, "records must not contain null");
            if (!ids.add(record.id())) {
                throw new IllegalArgumentException("Duplicate record id in batch: " + record.id());
            }
        }
    }

    /**
     * Dispatches one lookup per key and waits until all have settled.
     */
    private Map<ResolutionKey, PendingLookup> lookupAll(String batchId, Set<ResolutionKey> keys,
                                                        FranchiseLookup lookup) {
        Map<ResolutionKey, PendingLookup> inFlight = new LinkedHashMap<>();
        for (ResolutionKey key : keys) {
            inFlight.put(key, dispatchLookup(batchId, key, lookup));
        }
        if (inFlight.isEmpty()) {
            return inFlight;
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.values().stream()
                .map(PendingLookup::outcome)
                .toArray(CompletableFuture[]::new));
        try {
            all.get();
        } catch (InterruptedException e) {
            inFlight.values().forEach(pending -> pending.call().cancel(true));
            Thread.currentThread().interrupt();
            log.warn("batch.cancelled batchId={} outstandingLookups={}", batchId,
                    inFlight.values().stream().filter(p -> !p.outcome().isDone()).count());
            throw new ResolutionCancelledException(batchId, e);
        } catch (ExecutionException e) {
            // outcomes are built with handle() and never complete exceptionally
            throw new IllegalStateException("Lookup outcome failed unexpectedly", e.getCause());
        }
        return inFlight;
    }

    /**
     * Queues the lookup of one key. The timeout starts when a lookup thread picks the task up,
     * so keys waiting for a free thread are not failed by time spent in the queue.
     */
    private PendingLookup dispatchLookup(String batchId, ResolutionKey key, FranchiseLookup lookup) {
        CompletableFuture<ResolutionResult> call = new CompletableFuture<>();
        AtomicLong startedAt = new AtomicLong();
        try {
            lookupExecutor.execute(() -> runLookup(batchId, key, lookup, call, startedAt));
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        CompletableFuture<KeyOutcome> outcome = call.handle((result, error) -> {
            if (error == null) {
                return new KeyOutcome(result, ResolutionSource.LOOKUP);
            }
            metricsService.recordLookup(LookupOutcome.FAILED, elapsedSince(startedAt.get()));
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                log.warn("lookup.timeout batchId={} key={} timeout={}", batchId, key, options.getLookupTimeout());
            } else {
                log.warn("lookup.failed batchId={} key={} reason={}", batchId, key, cause.toString());
            }
            return new KeyOutcome(ResolutionResult.notFound(), ResolutionSource.LOOKUP_FAILED);
        });
        return new PendingLookup(call, outcome);
    }

    /**
     * Runs on a lookup thread. Only the completion that settles {@code call} is counted, so a
     * lookup finishing after its timeout is not recorded a second time.
     */
    private void runLookup(String batchId, ResolutionKey key, FranchiseLookup lookup,
                           CompletableFuture<ResolutionResult> call, AtomicLong startedAt) {
        if (call.isDone()) {
            // cancelled while queued
            return;
        }
        startedAt.set(System.nanoTime());
        call.orTimeout(options.getLookupTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try (LogContext ctx = LogContext.forLookup(batchId, key.asString())) {
            ResolutionResult result;
            try {
                result = lookup.lookup(key.franchiseId(), key.outletId());
            } catch (Throwable t) {
                call.completeExceptionally(t);
                return;
            }
            if (result == null) {
                result = ResolutionResult.notFound();
            }
            if (call.complete(result)) {
                metricsService.recordLookup(result.found() ? LookupOutcome.FOUND : LookupOutcome.NOT_FOUND,
                        elapsedSince(startedAt.get()));
                log.debug("lookup.completed found={}", result.found());
            } else {
                log.debug("lookup.discarded found={} reason=already settled", result.found());
            }
        }
    }

    private static Duration elapsedSince(long startedAtNanos) {
        return startedAtNanos == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }

    @Override
    public void close() {
        shutdown(lookupExecutor);
        shutdown(backfillExecutor);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static class Builder {
        private ResolverOptions options;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(ResolverOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public BatchResolver build() {
            return new BatchResolver(this);
        }
    }

    private record PendingLookup(CompletableFuture<ResolutionResult> call,
                                 CompletableFuture<KeyOutcome> outcome) {}

    private record KeyOutcome(ResolutionResult result, ResolutionSource source) {}
}
