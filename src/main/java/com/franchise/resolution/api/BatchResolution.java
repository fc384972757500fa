package com.franchise.resolution.api;

import com.franchise.resolution.core.model.ResolutionResult;
import com.franchise.resolution.core.model.ResolutionSource;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of {@link BatchResolver#resolveBatch}: one {@link ResolutionResult} per input record,
 * in input order, plus the handle on the batch's backfill writes.
 *
 * <p>When the resolver runs with {@link ResolverOptions.BackfillMode#DETACHED}, callers must
 * invoke {@link #awaitBackfill()} before their request completes.</p>
 */
public final class BatchResolution {

    private final String batchId;
    private final Map<Long, ResolutionResult> results;
    private final Map<Long, ResolutionSource> sources;
    private final int lookupCount;
    private final BackfillTracker backfill;
    private final Duration backfillTimeout;
    private final String unresolvedPlaceholder;

    BatchResolution(String batchId,
                    Map<Long, ResolutionResult> results,
                    Map<Long, ResolutionSource> sources,
                    int lookupCount,
                    BackfillTracker backfill,
                    ResolverOptions options) {
        this.batchId = batchId;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.lookupCount = lookupCount;
        this.backfill = backfill;
        this.backfillTimeout = options.getBackfillTimeout();
        this.unresolvedPlaceholder = options.getUnresolvedPlaceholder();
    }

    public String batchId() {
        return batchId;
    }

    /**
     * Record id to resolved names, in input order.
     */
    public Map<Long, ResolutionResult> results() {
        return results;
    }

    public Optional<ResolutionResult> get(long recordId) {
        return Optional.ofNullable(results.get(recordId));
    }

    public Optional<ResolutionSource> sourceOf(long recordId) {
        return Optional.ofNullable(sources.get(recordId));
    }

    public int size() {
        return results.size();
    }

    /**
     * Number of external lookups issued for this batch (one per distinct unresolved key).
     */
    public int lookupCount() {
        return lookupCount;
    }

    /**
     * Franchise name to display for a record, or the unresolved placeholder.
     */
    public String franchiseDisplayName(long recordId) {
        ResolutionResult result = results.get(recordId);
        return result != null ? result.franchiseNameOr(unresolvedPlaceholder) : unresolvedPlaceholder;
    }

    /**
     * Outlet name to display for a record, or the unresolved placeholder.
     */
    public String outletDisplayName(long recordId) {
        ResolutionResult result = results.get(recordId);
        return result != null ? result.outletNameOr(unresolvedPlaceholder) : unresolvedPlaceholder;
    }

    public int backfillsDispatched() {
        return backfill.dispatchedCount();
    }

    public int pendingBackfills() {
        return backfill.pendingCount();
    }

    /**
     * Waits for backfill writes using the resolver's configured backfill timeout.
     */
    public BackfillReport awaitBackfill() {
        return awaitBackfill(backfillTimeout);
    }

    /**
     * Waits up to {@code timeout} for backfill writes. Writes still outstanding afterwards
     * are cancelled and reported as abandoned. Idempotent: later calls return the first report.
     */
    public BackfillReport awaitBackfill(Duration timeout) {
        return backfill.drain(timeout);
    }

    @Override
    public String toString() {
        return "BatchResolution{" +
                "batchId=" + batchId +
                ", records=" + results.size() +
                ", lookups=" + lookupCount +
                ", backfills=" + backfill.dispatchedCount() +
                '}';
    }
}
