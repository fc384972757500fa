package com.franchise.resolution.metrics;

import java.time.Duration;

/**
 * Records name resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    enum LookupOutcome { FOUND, NOT_FOUND, FAILED }

    enum BackfillOutcome { SUCCESS, FAILURE, ABANDONED }

    void recordBatchSize(int size);

    void incrementFastPath();

    void recordLookup(LookupOutcome outcome, Duration duration);

    /**
     * Records that {@code count} records were served by a lookup issued for another record.
     */
    void incrementSharedLookups(int count);

    void incrementBackfill(BackfillOutcome outcome);
}
