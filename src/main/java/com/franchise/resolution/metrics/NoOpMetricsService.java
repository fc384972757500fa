package com.franchise.resolution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementFastPath() {
    }

    @Override
    public void recordLookup(LookupOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementSharedLookups(int count) {
    }

    @Override
    public void incrementBackfill(BackfillOutcome outcome) {
    }
}
