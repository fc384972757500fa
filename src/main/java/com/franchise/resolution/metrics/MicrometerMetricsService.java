package com.franchise.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code franchise.resolution.batch.size} - DistributionSummary</li>
 *   <li>{@code franchise.resolution.fastpath} - Counter</li>
 *   <li>{@code franchise.resolution.lookup.duration} - Timer (tag: outcome)</li>
 *   <li>{@code franchise.resolution.lookup.shared} - Counter</li>
 *   <li>{@code franchise.resolution.backfill} - Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final DistributionSummary batchSizeSummary;
    private final Counter fastPathCounter;
    private final Counter sharedLookupCounter;
    private final Map<LookupOutcome, Timer> lookupTimers = new EnumMap<>(LookupOutcome.class);
    private final Map<BackfillOutcome, Counter> backfillCounters = new EnumMap<>(BackfillOutcome.class);

    public MicrometerMetricsService(MeterRegistry registry) {
        this.batchSizeSummary = DistributionSummary.builder("franchise.resolution.batch.size")
                .description("Number of records per resolution batch")
                .register(registry);
        this.fastPathCounter = Counter.builder("franchise.resolution.fastpath")
                .description("Records resolved from already persisted names")
                .register(registry);
        this.sharedLookupCounter = Counter.builder("franchise.resolution.lookup.shared")
                .description("Records served by a lookup issued for another record with the same key")
                .register(registry);
        for (LookupOutcome outcome : LookupOutcome.values()) {
            lookupTimers.put(outcome, Timer.builder("franchise.resolution.lookup.duration")
                    .description("Duration of external franchise lookups")
                    .tag("outcome", tagValue(outcome))
                    .register(registry));
        }
        for (BackfillOutcome outcome : BackfillOutcome.values()) {
            backfillCounters.put(outcome, Counter.builder("franchise.resolution.backfill")
                    .description("Resolved names written back to the record store")
                    .tag("outcome", tagValue(outcome))
                    .register(registry));
        }
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementFastPath() {
        fastPathCounter.increment();
    }

    @Override
    public void recordLookup(LookupOutcome outcome, Duration duration) {
        lookupTimers.get(outcome).record(duration);
    }

    @Override
    public void incrementSharedLookups(int count) {
        if (count > 0) {
            sharedLookupCounter.increment(count);
        }
    }

    @Override
    public void incrementBackfill(BackfillOutcome outcome) {
        backfillCounters.get(outcome).increment();
    }

    private static String tagValue(Enum<?> outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
