package com.franchise.resolution.metrics;

import com.franchise.resolution.metrics.MetricsService.BackfillOutcome;
import com.franchise.resolution.metrics.MetricsService.LookupOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBatchSize(50);
                noOp.incrementFastPath();
                noOp.recordLookup(LookupOutcome.FOUND, Duration.ofMillis(100));
                noOp.incrementSharedLookups(3);
                noOp.incrementBackfill(BackfillOutcome.ABANDONED);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record batch size as distribution summary")
        void recordBatchSize() {
            metrics.recordBatchSize(10);
            metrics.recordBatchSize(30);

            DistributionSummary summary = registry.find("franchise.resolution.batch.size").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count fast-path records")
        void incrementFastPath() {
            metrics.incrementFastPath();
            metrics.incrementFastPath();

            assertEquals(2.0, registry.find("franchise.resolution.fastpath").counter().count());
        }

        @Test
        @DisplayName("Should record lookup durations tagged by outcome")
        void recordLookup() {
            metrics.recordLookup(LookupOutcome.FOUND, Duration.ofMillis(40));
            metrics.recordLookup(LookupOutcome.NOT_FOUND, Duration.ofMillis(20));
            metrics.recordLookup(LookupOutcome.FAILED, Duration.ofMillis(10));
            metrics.recordLookup(LookupOutcome.FAILED, Duration.ofMillis(10));

            Timer found = registry.find("franchise.resolution.lookup.duration").tag("outcome", "found").timer();
            Timer failed = registry.find("franchise.resolution.lookup.duration").tag("outcome", "failed").timer();
            assertEquals(1, found.count());
            assertEquals(2, failed.count());
            assertEquals(1, registry.find("franchise.resolution.lookup.duration")
                    .tag("outcome", "not_found").timer().count());
        }

        @Test
        @DisplayName("Should add shared lookups and ignore zero")
        void incrementSharedLookups() {
            metrics.incrementSharedLookups(4);
            metrics.incrementSharedLookups(0);

            Counter counter = registry.find("franchise.resolution.lookup.shared").counter();
            assertEquals(4.0, counter.count());
        }

        @Test
        @DisplayName("Should count backfill writes tagged by outcome")
        void incrementBackfill() {
            metrics.incrementBackfill(BackfillOutcome.SUCCESS);
            metrics.incrementBackfill(BackfillOutcome.SUCCESS);
            metrics.incrementBackfill(BackfillOutcome.ABANDONED);

            assertEquals(2.0, registry.find("franchise.resolution.backfill")
                    .tag("outcome", "success").counter().count());
            assertEquals(0.0, registry.find("franchise.resolution.backfill")
                    .tag("outcome", "failure").counter().count());
            assertEquals(1.0, registry.find("franchise.resolution.backfill")
                    .tag("outcome", "abandoned").counter().count());
        }
    }
}
