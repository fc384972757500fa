package com.franchise.resolution.api;

import com.franchise.resolution.core.model.ResolutionResult;
import com.franchise.resolution.metrics.MetricsService;
import com.franchise.resolution.metrics.MetricsService.BackfillOutcome;
import com.franchise.resolution.store.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("BackfillTracker Tests")
class BackfillTrackerTest {

    private static final ResolutionResult ALPHA = ResolutionResult.of("Alpha", "Alpha 1");

    private MetricsService metrics;
    private AtomicInteger abandoned;
    private List<Long> written;

    @BeforeEach
    void setUp() {
        metrics = mock(MetricsService.class);
        abandoned = new AtomicInteger();
        written = new ArrayList<>();
    }

    private BackfillTracker tracker(Executor executor) {
        return new BackfillTracker("batch-1", executor, metrics, abandoned::addAndGet);
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Each record can be dispatched only once")
        void onlyOncePerRecord() {
            BackfillTracker tracker = tracker(Runnable::run);
            tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id));

            assertThrows(IllegalStateException.class,
                    () -> tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id)));
            assertEquals(List.of(1L), written);
            assertEquals(1, tracker.dispatchedCount());
        }

        @Test
        @DisplayName("Dispatch after drain is rejected")
        void dispatchAfterDrain() {
            BackfillTracker tracker = tracker(Runnable::run);
            tracker.drain(Duration.ofSeconds(1));

            assertThrows(IllegalStateException.class,
                    () -> tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id)));
        }

        @Test
        @DisplayName("Writer receives the resolved names")
        void writerReceivesNames() {
            List<String> names = new ArrayList<>();
            BackfillTracker tracker = tracker(Runnable::run);

            tracker.dispatch(7, ALPHA, (id, f, o) -> {
                names.add(f);
                names.add(o);
            });

            assertEquals(List.of("Alpha", "Alpha 1"), names);
            verify(metrics).incrementBackfill(BackfillOutcome.SUCCESS);
        }

        @Test
        @DisplayName("Rejected execution is reported as a failed write")
        void rejectedExecution() {
            BackfillTracker tracker = tracker(task -> {
                throw new RejectedExecutionException("shut down");
            });

            tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id));
            BackfillReport report = tracker.drain(Duration.ofSeconds(1));

            assertTrue(written.isEmpty());
            assertTrue(report.failed().containsKey(1L));
            assertTrue(report.isComplete());
            verify(metrics).incrementBackfill(BackfillOutcome.FAILURE);
        }
    }

    @Nested
    @DisplayName("Drain")
    class DrainTests {

        @Test
        @DisplayName("Collects successes and failures")
        void collectsOutcomes() {
            BackfillTracker tracker = tracker(Runnable::run);
            ResolutionWriter writer = (id, f, o) -> {
                if (id == 2) {
                    throw new PersistenceException(id, "constraint violated");
                }
                written.add(id);
            };
            tracker.dispatch(1, ALPHA, writer);
            tracker.dispatch(2, ALPHA, writer);

            BackfillReport report = tracker.drain(Duration.ofSeconds(1));

            assertEquals(2, report.dispatched());
            assertEquals(List.of(1L), report.succeeded());
            assertEquals("constraint violated", report.failed().get(2L));
            assertTrue(report.hasFailures());
            assertEquals(0, abandoned.get());
            verify(metrics).incrementBackfill(BackfillOutcome.FAILURE);
        }

        @Test
        @DisplayName("Writes not started in time are abandoned and never applied")
        void unstartedWritesAbandoned() {
            List<Runnable> queued = new ArrayList<>();
            BackfillTracker tracker = tracker(queued::add);
            tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id));
            assertEquals(1, tracker.pendingCount());

            BackfillReport report = tracker.drain(Duration.ofMillis(20));
            queued.forEach(Runnable::run);

            assertEquals(List.of(1L), report.abandoned());
            assertFalse(report.isComplete());
            assertTrue(written.isEmpty());
            assertEquals(1, abandoned.get());
            verify(metrics).incrementBackfill(BackfillOutcome.ABANDONED);
        }

        @Test
        @DisplayName("Repeated drains return the first report")
        void drainIsIdempotent() {
            BackfillTracker tracker = tracker(Runnable::run);
            tracker.dispatch(1, ALPHA, (id, f, o) -> written.add(id));

            BackfillReport first = tracker.drain(Duration.ofSeconds(1));
            BackfillReport second = tracker.drain(Duration.ofSeconds(1));

            assertSame(first, second);
        }

        @Test
        @DisplayName("Empty tracker drains to an empty report")
        void emptyDrain() {
            BackfillReport report = tracker(Runnable::run).drain(Duration.ofMillis(1));

            assertEquals(0, report.dispatched());
            assertTrue(report.isComplete());
            assertFalse(report.hasFailures());
        }
    }
}
