package com.franchise.resolution.health;

import com.franchise.resolution.api.BatchResolution;
import com.franchise.resolution.api.BatchResolver;
import com.franchise.resolution.api.FranchiseLookup;
import com.franchise.resolution.api.ResolverOptions;
import com.franchise.resolution.core.model.NameRecord;
import com.franchise.resolution.core.model.ResolutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Lookup service status carries its response time")
        void lookupServiceStatus() {
            HealthStatus up = HealthStatus.lookupService(true, Duration.ofMillis(42));
            HealthStatus down = HealthStatus.lookupService(false, Duration.ofMillis(7));

            assertTrue(up.isUp());
            assertEquals("OK", up.message());
            assertEquals(Optional.of(Duration.ofMillis(42)), up.responseTime());
            assertTrue(down.isDown());
            assertEquals(7L, down.details().get(HealthStatus.RESPONSE_TIME_MS));
            assertTrue(up.abandonedBackfills().isEmpty());
        }

        @Test
        @DisplayName("Backfill status degrades with abandoned writes")
        void backfillStatus() {
            HealthStatus clean = HealthStatus.backfill(0);
            HealthStatus degraded = HealthStatus.backfill(3);

            assertTrue(clean.isUp());
            assertEquals(OptionalLong.of(0), clean.abandonedBackfills());
            assertTrue(degraded.isDegraded());
            assertEquals("3 backfill writes abandoned", degraded.message());
            assertEquals(OptionalLong.of(3), degraded.abandonedBackfills());
            assertTrue(degraded.responseTime().isEmpty());
        }

        @Test
        @DisplayName("Statuses order from UP to DOWN")
        void ordering() {
            HealthStatus up = HealthStatus.backfill(0);
            HealthStatus degraded = HealthStatus.backfill(1);
            HealthStatus down = HealthStatus.lookupService(false, Duration.ZERO);

            assertTrue(down.isWorseThan(degraded));
            assertTrue(degraded.isWorseThan(up));
            assertFalse(up.isWorseThan(up));
        }

        @Test
        @DisplayName("withDetail() keeps existing details and is immutable")
        void withDetail() {
            HealthStatus status = HealthStatus.up("OK")
                    .withDetail("endpoint", "/api/login")
                    .withDetail("region", "sg");

            assertEquals(2, status.details().size());
            assertEquals("/api/login", status.details().get("endpoint"));
            assertThrows(UnsupportedOperationException.class,
                    () -> status.details().put("another", "value"));
        }
    }

    @Nested
    @DisplayName("LookupServiceHealthCheck")
    class LookupServiceTests {

        @Test
        @DisplayName("UP when the lookup service is available")
        void available() {
            FranchiseLookup lookup = mock(FranchiseLookup.class);
            when(lookup.isAvailable()).thenReturn(true);

            HealthStatus status = new LookupServiceHealthCheck(lookup).check();

            assertTrue(status.isUp());
            assertTrue(status.responseTime().isPresent());
        }

        @Test
        @DisplayName("DOWN when the lookup service is unavailable")
        void unavailable() {
            FranchiseLookup lookup = mock(FranchiseLookup.class);
            when(lookup.isAvailable()).thenReturn(false);

            LookupServiceHealthCheck check = new LookupServiceHealthCheck(lookup);

            assertTrue(check.check().isDown());
            assertEquals("franchise-lookup", check.getName());
        }
    }

    @Nested
    @DisplayName("BackfillHealthCheck")
    class BackfillTests {

        @Test
        @DisplayName("UP while no write has been abandoned")
        void upWithoutAbandoned() {
            try (BatchResolver resolver = BatchResolver.builder().build()) {
                HealthStatus status = new BackfillHealthCheck(resolver).check();

                assertTrue(status.isUp());
                assertEquals(OptionalLong.of(0), status.abandonedBackfills());
            }
        }

        @Test
        @DisplayName("DEGRADED after a write was abandoned")
        void degradedAfterAbandon() {
            CountDownLatch release = new CountDownLatch(1);
            try (BatchResolver resolver = BatchResolver.builder().options(ResolverOptions.detached()).build()) {
                BatchResolution resolution = resolver.resolveBatch(
                        List.of(NameRecord.of(1, "1", "1", null, null)),
                        (fid, oid) -> ResolutionResult.of("Alpha", null),
                        (id, f, o) -> {
                            try {
                                release.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        });
                resolution.awaitBackfill(Duration.ofMillis(20));
                release.countDown();

                HealthStatus status = new BackfillHealthCheck(resolver).check();

                assertTrue(status.isDegraded());
                assertEquals(OptionalLong.of(1), status.abandonedBackfills());
            } finally {
                release.countDown();
            }
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry is UP")
        void emptyRegistry() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Worst status wins and per-check results are reported")
        void worstStatusWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("franchise-lookup", HealthStatus.lookupService(true, Duration.ofMillis(15))));
            registry.register(check("backfill", HealthStatus.backfill(2)));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDegraded());
            assertEquals("backfill: 2 backfill writes abandoned", status.message());
            assertEquals(2, registry.size());
            assertTrue(status.details().containsKey("franchise-lookup"));
            assertInstanceOf(Map.class, status.details().get("backfill"));
            assertEquals(Optional.of(Duration.ofMillis(15)), status.responseTime());
            assertEquals(OptionalLong.of(2), status.abandonedBackfills());
        }

        @Test
        @DisplayName("Throwing check counts as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            HealthCheck broken = mock(HealthCheck.class);
            when(broken.getName()).thenReturn("broken");
            when(broken.check()).thenThrow(new IllegalStateException("boom"));
            registry.register(broken);
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("broken: broken check failed: boom", status.message());
            assertEquals(1, registry.size());
        }

        private HealthCheck check(String name, HealthStatus result) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return result;
                }
            };
        }
    }
}
