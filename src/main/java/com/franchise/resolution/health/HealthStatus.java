package com.franchise.resolution.health;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Health of the lookup service, the backfill pipeline, or both combined.
 *
 * <p>The two figures operators watch are typed: the lookup service's response time and the
 * number of backfill writes abandoned since startup. {@code details} keeps them under
 * {@link #RESPONSE_TIME_MS} and {@link #ABANDONED_BACKFILLS} for exporters that want a flat map,
 * plus per-check entries when statuses are aggregated.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public static final String RESPONSE_TIME_MS = "responseTimeMs";
    public static final String ABANDONED_BACKFILLS = "abandonedBackfills";

    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /**
     * Status of the franchise lookup service: DOWN when it could not hand out a token.
     */
    public static HealthStatus lookupService(boolean available, Duration responseTime) {
        HealthStatus status = available
                ? new HealthStatus(Status.UP, "OK", Map.of())
                : new HealthStatus(Status.DOWN, "Franchise lookup service unavailable", Map.of());
        return status.withDetail(RESPONSE_TIME_MS, responseTime.toMillis());
    }

    /**
     * Status of the backfill pipeline: DEGRADED once any write was abandoned, since those
     * records will be looked up again by a later batch.
     */
    public static HealthStatus backfill(long abandonedBackfills) {
        HealthStatus status = abandonedBackfills == 0
                ? new HealthStatus(Status.UP, "OK", Map.of())
                : new HealthStatus(Status.DEGRADED, abandonedBackfills + " backfill writes abandoned", Map.of());
        return status.withDetail(ABANDONED_BACKFILLS, abandonedBackfills);
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    /**
     * A check that failed to produce a status at all.
     */
    public static HealthStatus failed(String checkName, RuntimeException e) {
        return new HealthStatus(Status.DOWN, checkName + " check failed: " + e.getMessage(), Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public Optional<Duration> responseTime() {
        Object value = details.get(RESPONSE_TIME_MS);
        return value instanceof Long millis ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
    }

    public OptionalLong abandonedBackfills() {
        Object value = details.get(ABANDONED_BACKFILLS);
        return value instanceof Long count ? OptionalLong.of(count) : OptionalLong.empty();
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.compareTo(other.status) > 0;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
