package com.franchise.resolution.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs registered health checks and combines them; the worst status wins
 * (DOWN over DEGRADED over UP). A check that throws counts as DOWN.
 *
 * <p>The aggregate carries the lookup response time and abandoned backfill count reported by
 * the individual checks, so {@link HealthStatus#responseTime()} and
 * {@link HealthStatus#abandonedBackfills()} work on it directly.</p>
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> checkResults = new LinkedHashMap<>();
        Map<String, Object> figures = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up("OK");
        String worstName = null;

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                result = HealthStatus.failed(check.getName(), e);
            }
            checkResults.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));

            result.responseTime().ifPresent(t -> figures.put(HealthStatus.RESPONSE_TIME_MS, t.toMillis()));
            result.abandonedBackfills().ifPresent(n -> figures.put(HealthStatus.ABANDONED_BACKFILLS, n));

            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        HealthStatus aggregate = new HealthStatus(worst.status(), message, figures);
        for (Map.Entry<String, Object> entry : checkResults.entrySet()) {
            aggregate = aggregate.withDetail(entry.getKey(), entry.getValue());
        }
        return aggregate;
    }

    public int size() {
        return checks.size();
    }
}
