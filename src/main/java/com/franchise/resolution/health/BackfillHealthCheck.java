package com.franchise.resolution.health;

import com.franchise.resolution.api.BatchResolver;

import java.util.Objects;

/**
 * DEGRADED once the resolver has abandoned any backfill write; resolved names for those
 * records were not persisted and will be looked up again by a later batch.
 */
public class BackfillHealthCheck implements HealthCheck {

    private final BatchResolver resolver;

    public BackfillHealthCheck(BatchResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
    }

    @Override
    public String getName() {
        return "backfill";
    }

    @Override
    public HealthStatus check() {
        return HealthStatus.backfill(resolver.getAbandonedBackfillCount());
    }
}
