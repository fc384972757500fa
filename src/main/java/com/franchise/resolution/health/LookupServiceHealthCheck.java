package com.franchise.resolution.health;

import com.franchise.resolution.api.FranchiseLookup;

import java.time.Duration;
import java.util.Objects;

/**
 * DOWN when the franchise lookup service reports itself unavailable.
 */
public class LookupServiceHealthCheck implements HealthCheck {

    private final FranchiseLookup lookup;

    public LookupServiceHealthCheck(FranchiseLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup is required");
    }

    @Override
    public String getName() {
        return "franchise-lookup";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        boolean available = lookup.isAvailable();
        return HealthStatus.lookupService(available, Duration.ofNanos(System.nanoTime() - start));
    }
}
