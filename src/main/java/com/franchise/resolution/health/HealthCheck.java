package com.franchise.resolution.health;

/**
 * A check of one component (lookup service, backfill pipeline, ...).
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
