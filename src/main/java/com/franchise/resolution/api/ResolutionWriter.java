package com.franchise.resolution.api;

/**
 * Persists freshly resolved names for one record.
 *
 * <p>Implementations must write both fields in a single atomic update, be safe to call
 * concurrently for different record ids, and be idempotent. Failures are signalled by
 * throwing (typically {@link com.franchise.resolution.store.PersistenceException}); the
 * resolver reports them and never propagates them to the caller.</p>
 */
@FunctionalInterface
public interface ResolutionWriter {

    void storeResolution(long recordId, String franchiseName, String outletName);
}
