package com.franchise.resolution.core.model;

/**
 * How a record's {@link ResolutionResult} was produced within a batch.
 */
public enum ResolutionSource {
    /** Names already persisted on the record; no lookup. */
    EXISTING,
    /** Result of the single lookup issued for the record's key. */
    LOOKUP,
    /** The lookup for the record's key failed or timed out. */
    LOOKUP_FAILED,
    /** Franchise or outlet id missing; no lookup attempted. */
    INVALID_KEY
}
