package com.franchise.resolution.core.model;

import java.util.Objects;

/**
 * Lookup key identifying one franchise/outlet name lookup.
 * Components are expected to be normalized already (see
 * {@link com.franchise.resolution.rules.KeyNormalizer}). Two keys are equal iff both
 * normalized ids are equal; {@link #asString()} is a log and display form only and can
 * coincide for different keys when an id itself contains {@code '-'}.
 */
public record ResolutionKey(String franchiseId, String outletId) {

    public ResolutionKey {
        Objects.requireNonNull(franchiseId, "franchiseId is required");
        Objects.requireNonNull(outletId, "outletId is required");
        if (franchiseId.isBlank() || outletId.isBlank()) {
            throw new IllegalArgumentException("franchiseId and outletId must be non-blank");
        }
    }

    /**
     * Returns {@code franchiseId-outletId}, used in log lines and the lookup MDC.
     */
    public String asString() {
        return franchiseId + "-" + outletId;
    }

    @Override
    public String toString() {
        return asString();
    }
}
