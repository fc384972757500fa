package com.franchise.resolution.api;

import com.franchise.resolution.core.model.ResolutionResult;

/**
 * External name lookup, keyed by franchise and outlet id.
 *
 * <p>Implementations may be slow and are never retried by the resolver. A negative answer
 * is returned as {@link ResolutionResult#notFound()}; any other failure is signalled by
 * throwing (typically {@link com.franchise.resolution.lookup.LookupException}).</p>
 */
@FunctionalInterface
public interface FranchiseLookup {

    /**
     * Looks up names for one key. Both ids are non-blank and already normalized.
     */
    ResolutionResult lookup(String franchiseId, String outletId);

    /**
     * Whether the lookup service is currently reachable. Defaults to true.
     */
    default boolean isAvailable() {
        return true;
    }
}
