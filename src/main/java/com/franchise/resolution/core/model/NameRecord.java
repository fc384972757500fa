package com.franchise.resolution.core.model;

import com.franchise.resolution.rules.KeyNormalizer;

/**
 * A record whose franchise and outlet names need resolving, as read from the record store.
 * Never mutated by the resolver; results are returned alongside.
 *
 * @param id                    record identifier, unique within a batch
 * @param key                   normalized lookup key, or null when the record is not resolvable
 * @param existingFranchiseName franchise name already persisted, or null
 * @param existingOutletName    outlet name already persisted, or null
 */
public record NameRecord(long id, ResolutionKey key, String existingFranchiseName, String existingOutletName) {

    public NameRecord {
        existingFranchiseName = blankToNull(existingFranchiseName);
        existingOutletName = blankToNull(existingOutletName);
    }

    /**
     * Builds a record from raw ids, normalizing the key with the given normalizer.
     */
    public static NameRecord of(long id, String franchiseId, String outletId,
                                String existingFranchiseName, String existingOutletName,
                                KeyNormalizer normalizer) {
        ResolutionKey key = normalizer.normalize(franchiseId, outletId).orElse(null);
        return new NameRecord(id, key, existingFranchiseName, existingOutletName);
    }

    /**
     * Builds a record using the default trimming normalizer.
     */
    public static NameRecord of(long id, String franchiseId, String outletId,
                                String existingFranchiseName, String existingOutletName) {
        return of(id, franchiseId, outletId, existingFranchiseName, existingOutletName, KeyNormalizer.trimming());
    }

    public boolean hasExistingNames() {
        return existingFranchiseName != null || existingOutletName != null;
    }

    public boolean isResolvable() {
        return key != null;
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
