package com.franchise.resolution.store;

import com.franchise.resolution.core.model.NameRecord;
import com.franchise.resolution.rules.KeyNormalizer;

/**
 * A record as held by the record store: raw ids plus any names resolved earlier.
 *
 * @param id                    record identifier
 * @param franchiseId           raw franchise id, possibly blank
 * @param outletId              raw outlet id, possibly blank
 * @param franchiseNameResolved persisted franchise name, or null
 * @param outletNameResolved    persisted outlet name, or null
 */
public record StoredRecord(
        long id,
        String franchiseId,
        String outletId,
        String franchiseNameResolved,
        String outletNameResolved
) {

    public static StoredRecord unresolved(long id, String franchiseId, String outletId) {
        return new StoredRecord(id, franchiseId, outletId, null, null);
    }

    public StoredRecord withResolvedNames(String franchiseName, String outletName) {
        return new StoredRecord(id, franchiseId, outletId, franchiseName, outletName);
    }

    public NameRecord toNameRecord(KeyNormalizer normalizer) {
        return NameRecord.of(id, franchiseId, outletId, franchiseNameResolved, outletNameResolved, normalizer);
    }
}
