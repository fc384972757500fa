package com.franchise.resolution.store;

import com.franchise.resolution.api.ResolutionWriter;
import com.franchise.resolution.core.model.NameRecord;
import com.franchise.resolution.rules.KeyNormalizer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage of records carrying franchise/outlet ids and their resolved names.
 * Serves as the durable, cross-request cache of resolved names.
 */
public interface RecordStore extends ResolutionWriter {

    Optional<StoredRecord> findById(long id);

    /**
     * Returns the stored records for the given ids, in the order of {@code ids}.
     * Unknown ids are skipped.
     */
    List<StoredRecord> findByIds(Collection<Long> ids);

    /**
     * Writes both resolved names of one record in a single atomic update.
     *
     * @throws PersistenceException if the record does not exist or the write fails
     */
    @Override
    void storeResolution(long recordId, String franchiseName, String outletName);

    /**
     * Loads records ready to be passed to the batch resolver.
     */
    default List<NameRecord> loadBatch(Collection<Long> ids, KeyNormalizer normalizer) {
        return findByIds(ids).stream()
                .map(record -> record.toNameRecord(normalizer))
                .toList();
    }
}
