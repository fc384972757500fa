package com.franchise.resolution.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link RecordStore}.
 * Thread-safe; each resolution write replaces the stored record in one step.
 */
public class InMemoryRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final ConcurrentMap<Long, StoredRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, AtomicInteger> writeCounts = new ConcurrentHashMap<>();

    public StoredRecord save(StoredRecord record) {
        Objects.requireNonNull(record, "record is required");
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<StoredRecord> findById(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<StoredRecord> findByIds(Collection<Long> ids) {
        List<StoredRecord> found = new ArrayList<>();
        for (Long id : ids) {
            StoredRecord record = records.get(id);
            if (record != null) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    public void storeResolution(long recordId, String franchiseName, String outletName) {
        StoredRecord updated = records.computeIfPresent(recordId,
                (id, existing) -> existing.withResolvedNames(franchiseName, outletName));
        if (updated == null) {
            throw new PersistenceException(recordId, "No record with id " + recordId);
        }
        writeCounts.computeIfAbsent(recordId, id -> new AtomicInteger()).incrementAndGet();
        log.debug("record.resolution.stored recordId={}", recordId);
    }

    /**
     * Number of resolution writes applied to a record.
     */
    public int writeCount(long recordId) {
        AtomicInteger count = writeCounts.get(recordId);
        return count != null ? count.get() : 0;
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
        writeCounts.clear();
    }
}
