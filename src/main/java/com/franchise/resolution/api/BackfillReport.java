package com.franchise.resolution.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the backfill writes dispatched by one batch.
 *
 * @param dispatched number of writes dispatched
 * @param succeeded  record ids whose names were written
 * @param failed     record id to failure message, for writes the store rejected
 * @param abandoned  record ids whose writes had not settled when the batch was drained
 */
public record BackfillReport(
        int dispatched,
        List<Long> succeeded,
        Map<Long, String> failed,
        List<Long> abandoned
) {
    public BackfillReport {
        succeeded = succeeded != null ? List.copyOf(succeeded) : List.of();
        failed = failed != null ? Collections.unmodifiableMap(new LinkedHashMap<>(failed)) : Map.of();
        abandoned = abandoned != null ? List.copyOf(abandoned) : List.of();
    }

    public static BackfillReport empty() {
        return new BackfillReport(0, List.of(), Map.of(), List.of());
    }

    /**
     * True when every dispatched write settled (successfully or not).
     */
    public boolean isComplete() {
        return abandoned.isEmpty();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    @Override
    public String toString() {
        return "BackfillReport{" +
                "dispatched=" + dispatched +
                ", succeeded=" + succeeded.size() +
                ", failed=" + failed.size() +
                ", abandoned=" + abandoned.size() +
                '}';
    }
}
