package com.franchise.resolution.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link BatchResolver}: concurrency bounds, timeouts and backfill behaviour.
 */
public class ResolverOptions {

    private static final int DEFAULT_MAX_CONCURRENT_LOOKUPS = 8;
    private static final int DEFAULT_MAX_CONCURRENT_BACKFILLS = 4;
    private static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_BACKFILL_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;
    private static final String DEFAULT_UNRESOLVED_PLACEHOLDER = "No Outlet Found";

    /**
     * Whether {@link BatchResolver#resolveBatch} waits for backfill writes before returning.
     */
    public enum BackfillMode {
        /** Drain all writes (bounded by the backfill timeout) before returning. */
        AWAIT,
        /** Return right after lookups settle; the caller drains via {@link BatchResolution#awaitBackfill}. */
        DETACHED
    }

    private final int maxConcurrentLookups;
    private final int maxConcurrentBackfills;
    private final Duration lookupTimeout;
    private final Duration backfillTimeout;
    private final BackfillMode backfillMode;
    private final int maxBatchSize;
    private final String unresolvedPlaceholder;

    private ResolverOptions(Builder builder) {
        this.maxConcurrentLookups = builder.maxConcurrentLookups;
        this.maxConcurrentBackfills = builder.maxConcurrentBackfills;
        this.lookupTimeout = builder.lookupTimeout;
        this.backfillTimeout = builder.backfillTimeout;
        this.backfillMode = builder.backfillMode;
        this.maxBatchSize = builder.maxBatchSize;
        this.unresolvedPlaceholder = builder.unresolvedPlaceholder;
    }

    public int getMaxConcurrentLookups() {
        return maxConcurrentLookups;
    }

    public int getMaxConcurrentBackfills() {
        return maxConcurrentBackfills;
    }

    public Duration getLookupTimeout() {
        return lookupTimeout;
    }

    public Duration getBackfillTimeout() {
        return backfillTimeout;
    }

    public BackfillMode getBackfillMode() {
        return backfillMode;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public String getUnresolvedPlaceholder() {
        return unresolvedPlaceholder;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    /**
     * Options that return without waiting for backfill writes.
     */
    public static ResolverOptions detached() {
        return builder().backfillMode(BackfillMode.DETACHED).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConcurrentLookups = DEFAULT_MAX_CONCURRENT_LOOKUPS;
        private int maxConcurrentBackfills = DEFAULT_MAX_CONCURRENT_BACKFILLS;
        private Duration lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;
        private Duration backfillTimeout = DEFAULT_BACKFILL_TIMEOUT;
        private BackfillMode backfillMode = BackfillMode.AWAIT;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private String unresolvedPlaceholder = DEFAULT_UNRESOLVED_PLACEHOLDER;

        public Builder maxConcurrentLookups(int maxConcurrentLookups) {
            if (maxConcurrentLookups <= 0) {
                throw new IllegalArgumentException("maxConcurrentLookups must be positive");
            }
            this.maxConcurrentLookups = maxConcurrentLookups;
            return this;
        }

        public Builder maxConcurrentBackfills(int maxConcurrentBackfills) {
            if (maxConcurrentBackfills <= 0) {
                throw new IllegalArgumentException("maxConcurrentBackfills must be positive");
            }
            this.maxConcurrentBackfills = maxConcurrentBackfills;
            return this;
        }

        public Builder lookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = requirePositive(lookupTimeout, "lookupTimeout");
            return this;
        }

        public Builder backfillTimeout(Duration backfillTimeout) {
            this.backfillTimeout = requirePositive(backfillTimeout, "backfillTimeout");
            return this;
        }

        public Builder backfillMode(BackfillMode backfillMode) {
            this.backfillMode = Objects.requireNonNull(backfillMode, "backfillMode is required");
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder unresolvedPlaceholder(String unresolvedPlaceholder) {
            this.unresolvedPlaceholder = Objects.requireNonNull(unresolvedPlaceholder,
                    "unresolvedPlaceholder is required");
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "maxConcurrentLookups=" + maxConcurrentLookups +
                ", maxConcurrentBackfills=" + maxConcurrentBackfills +
                ", lookupTimeout=" + lookupTimeout +
                ", backfillTimeout=" + backfillTimeout +
                ", backfillMode=" + backfillMode +
                ", maxBatchSize=" + maxBatchSize +
                '}';
    }
}
