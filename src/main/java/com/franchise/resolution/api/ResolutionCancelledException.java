package com.franchise.resolution.api;

/**
 * Thrown when the calling thread is interrupted while a batch waits for its lookups.
 * No backfill has been dispatched for the batch when this is thrown.
 */
public class ResolutionCancelledException extends RuntimeException {

    private final String batchId;

    public ResolutionCancelledException(String batchId, Throwable cause) {
        super("Resolution batch " + batchId + " was cancelled", cause);
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
