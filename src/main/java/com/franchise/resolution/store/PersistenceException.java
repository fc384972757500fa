package com.franchise.resolution.store;

/**
 * Thrown when resolved names could not be written to the record store.
 */
public class PersistenceException extends RuntimeException {

    private final long recordId;

    public PersistenceException(long recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public PersistenceException(long recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public long getRecordId() {
        return recordId;
    }
}
