package com.regressionsentinel.core.store;

/**
 * Raised when a snapshot cannot be read from or written to its backing
 * storage.
 */
public class SnapshotStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
