package com.starkiller.core.persistence;

/**
 * Thrown when a session snapshot cannot be written or read.
 */
public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
