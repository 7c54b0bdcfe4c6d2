package com.crabtrading.backend.exception;

/**
 * Raised at startup when the stored ledger snapshot cannot be decoded and the store is
 * configured to refuse starting from an empty ledger.
 */
public class SnapshotCorruptedException extends RuntimeException {

    public SnapshotCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
