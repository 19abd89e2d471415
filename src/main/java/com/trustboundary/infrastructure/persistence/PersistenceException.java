package com.trustboundary.infrastructure.persistence;

/**
 * A ledger could not be written or read. In-memory state has been rolled back
 * to what it was before the failed write.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
