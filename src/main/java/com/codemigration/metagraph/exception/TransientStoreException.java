package com.codemigration.metagraph.exception;

/**
 * Graph store unreachable or timed out. Safe to retry.
 */
public class TransientStoreException extends MigrationException {

    public TransientStoreException(String message) {
        super(ErrorKind.TRANSIENT_STORE, message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_STORE, message, cause);
    }
}
