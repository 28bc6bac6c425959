package com.codemigration.metagraph.exception;

/**
 * A write would break a graph invariant (duplicate natural key, dangling edge).
 */
public class ConstraintViolationException extends MigrationException {

    public ConstraintViolationException(String message) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message, cause);
    }
}
