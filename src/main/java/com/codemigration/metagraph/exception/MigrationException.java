package com.codemigration.metagraph.exception;

import lombok.Getter;

/**
 * Base class for all failures raised by the metadata pipeline.
 */
@Getter
public class MigrationException extends RuntimeException {

    private final ErrorKind kind;

    public MigrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MigrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
