package com.codemigration.metagraph.exception;

/**
 * Inference call failed, timed out or is not configured. Callers skip the inferred fields.
 */
public class TransientInferenceException extends MigrationException {

    public TransientInferenceException(String message) {
        super(ErrorKind.TRANSIENT_INFERENCE, message);
    }

    public TransientInferenceException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_INFERENCE, message, cause);
    }
}
