package com.codemigration.metagraph.exception;

/**
 * Failure taxonomy shared by every pipeline stage.
 *
 * <p>The tag is what gets written to Report/Feedback nodes, so callers reading the graph
 * can tell an isolated file failure from a project-level one.
 */
public enum ErrorKind {
    TRANSIENT_STORE("TransientStoreError", true),
    TRANSIENT_INFERENCE("TransientInferenceError", true),
    MALFORMED_INPUT("MalformedInputError", false),
    CONSTRAINT_VIOLATION("ConstraintViolationError", false),
    UNMAPPABLE_CONSTRUCT("UnmappableConstructError", false);

    private final String tag;
    private final boolean retryable;

    ErrorKind(String tag, boolean retryable) {
        this.tag = tag;
        this.retryable = retryable;
    }

    public String getTag() {
        return tag;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
