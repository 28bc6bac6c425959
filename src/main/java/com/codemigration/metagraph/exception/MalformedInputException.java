package com.codemigration.metagraph.exception;

import lombok.Getter;

/**
 * A single source file could not be parsed. Isolated to that file.
 */
@Getter
public class MalformedInputException extends MigrationException {

    private final String path;
    private final int line;

    public MalformedInputException(String path, int line, String message) {
        super(ErrorKind.MALFORMED_INPUT, path + ":" + line + ": " + message);
        this.path = path;
        this.line = line;
    }

    public MalformedInputException(String path, String message, Throwable cause) {
        super(ErrorKind.MALFORMED_INPUT, path + ": " + message, cause);
        this.path = path;
        this.line = 0;
    }
}
