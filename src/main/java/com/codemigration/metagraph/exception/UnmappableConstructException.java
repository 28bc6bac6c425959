package com.codemigration.metagraph.exception;

import lombok.Getter;

/**
 * No mapping rule or inference suggestion exists for a legacy construct.
 * Routed to Feedback; never fails the project.
 */
@Getter
public class UnmappableConstructException extends MigrationException {

    private final String construct;

    public UnmappableConstructException(String construct, String message) {
        super(ErrorKind.UNMAPPABLE_CONSTRUCT, message);
        this.construct = construct;
    }
}
