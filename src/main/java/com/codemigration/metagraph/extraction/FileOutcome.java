package com.codemigration.metagraph.extraction;

/**
 * What happened to one file during content analysis.
 */
public record FileOutcome(String path, String status, int functions, int classes, int enums, int extensions,
                          boolean inferred, boolean inferenceFailed) {
}
