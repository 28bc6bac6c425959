package com.codemigration.metagraph.extraction;

/**
 * One file handed to a parser: project-relative path, language tag and decoded text.
 */
public record SourceUnit(String path, String language, String contents) {

    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
