package com.codemigration.metagraph.model.entity;

/**
 * Which producer supplied a field value.
 */
public enum Provenance {
    SYNTAX,
    INFERENCE;

    public String tag() {
        return name().toLowerCase();
    }

    public static Provenance fromTag(String tag) {
        return tag == null ? SYNTAX : valueOf(tag.toUpperCase());
    }
}
