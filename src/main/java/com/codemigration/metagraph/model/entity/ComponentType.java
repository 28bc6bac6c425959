package com.codemigration.metagraph.model.entity;

import java.util.Optional;

/**
 * Coarse component classification of a file.
 */
public enum ComponentType {
    UI,
    LOGIC,
    DATA,
    CONFIG,
    UNKNOWN;

    public String tag() {
        return name().toLowerCase();
    }

    public static ComponentType fromTag(String tag) {
        return parse(tag).orElse(UNKNOWN);
    }

    public static Optional<ComponentType> parse(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(tag.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
