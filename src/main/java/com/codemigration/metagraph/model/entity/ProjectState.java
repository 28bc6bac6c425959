package com.codemigration.metagraph.model.entity;

/**
 * Orchestrator state of a project. Stored lower-case on the Project node.
 */
public enum ProjectState {
    UPLOADED(0),
    STRUCTURE_ANALYZED(20),
    CONTENT_ANALYZED(40),
    CLASSIFIED(55),
    MAPPED(70),
    STRATEGIZED(85),
    DONE(100),
    NEEDS_FEEDBACK(-1),
    FAILED(-1),
    CANCELLED(-1);

    private final int progress;

    ProjectState(int progress) {
        this.progress = progress;
    }

    /**
     * Percentage reached once this state is committed; -1 for states that keep the previous value.
     */
    public int getProgress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public String tag() {
        return name().toLowerCase();
    }

    public static ProjectState fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase());
    }
}
