package com.codemigration.metagraph.model.graph;

/**
 * Node labels of the project-scoped migration graph.
 */
public enum NodeLabel {
    PROJECT("Project"),
    FILE("File"),
    FUNCTION("Function"),
    CLASS("Class"),
    ENUM("Enum"),
    EXTENSION("Extension"),
    COMPONENT("Component"),
    DEPENDENCY("Dependency"),
    MAPPING("Mapping"),
    TARGET_COMPONENT("TargetComponent"),
    STRATEGY("Strategy"),
    REPORT("Report"),
    FEEDBACK("Feedback");

    private final String label;

    NodeLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static NodeLabel fromLabel(String label) {
        for (NodeLabel value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node label: " + label);
    }
}
