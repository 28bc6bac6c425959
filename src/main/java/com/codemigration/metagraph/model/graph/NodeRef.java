package com.codemigration.metagraph.model.graph;

/**
 * Natural-key reference to a node inside one project subgraph.
 */
public record NodeRef(NodeLabel label, String key) {

    public NodeRef {
        if (label == null || key == null || key.isBlank()) {
            throw new IllegalArgumentException("Node reference needs a label and a key");
        }
    }

    public static NodeRef of(NodeLabel label, String key) {
        return new NodeRef(label, key);
    }

    @Override
    public String toString() {
        return label.getLabel() + "(" + key + ")";
    }
}
