package com.codemigration.metagraph.model.graph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Directed relationship kinds. Endpoint labels are fixed per type so stores can
 * match both ends by natural key without a label lookup.
 */
public enum RelationshipType {
    CONTAINS(NodeLabel.PROJECT, NodeLabel.FILE),
    HAS_FUNCTION(NodeLabel.FILE, NodeLabel.FUNCTION),
    HAS_CLASS(NodeLabel.FILE, NodeLabel.CLASS),
    HAS_ENUM(NodeLabel.FILE, NodeLabel.ENUM),
    HAS_EXTENSION(NodeLabel.FILE, NodeLabel.EXTENSION),
    IMPORTS(NodeLabel.FILE, NodeLabel.FILE),
    REFERENCES(NodeLabel.FILE, NodeLabel.FILE),
    DEPENDS_ON(NodeLabel.FILE, NodeLabel.DEPENDENCY),
    CLASSIFIES_AS(NodeLabel.FILE, NodeLabel.COMPONENT),
    MAPS_TO(null, NodeLabel.MAPPING),
    TARGETS(NodeLabel.MAPPING, NodeLabel.TARGET_COMPONENT),
    PLANNED_IN(NodeLabel.COMPONENT, NodeLabel.STRATEGY),
    REPORTED_IN(NodeLabel.PROJECT, NodeLabel.REPORT),
    FEEDBACK_FOR(NodeLabel.PROJECT, NodeLabel.FEEDBACK);

    /** File-to-file edges that make up the dependency relation used for closures and ordering. */
    public static final Set<RelationshipType> FILE_DEPENDENCIES = EnumSet.of(IMPORTS, REFERENCES);

    private final NodeLabel from;
    private final NodeLabel to;

    RelationshipType(NodeLabel from, NodeLabel to) {
        this.from = from;
        this.to = to;
    }

    /**
     * Source label, or {@code null} when several labels may originate the edge (MAPS_TO).
     */
    public NodeLabel getFrom() {
        return from;
    }

    public NodeLabel getTo() {
        return to;
    }

    public boolean accepts(NodeLabel fromLabel, NodeLabel toLabel) {
        if (to != toLabel) {
            return false;
        }
        if (from == null) {
            return fromLabel == NodeLabel.COMPONENT || fromLabel == NodeLabel.FUNCTION
                || fromLabel == NodeLabel.CLASS;
        }
        return from == fromLabel;
    }
}
