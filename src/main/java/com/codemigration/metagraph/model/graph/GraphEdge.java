package com.codemigration.metagraph.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A directed, typed relationship between two nodes of the same project.
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    RelationshipType type;
    NodeRef from;
    NodeRef to;
    @Singular
    Map<String, Object> properties;

    public static GraphEdge of(RelationshipType type, NodeRef from, NodeRef to) {
        return GraphEdge.builder().type(type).from(from).to(to).build();
    }

    public static GraphEdge of(RelationshipType type, NodeRef from, NodeRef to, Map<String, Object> properties) {
        return GraphEdge.builder().type(type).from(from).to(to).properties(properties).build();
    }
}
