package com.codemigration.metagraph.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A group of upserts applied as one transaction: either everything lands or nothing does.
 *
 * <p>{@code exclusiveEdges} replace the outgoing edges of the same type from their source node:
 * afterwards that node has exactly the targets listed for it in this batch. A single exclusive
 * edge keeps a functional relationship such as CLASSIFIES_AS single-valued; several from the same
 * source replace a whole target set, as TARGETS does when a mapping is regenerated.
 */
@Value
@Builder
public class GraphBatch {

    @Singular
    List<GraphNode> nodes;
    @Singular
    List<GraphEdge> edges;
    @Singular
    List<GraphEdge> exclusiveEdges;

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty() && exclusiveEdges.isEmpty();
    }

    public int size() {
        return nodes.size() + edges.size() + exclusiveEdges.size();
    }
}
