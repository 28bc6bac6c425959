package com.codemigration.metagraph.graph;

import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Project-scoped property graph.
 *
 * <p>Every operation takes the project id; nodes and relationships of different projects never
 * meet. Writes are idempotent upserts keyed by (label, natural key): re-applying a node merges
 * its properties, last write wins per property, and properties not mentioned are kept.
 *
 * <p>Failures surface as {@code TransientStoreException} (retryable) or
 * {@code ConstraintViolationException} (not retryable).
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Apply a batch as one transaction. A relationship whose endpoint does not exist once the
     * batch's nodes are written fails the whole batch with a constraint violation.
     *
     * @param projectId Owning project
     * @param batch Nodes, relationships and exclusive relationships to merge
     */
    void applyBatch(String projectId, GraphBatch batch);

    default void upsertNode(String projectId, GraphNode node) {
        applyBatch(projectId, GraphBatch.builder().node(node).build());
    }

    default void upsertEdge(String projectId, GraphEdge edge) {
        applyBatch(projectId, GraphBatch.builder().edge(edge).build());
    }

    /**
     * Merge {@code edge} and delete every other outgoing relationship of the same type from its
     * source node.
     */
    default void replaceOutgoingEdge(String projectId, GraphEdge edge) {
        applyBatch(projectId, GraphBatch.builder().exclusiveEdge(edge).build());
    }

    /**
     * Delete the whole project subgraph, Project node included.
     *
     * @param projectId Project to purge
     * @return Number of nodes deleted
     */
    long deleteProject(String projectId);

    // =========================================================================
    // Queries
    // =========================================================================

    Optional<GraphNode> findNode(String projectId, NodeLabel label, String key);

    /**
     * All nodes of a label, ordered by key.
     */
    List<GraphNode> findNodes(String projectId, NodeLabel label);

    /**
     * Nodes of a label whose properties equal every entry of {@code filter}, ordered by key.
     */
    List<GraphNode> findNodes(String projectId, NodeLabel label, Map<String, Object> filter);

    /**
     * Relationships of the given types, ordered by source key then target key.
     */
    List<GraphEdge> findEdges(String projectId, Set<RelationshipType> types);

    List<GraphEdge> findOutgoing(String projectId, NodeRef from, RelationshipType type);

    /**
     * Keys of nodes reachable from {@code startKey} over {@code types}, following edges forward.
     * The start node is excluded. Cycles are traversed at most once.
     *
     * @param maxHops Upper bound on path length; zero or negative means unbounded
     */
    Set<String> reachableKeys(String projectId, NodeLabel label, String startKey,
                              Set<RelationshipType> types, int maxHops);

    /**
     * @param label Label to count, or {@code null} for all nodes of the project
     */
    long countNodes(String projectId, NodeLabel label);

    /**
     * @param type Type to count, or {@code null} for all relationships of the project
     */
    long countEdges(String projectId, RelationshipType type);
}
