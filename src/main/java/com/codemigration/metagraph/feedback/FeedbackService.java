package com.codemigration.metagraph.feedback;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Feedback;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Feedback entries: issues a stage could not settle on its own, and issues users raise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final GraphStore graphStore;

    public Feedback submit(String projectId, String issue, String suggestion, String component) {
        requireProject(projectId);
        if (issue == null || issue.isBlank()) {
            throw new IllegalArgumentException("Feedback issue is required");
        }
        Feedback feedback = Feedback.pending(issue, component).suggestion(suggestion).build();
        write(projectId, feedback);
        log.info("Feedback {} submitted for {}", feedback.getKey(), component);
        return feedback;
    }

    /**
     * Record stage-raised feedback unless an entry with the same key already exists.
     *
     * @return true when the entry was written
     */
    public boolean raise(String projectId, Feedback feedback) {
        if (graphStore.findNode(projectId, NodeLabel.FEEDBACK, feedback.getKey()).isPresent()) {
            return false;
        }
        write(projectId, feedback);
        log.warn("Feedback raised: {} ({})", feedback.getIssue(), feedback.getComponent());
        return true;
    }

    public Feedback resolve(String projectId, String feedbackKey, String resolution) {
        Feedback existing = graphStore.findNode(projectId, NodeLabel.FEEDBACK, feedbackKey)
            .map(Feedback::fromNode)
            .orElseThrow(() -> new IllegalArgumentException("Feedback not found: " + feedbackKey));
        Feedback resolved = existing.toBuilder()
            .status(Feedback.RESOLVED)
            .resolution(resolution)
            .updatedAt(Instant.now().toString())
            .build();
        graphStore.upsertNode(projectId, resolved.toNode(projectId));
        log.info("Feedback {} resolved", feedbackKey);
        return resolved;
    }

    public List<Feedback> list(String projectId) {
        return graphStore.findNodes(projectId, NodeLabel.FEEDBACK).stream().map(Feedback::fromNode).toList();
    }

    public List<Feedback> listPending(String projectId) {
        return graphStore.findNodes(projectId, NodeLabel.FEEDBACK, Map.of("status", Feedback.PENDING)).stream()
            .map(Feedback::fromNode)
            .toList();
    }

    public long countPending(String projectId) {
        return listPending(projectId).size();
    }

    private void write(String projectId, Feedback feedback) {
        GraphNode node = feedback.toNode(projectId);
        graphStore.applyBatch(projectId, GraphBatch.builder()
            .node(node)
            .edge(GraphEdge.of(RelationshipType.FEEDBACK_FOR, NodeRef.of(NodeLabel.PROJECT, projectId), node.ref()))
            .build());
    }

    private void requireProject(String projectId) {
        if (graphStore.findNode(projectId, NodeLabel.PROJECT, projectId).isEmpty()) {
            throw new IllegalArgumentException("Project not found: " + projectId);
        }
    }
}
