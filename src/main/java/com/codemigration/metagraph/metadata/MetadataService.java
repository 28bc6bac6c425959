package com.codemigration.metagraph.metadata;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read side for callers outside the pipeline: counts, and a JSON dump of the project graph.
 *
 * <p>The dump carries every node with its full property bag, including properties no entity type
 * declares, and every relationship with its properties.
 */
@Slf4j
@Service
public class MetadataService {

    private final GraphStore graphStore;
    private final ObjectMapper objectMapper;

    public MetadataService(GraphStore graphStore, ObjectMapper objectMapper) {
        this.graphStore = graphStore;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public MetadataSummary summarize(String projectId) {
        Map<String, Long> nodesByLabel = new LinkedHashMap<>();
        for (NodeLabel label : NodeLabel.values()) {
            nodesByLabel.put(label.getLabel(), graphStore.countNodes(projectId, label));
        }
        Map<String, Long> relationshipsByType = new LinkedHashMap<>();
        for (RelationshipType type : RelationshipType.values()) {
            relationshipsByType.put(type.name(), graphStore.countEdges(projectId, type));
        }
        return new MetadataSummary(
            projectId,
            nodesByLabel.get(NodeLabel.FILE.getLabel()),
            nodesByLabel.get(NodeLabel.FUNCTION.getLabel()),
            nodesByLabel.get(NodeLabel.CLASS.getLabel()),
            nodesByLabel.get(NodeLabel.ENUM.getLabel()),
            nodesByLabel.get(NodeLabel.EXTENSION.getLabel()),
            graphStore.countEdges(projectId, null),
            nodesByLabel,
            relationshipsByType,
            countBy(projectId, NodeLabel.FILE, "language"),
            countBy(projectId, NodeLabel.COMPONENT, "type"));
    }

    /**
     * Nodes and relationships of a project.
     *
     * @param labels Labels to include; empty means all
     * @param types Relationship types to include; empty means all
     */
    public GraphExport export(String projectId, Set<NodeLabel> labels, Set<RelationshipType> types) {
        Set<NodeLabel> nodeLabels = labels == null || labels.isEmpty() ? EnumSet.allOf(NodeLabel.class) : labels;
        Set<RelationshipType> edgeTypes = types == null || types.isEmpty()
            ? EnumSet.allOf(RelationshipType.class)
            : types;

        List<GraphExport.Node> nodes = new ArrayList<>();
        for (NodeLabel label : nodeLabels) {
            for (GraphNode node : graphStore.findNodes(projectId, label)) {
                nodes.add(new GraphExport.Node(label.getLabel(), node.getKey(), node.getProperties()));
            }
        }
        List<GraphExport.Relationship> relationships = new ArrayList<>();
        for (GraphEdge edge : graphStore.findEdges(projectId, edgeTypes)) {
            if (!nodeLabels.contains(edge.getFrom().label()) || !nodeLabels.contains(edge.getTo().label())) {
                continue;
            }
            relationships.add(new GraphExport.Relationship(edge.getType().name(),
                edge.getFrom().label().getLabel(), edge.getFrom().key(),
                edge.getTo().label().getLabel(), edge.getTo().key(),
                edge.getProperties()));
        }
        log.debug("Exporting {} nodes and {} relationships of {}", nodes.size(), relationships.size(), projectId);
        return new GraphExport(projectId, nodes, relationships);
    }

    public String exportJson(String projectId, Set<NodeLabel> labels, Set<RelationshipType> types) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(export(projectId, labels, types));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Graph export of " + projectId + " is not serializable", e);
        }
    }

    private Map<String, Long> countBy(String projectId, NodeLabel label, String property) {
        Map<String, Long> counts = new TreeMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, label)) {
            counts.merge(node.getString(property).orElse("unknown"), 1L, Long::sum);
        }
        return counts;
    }
}
