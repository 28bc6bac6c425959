package com.codemigration.metagraph.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Serializable snapshot of a project graph.
 */
public record GraphExport(@JsonProperty("project_id") String projectId, List<Node> nodes,
                          List<Relationship> relationships) {

    public record Node(String label, String key, Map<String, Object> properties) {
    }

    public record Relationship(String type,
                               @JsonProperty("from_label") String fromLabel,
                               @JsonProperty("from_key") String fromKey,
                               @JsonProperty("to_label") String toLabel,
                               @JsonProperty("to_key") String toKey,
                               Map<String, Object> properties) {
    }
}
