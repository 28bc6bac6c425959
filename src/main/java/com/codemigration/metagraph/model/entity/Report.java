package com.codemigration.metagraph.model.entity;

import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Audit entry written by any stage. {@code type} is a stage name or an error tag such as
 * {@code MalformedInputError}.
 */
@Value
@Builder(toBuilder = true)
public class Report {

    private static final Set<String> FIELDS = Set.of("type", "message", "details", "created_at");

    String key;
    String type;
    String message;
    @Singular
    Map<String, Object> details;
    String createdAt;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public static Report.ReportBuilder appended(String type, String message) {
        return Report.builder()
            .key("report:" + UUID.randomUUID())
            .type(type)
            .message(message)
            .createdAt(Instant.now().toString());
    }

    /**
     * A report whose key is derived from type and subject, so re-running the stage that
     * writes it updates rather than duplicates it.
     */
    public static Report.ReportBuilder keyed(String type, String subject, String message) {
        return Report.builder()
            .key(EntityKeys.stageReport(type, subject))
            .type(type)
            .message(message)
            .createdAt(Instant.now().toString());
    }

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("type", type);
        props.put("message", message == null ? "" : message);
        props.put("details", new LinkedHashMap<>(details));
        props.put("created_at", createdAt);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.REPORT).key(key).properties(props).build();
    }

    public static Report fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return Report.builder()
            .key(node.getKey())
            .type(Props.str(p.get("type")))
            .message(Props.str(p.get("message"), ""))
            .details(Props.map(p.get("details")))
            .createdAt(Props.str(p.get("created_at")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
