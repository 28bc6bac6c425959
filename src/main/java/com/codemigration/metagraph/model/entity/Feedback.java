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
 * An issue needing a human decision, raised by a stage or submitted by a user.
 */
@Value
@Builder(toBuilder = true)
public class Feedback {

    public static final String PENDING = "pending";
    public static final String RESOLVED = "resolved";

    private static final Set<String> FIELDS = Set.of("issue", "suggestion", "component", "status",
        "resolution", "error_kind", "details", "created_at", "updated_at");

    String key;
    String issue;
    String suggestion;
    String component;
    String status;
    String resolution;
    String errorKind;
    @Singular
    Map<String, Object> details;
    String createdAt;
    String updatedAt;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public static Feedback.FeedbackBuilder pending(String issue, String component) {
        String now = Instant.now().toString();
        return Feedback.builder()
            .key("feedback:" + UUID.randomUUID())
            .issue(issue)
            .component(component)
            .status(PENDING)
            .createdAt(now)
            .updatedAt(now);
    }

    /**
     * Pending feedback raised by a stage for an error on {@code subject}. The key is derived from
     * both, so a stage that re-runs finds its earlier entry instead of adding another.
     */
    public static Feedback.FeedbackBuilder forError(String errorTag, String subject, String issue) {
        return pending(issue, subject)
            .key("feedback:" + errorTag + ":" + subject)
            .errorKind(errorTag);
    }

    public boolean isPending() {
        return PENDING.equals(status);
    }

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("issue", issue);
        props.put("suggestion", suggestion == null ? "" : suggestion);
        props.put("component", component == null ? "" : component);
        props.put("status", status == null ? PENDING : status);
        if (resolution != null) {
            props.put("resolution", resolution);
        }
        if (errorKind != null) {
            props.put("error_kind", errorKind);
        }
        props.put("details", new LinkedHashMap<>(details));
        props.put("created_at", createdAt);
        props.put("updated_at", updatedAt);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.FEEDBACK).key(key).properties(props).build();
    }

    public static Feedback fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return Feedback.builder()
            .key(node.getKey())
            .issue(Props.str(p.get("issue")))
            .suggestion(Props.str(p.get("suggestion"), ""))
            .component(Props.str(p.get("component"), ""))
            .status(Props.str(p.get("status"), PENDING))
            .resolution(Props.str(p.get("resolution")))
            .errorKind(Props.str(p.get("error_kind")))
            .details(Props.map(p.get("details")))
            .createdAt(Props.str(p.get("created_at")))
            .updatedAt(Props.str(p.get("updated_at")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
