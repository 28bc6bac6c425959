package com.codemigration.metagraph.model.entity;

import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Derived classification of one file.
 */
@Value
@Builder(toBuilder = true)
public class Component {

    private static final Set<String> FIELDS = Set.of("file_path", "type", "classified_by", "reason");

    String key;
    String filePath;
    ComponentType type;
    Provenance classifiedBy;
    String reason;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public static Component forFile(String filePath, ComponentType type, Provenance classifiedBy, String reason) {
        return Component.builder()
            .key(EntityKeys.component(filePath))
            .filePath(filePath)
            .type(type)
            .classifiedBy(classifiedBy)
            .reason(reason)
            .build();
    }

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("file_path", filePath);
        props.put("type", type.tag());
        props.put("classified_by", classifiedBy.tag());
        props.put("reason", reason == null ? "" : reason);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.COMPONENT).key(key).properties(props).build();
    }

    public static Component fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return Component.builder()
            .key(node.getKey())
            .filePath(Props.str(p.get("file_path")))
            .type(ComponentType.fromTag(Props.str(p.get("type"))))
            .classifiedBy(Provenance.fromTag(Props.str(p.get("classified_by"))))
            .reason(Props.str(p.get("reason"), ""))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
