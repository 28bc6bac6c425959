package com.codemigration.metagraph.model.entity;

import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One step of the migration plan. Lower priority runs earlier; priorities of a project are
 * distinct and contiguous from zero.
 */
@Value
@Builder(toBuilder = true)
public class Strategy {

    private static final Set<String> FIELDS = Set.of("component_key", "file_path", "priority", "actions",
        "depends_on");

    String key;
    String componentKey;
    String filePath;
    int priority;
    @Singular
    List<String> actions;
    @Singular("dependsOnEntry")
    List<String> dependsOn;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("component_key", componentKey);
        props.put("file_path", filePath);
        props.put("priority", priority);
        props.put("actions", List.copyOf(actions));
        props.put("depends_on", List.copyOf(dependsOn));
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.STRATEGY).key(key).properties(props).build();
    }

    public static Strategy fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return Strategy.builder()
            .key(node.getKey())
            .componentKey(Props.str(p.get("component_key")))
            .filePath(Props.str(p.get("file_path")))
            .priority(Props.intValue(p.get("priority"), Integer.MAX_VALUE))
            .actions(Props.strings(p.get("actions")))
            .dependsOn(Props.strings(p.get("depends_on")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
