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
 * A library or module the project uses but does not contain.
 */
@Value
@Builder(toBuilder = true)
public class DependencyInfo {

    public static final String EXTERNAL = "external";
    public static final String INTERNAL = "internal";

    private static final Set<String> FIELDS = Set.of("name", "version", "type");

    String key;
    String name;
    String version;
    String type;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public static DependencyInfo external(String name) {
        return DependencyInfo.builder()
            .key(EntityKeys.dependency(name))
            .name(name)
            .version("unknown")
            .type(EXTERNAL)
            .build();
    }

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("name", name);
        props.put("version", version == null ? "unknown" : version);
        props.put("type", type == null ? EXTERNAL : type);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.DEPENDENCY).key(key).properties(props).build();
    }

    public static DependencyInfo fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return DependencyInfo.builder()
            .key(node.getKey())
            .name(Props.str(p.get("name")))
            .version(Props.str(p.get("version"), "unknown"))
            .type(Props.str(p.get("type"), EXTERNAL))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
