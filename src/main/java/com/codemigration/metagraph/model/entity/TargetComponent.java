package com.codemigration.metagraph.model.entity;

import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class TargetComponent {

    private static final Set<String> FIELDS = Set.of("name", "version", "type");

    String key;
    String name;
    String version;
    String type;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public static TargetComponent of(String name, String version, String type) {
        return TargetComponent.builder()
            .key(EntityKeys.targetComponent(name, version))
            .name(name)
            .version(version)
            .type(type)
            .build();
    }

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("name", name);
        props.put("version", version == null ? "latest" : version);
        props.put("type", type);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.TARGET_COMPONENT).key(key).properties(props).build();
    }

    public static TargetComponent fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return TargetComponent.builder()
            .key(node.getKey())
            .name(Props.str(p.get("name")))
            .version(Props.str(p.get("version"), "latest"))
            .type(Props.str(p.get("type")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
