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
 * Behaviour attached to an existing type from outside its declaration (monkey patches,
 * categories, open-class reopenings).
 */
@Value
@Builder(toBuilder = true)
public class ExtensionInfo {

    private static final Set<String> FIELDS = Set.of("file_path", "name", "base_type", "methods", "line",
        "provenance");

    String key;
    String filePath;
    String name;
    String baseType;
    @Singular
    List<MethodRef> methods;
    int line;
    @Singular("provenanceEntry")
    Map<String, Provenance> provenance;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("file_path", filePath);
        props.put("name", name);
        props.put("base_type", baseType);
        props.put("methods", methods.stream().map(MethodRef::toMap).toList());
        props.put("line", line);
        props.put("provenance", Props.provenanceTags(provenance));
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.EXTENSION).key(key).properties(props).build();
    }

    public static ExtensionInfo fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return ExtensionInfo.builder()
            .key(node.getKey())
            .filePath(Props.str(p.get("file_path")))
            .name(Props.str(p.get("name")))
            .baseType(Props.str(p.get("base_type")))
            .methods(Props.maps(p.get("methods")).stream().map(MethodRef::fromMap).toList())
            .line(Props.intValue(p.get("line"), 0))
            .provenance(Props.provenance(p.get("provenance")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
