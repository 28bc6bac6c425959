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

@Value
@Builder(toBuilder = true)
public class EnumInfo {

    private static final Set<String> FIELDS = Set.of("file_path", "name", "values", "docstring", "line",
        "provenance");

    String key;
    String filePath;
    String name;
    @Singular
    List<String> values;
    String docstring;
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
        props.put("values", List.copyOf(values));
        props.put("docstring", docstring == null ? "" : docstring);
        props.put("line", line);
        props.put("provenance", Props.provenanceTags(provenance));
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.ENUM).key(key).properties(props).build();
    }

    public static EnumInfo fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return EnumInfo.builder()
            .key(node.getKey())
            .filePath(Props.str(p.get("file_path")))
            .name(Props.str(p.get("name")))
            .values(Props.strings(p.get("values")))
            .docstring(Props.str(p.get("docstring"), ""))
            .line(Props.intValue(p.get("line"), 0))
            .provenance(Props.provenance(p.get("provenance")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
