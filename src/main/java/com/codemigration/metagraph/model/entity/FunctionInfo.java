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
 * A free (module-level) function. Methods live on their Class record as {@link MethodRef}s.
 */
@Value
@Builder(toBuilder = true)
public class FunctionInfo {

    private static final Set<String> FIELDS = Set.of("file_path", "name", "return_type", "arguments",
        "decorators", "is_static", "is_async", "docstring", "line", "provenance", "unresolved");

    String key;
    String filePath;
    String name;
    String returnType;
    @Singular
    List<Argument> arguments;
    @Singular
    List<String> decorators;
    boolean isStatic;
    boolean isAsync;
    String docstring;
    int line;
    @Singular("provenanceEntry")
    Map<String, Provenance> provenance;
    @Singular("unresolvedField")
    Set<String> unresolved;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("file_path", filePath);
        props.put("name", name);
        props.put("return_type", returnType);
        props.put("arguments", arguments.stream().map(Argument::toMap).toList());
        props.put("decorators", List.copyOf(decorators));
        props.put("is_static", isStatic);
        props.put("is_async", isAsync);
        props.put("docstring", docstring == null ? "" : docstring);
        props.put("line", line);
        props.put("provenance", Props.provenanceTags(provenance));
        props.put("unresolved", unresolved.stream().sorted().toList());
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.FUNCTION).key(key).properties(props).build();
    }

    public static FunctionInfo fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return FunctionInfo.builder()
            .key(node.getKey())
            .filePath(Props.str(p.get("file_path")))
            .name(Props.str(p.get("name")))
            .returnType(Props.str(p.get("return_type"), "None"))
            .arguments(Props.maps(p.get("arguments")).stream().map(Argument::fromMap).toList())
            .decorators(Props.strings(p.get("decorators")))
            .isStatic(Props.bool(p.get("is_static")))
            .isAsync(Props.bool(p.get("is_async")))
            .docstring(Props.str(p.get("docstring"), ""))
            .line(Props.intValue(p.get("line"), 0))
            .provenance(Props.provenance(p.get("provenance")))
            .unresolved(Props.strings(p.get("unresolved")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
