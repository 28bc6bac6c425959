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
 * A class declared in a legacy source file.
 *
 * <p>{@code kind} is an open tag ({@code plain}, {@code singleton}, {@code abstract},
 * {@code interface}, {@code dataclass}, ...). It is persisted under the {@code type} property.
 * Fields the parser could not decide are listed in {@code unresolved}; inference may fill those.
 */
@Value
@Builder(toBuilder = true)
public class ClassInfo {

    public static final String KIND_PLAIN = "plain";
    public static final String KIND_SINGLETON = "singleton";
    public static final String KIND_ABSTRACT = "abstract";
    public static final String KIND_INTERFACE = "interface";

    private static final Set<String> FIELDS = Set.of("file_path", "name", "type", "is_static", "is_final",
        "superclasses", "interfaces", "methods", "attributes", "decorators", "docstring", "line",
        "provenance", "unresolved", "provenance_conflicts");

    String key;
    String filePath;
    String name;
    String kind;
    boolean isStatic;
    boolean isFinal;
    @Singular("superclass")
    List<String> superclasses;
    @Singular("interfaceName")
    List<String> interfaces;
    @Singular
    List<MethodRef> methods;
    @Singular
    List<Attribute> attributes;
    @Singular
    List<String> decorators;
    String docstring;
    int line;
    @Singular("provenanceEntry")
    Map<String, Provenance> provenance;
    @Singular("unresolvedField")
    Set<String> unresolved;
    @Singular
    List<Map<String, Object>> provenanceConflicts;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("file_path", filePath);
        props.put("name", name);
        props.put("type", kind == null ? KIND_PLAIN : kind);
        props.put("is_static", isStatic);
        props.put("is_final", isFinal);
        props.put("superclasses", List.copyOf(superclasses));
        props.put("interfaces", List.copyOf(interfaces));
        props.put("methods", methods.stream().map(MethodRef::toMap).toList());
        props.put("attributes", attributes.stream().map(Attribute::toMap).toList());
        props.put("decorators", List.copyOf(decorators));
        props.put("docstring", docstring == null ? "" : docstring);
        props.put("line", line);
        props.put("provenance", Props.provenanceTags(provenance));
        props.put("unresolved", unresolved.stream().sorted().toList());
        props.put("provenance_conflicts", List.copyOf(provenanceConflicts));
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.CLASS).key(key).properties(props).build();
    }

    public static ClassInfo fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return ClassInfo.builder()
            .key(node.getKey())
            .filePath(Props.str(p.get("file_path")))
            .name(Props.str(p.get("name")))
            .kind(Props.str(p.get("type"), KIND_PLAIN))
            .isStatic(Props.bool(p.get("is_static")))
            .isFinal(Props.bool(p.get("is_final")))
            .superclasses(Props.strings(p.get("superclasses")))
            .interfaces(Props.strings(p.get("interfaces")))
            .methods(Props.maps(p.get("methods")).stream().map(MethodRef::fromMap).toList())
            .attributes(Props.maps(p.get("attributes")).stream().map(Attribute::fromMap).toList())
            .decorators(Props.strings(p.get("decorators")))
            .docstring(Props.str(p.get("docstring"), ""))
            .line(Props.intValue(p.get("line"), 0))
            .provenance(Props.provenance(p.get("provenance")))
            .unresolved(Props.strings(p.get("unresolved")))
            .provenanceConflicts(Props.maps(p.get("provenance_conflicts")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
