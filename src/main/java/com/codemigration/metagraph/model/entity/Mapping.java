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
 * Source construct to target component mapping.
 *
 * <p>{@code resolvedBy} is {@code rule}, {@code custom}, {@code inference} or {@code fallback}.
 */
@Value
@Builder(toBuilder = true)
public class Mapping {

    public static final String BY_RULE = "rule";
    public static final String BY_CUSTOM = "custom";
    public static final String BY_INFERENCE = "inference";
    public static final String BY_FALLBACK = "fallback";

    private static final Set<String> FIELDS = Set.of("source_label", "source_key", "target_keys",
        "data_type_mapping", "is_custom", "construct", "resolved_by");

    String key;
    NodeLabel sourceLabel;
    String sourceKey;
    @Singular
    List<String> targetKeys;
    @Singular("dataTypeEntry")
    Map<String, String> dataTypeMapping;
    boolean isCustom;
    String construct;
    String resolvedBy;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("source_label", sourceLabel.getLabel());
        props.put("source_key", sourceKey);
        props.put("target_keys", List.copyOf(targetKeys));
        props.put("data_type_mapping", new LinkedHashMap<>(dataTypeMapping));
        props.put("is_custom", isCustom);
        props.put("construct", construct == null ? "" : construct);
        props.put("resolved_by", resolvedBy == null ? BY_RULE : resolvedBy);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.MAPPING).key(key).properties(props).build();
    }

    public static Mapping fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return Mapping.builder()
            .key(node.getKey())
            .sourceLabel(NodeLabel.fromLabel(Props.str(p.get("source_label"), "Component")))
            .sourceKey(Props.str(p.get("source_key")))
            .targetKeys(Props.strings(p.get("target_keys")))
            .dataTypeMapping(Props.stringMap(p.get("data_type_mapping")))
            .isCustom(Props.bool(p.get("is_custom")))
            .construct(Props.str(p.get("construct"), ""))
            .resolvedBy(Props.str(p.get("resolved_by"), BY_RULE))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
