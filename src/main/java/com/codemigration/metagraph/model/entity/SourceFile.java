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
 * A source file of the legacy project, keyed by its project-relative path.
 *
 * <p>{@code pendingImports} and {@code pendingReferences} hold the tentative cross-file links
 * written during extraction; the resolution pass turns them into IMPORTS / REFERENCES edges.
 */
@Value
@Builder(toBuilder = true)
public class SourceFile {

    public static final String PARSED = "parsed";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";
    public static final String PENDING = "pending";

    private static final Set<String> FIELDS = Set.of("path", "language", "size", "discovery_index",
        "parse_status", "parse_error", "pending_imports", "pending_references", "report_closure",
        "full_closure");

    String path;
    String language;
    long size;
    int discoveryIndex;
    String parseStatus;
    String parseError;
    @Singular
    List<ModuleRef> pendingImports;
    @Singular
    List<ModuleRef> pendingReferences;
    @Singular("reportClosureEntry")
    List<String> reportClosure;
    @Singular("fullClosureEntry")
    List<String> fullClosure;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode(String projectId) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, projectId);
        props.put("path", path);
        props.put("language", language);
        props.put("size", size);
        props.put("discovery_index", discoveryIndex);
        props.put("parse_status", parseStatus == null ? PENDING : parseStatus);
        if (parseError != null) {
            props.put("parse_error", parseError);
        }
        props.put("pending_imports", pendingImports.stream().map(ModuleRef::toMap).toList());
        props.put("pending_references", pendingReferences.stream().map(ModuleRef::toMap).toList());
        if (!reportClosure.isEmpty() || !fullClosure.isEmpty()) {
            props.put("report_closure", List.copyOf(reportClosure));
            props.put("full_closure", List.copyOf(fullClosure));
        }
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.FILE).key(EntityKeys.file(path)).properties(props).build();
    }

    public static SourceFile fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        return SourceFile.builder()
            .path(Props.str(p.get("path"), node.getKey()))
            .language(Props.str(p.get("language"), "unknown"))
            .size(Props.longValue(p.get("size"), 0))
            .discoveryIndex(Props.intValue(p.get("discovery_index"), Integer.MAX_VALUE))
            .parseStatus(Props.str(p.get("parse_status"), PENDING))
            .parseError(Props.str(p.get("parse_error")))
            .pendingImports(Props.maps(p.get("pending_imports")).stream().map(ModuleRef::fromMap).toList())
            .pendingReferences(Props.maps(p.get("pending_references")).stream().map(ModuleRef::fromMap).toList())
            .reportClosure(Props.strings(p.get("report_closure")))
            .fullClosure(Props.strings(p.get("full_closure")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
