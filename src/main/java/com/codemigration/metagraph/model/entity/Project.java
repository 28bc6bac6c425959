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
 * Root of a project subgraph. {@code status} is the orchestrator's committed state.
 */
@Value
@Builder(toBuilder = true)
public class Project {

    private static final Set<String> FIELDS = Set.of("name", "description", "source_dir", "source_language",
        "target_language", "source_framework", "target_framework", "status", "last_completed_stage",
        "progress", "current_step", "custom_mappings", "cancel_requested", "error", "created_at",
        "updated_at");

    String id;
    String name;
    String description;
    String sourceDir;
    String sourceLanguage;
    String targetLanguage;
    String sourceFramework;
    String targetFramework;
    ProjectState status;
    ProjectState lastCompletedStage;
    int progress;
    String currentStep;
    @Singular
    Map<String, String> customMappings;
    boolean cancelRequested;
    String error;
    String createdAt;
    String updatedAt;
    @Singular("extraProperty")
    Map<String, Object> extra;

    public GraphNode toNode() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(GraphNode.PROJECT_ID, id);
        props.put("name", name == null ? id : name);
        props.put("description", description == null ? "" : description);
        props.put("source_dir", sourceDir);
        props.put("source_language", sourceLanguage == null ? "unknown" : sourceLanguage);
        props.put("target_language", targetLanguage == null ? "" : targetLanguage);
        props.put("source_framework", sourceFramework == null ? "" : sourceFramework);
        props.put("target_framework", targetFramework == null ? "" : targetFramework);
        props.put("status", status.tag());
        props.put("last_completed_stage", lastCompletedStage == null ? status.tag() : lastCompletedStage.tag());
        props.put("progress", progress);
        props.put("current_step", currentStep == null ? "" : currentStep);
        props.put("custom_mappings", new LinkedHashMap<>(customMappings));
        props.put("cancel_requested", cancelRequested);
        if (error != null) {
            props.put("error", error);
        }
        props.put("created_at", createdAt);
        props.put("updated_at", updatedAt);
        Props.mergeExtras(props, extra);
        return GraphNode.builder().label(NodeLabel.PROJECT).key(id).properties(props).build();
    }

    public static Project fromNode(GraphNode node) {
        Map<String, Object> p = node.getProperties();
        ProjectState status = ProjectState.fromTag(Props.str(p.get("status"), "uploaded"));
        return Project.builder()
            .id(node.getKey())
            .name(Props.str(p.get("name")))
            .description(Props.str(p.get("description"), ""))
            .sourceDir(Props.str(p.get("source_dir")))
            .sourceLanguage(Props.str(p.get("source_language"), "unknown"))
            .targetLanguage(Props.str(p.get("target_language"), ""))
            .sourceFramework(Props.str(p.get("source_framework"), ""))
            .targetFramework(Props.str(p.get("target_framework"), ""))
            .status(status)
            .lastCompletedStage(ProjectState.fromTag(Props.str(p.get("last_completed_stage"), status.tag())))
            .progress(Props.intValue(p.get("progress"), 0))
            .currentStep(Props.str(p.get("current_step"), ""))
            .customMappings(Props.stringMap(p.get("custom_mappings")))
            .cancelRequested(Props.bool(p.get("cancel_requested")))
            .error(Props.str(p.get("error")))
            .createdAt(Props.str(p.get("created_at")))
            .updatedAt(Props.str(p.get("updated_at")))
            .extra(Props.extras(p, FIELDS))
            .build();
    }
}
