package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Reads and writes Project nodes.
 *
 * <p>State updates write only the state fields, so a cancellation flag set while a stage runs
 * is never overwritten by the stage's commit.
 */
@Component
@RequiredArgsConstructor
public class ProjectRegistry {

    private final GraphStore graphStore;

    public Project create(ProjectIntake intake) {
        String id = intake.getProjectId() == null || intake.getProjectId().isBlank()
            ? UUID.randomUUID().toString()
            : intake.getProjectId();
        if (graphStore.findNode(id, NodeLabel.PROJECT, id).isPresent()) {
            throw new IllegalArgumentException("Project already exists: " + id);
        }
        String now = Instant.now().toString();
        Project project = Project.builder()
            .id(id)
            .name(intake.getName() == null ? id : intake.getName())
            .description(intake.getDescription())
            .sourceDir(intake.getSourceDir())
            .sourceLanguage(intake.getSourceLanguage())
            .targetLanguage(intake.getTargetLanguage())
            .sourceFramework(intake.getSourceFramework())
            .targetFramework(intake.getTargetFramework())
            .customMappings(intake.getCustomMappings())
            .status(ProjectState.UPLOADED)
            .lastCompletedStage(ProjectState.UPLOADED)
            .progress(0)
            .currentStep("")
            .createdAt(now)
            .updatedAt(now)
            .build();
        graphStore.upsertNode(id, project.toNode());
        return project;
    }

    public Project load(String projectId) {
        return graphStore.findNode(projectId, NodeLabel.PROJECT, projectId)
            .map(Project::fromNode)
            .orElseThrow(() -> new IllegalArgumentException("Project not found: " + projectId));
    }

    public void markStep(String projectId, String step) {
        graphStore.upsertNode(projectId, stateNode(projectId)
            .property("current_step", step)
            .build());
    }

    /**
     * Commit a state. {@code lastCompleted} is what the next run resumes from; {@code error} is
     * cleared when {@code null}.
     */
    public void commit(String projectId, ProjectState state, ProjectState lastCompleted, String step, String error) {
        GraphNode.GraphNodeBuilder node = stateNode(projectId)
            .property("status", state.tag())
            .property("last_completed_stage", lastCompleted.tag())
            .property("current_step", step)
            .property("error", error == null ? "" : error);
        if (lastCompleted.getProgress() >= 0) {
            node.property("progress", lastCompleted.getProgress());
        }
        graphStore.upsertNode(projectId, node.build());
    }

    public void requestCancel(String projectId) {
        graphStore.upsertNode(projectId, stateNode(projectId)
            .property("cancel_requested", true)
            .build());
    }

    private static GraphNode.GraphNodeBuilder stateNode(String projectId) {
        return GraphNode.builder()
            .label(NodeLabel.PROJECT)
            .key(projectId)
            .property("updated_at", Instant.now().toString());
    }
}
