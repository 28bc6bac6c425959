package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.model.entity.ProjectState;

/**
 * Status view for callers polling a project.
 *
 * @param running Whether a pipeline run is in flight right now
 */
public record ProjectStatus(String projectId, ProjectState state, ProjectState lastCompletedStage, int progress,
                            String currentStep, long pendingFeedback, long reports, String error, String updatedAt,
                            boolean running) {

    public boolean needsAttention() {
        return state == ProjectState.FAILED || state == ProjectState.NEEDS_FEEDBACK;
    }
}
