package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;

/**
 * One transition of the project state machine.
 *
 * <p>A stage only writes upserts, so running it again after a crash or a retry is safe. It must
 * not touch the Project node's state fields; the orchestrator commits those once the stage
 * returns.
 *
 * @since 1.0.0
 */
public interface PipelineStage {

    /**
     * Short name used in logs, MDC and {@code current_step}.
     */
    String name();

    /**
     * State a project must have completed for this stage to run.
     */
    ProjectState requires();

    /**
     * State committed after the stage succeeds.
     */
    ProjectState produces();

    void run(Project project);
}
