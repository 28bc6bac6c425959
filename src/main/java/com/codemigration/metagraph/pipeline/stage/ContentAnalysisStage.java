package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.extraction.ExtractionEngine;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code structure_analyzed -> content_analyzed}: per-file extraction plus cross-file resolution.
 */
@Order(2)
@Component
@RequiredArgsConstructor
public class ContentAnalysisStage implements PipelineStage {

    private final ExtractionEngine extractionEngine;

    @Override
    public String name() {
        return "content_analysis";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.STRUCTURE_ANALYZED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.CONTENT_ANALYZED;
    }

    @Override
    public void run(Project project) {
        extractionEngine.analyze(project);
    }
}
