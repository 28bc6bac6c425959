package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.pipeline.PipelineStage;
import com.codemigration.metagraph.resolver.ClassificationService;
import com.codemigration.metagraph.resolver.ClosureService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code content_analyzed -> classified}: dependency closures and cycle reports, then one
 * Component per file.
 */
@Order(3)
@Component
@RequiredArgsConstructor
public class ClassificationStage implements PipelineStage {

    private final ClosureService closureService;
    private final ClassificationService classificationService;

    @Override
    public String name() {
        return "classification";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.CONTENT_ANALYZED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.CLASSIFIED;
    }

    @Override
    public void run(Project project) {
        closureService.compute(project.getId());
        classificationService.classifyAll(project.getId());
    }
}
