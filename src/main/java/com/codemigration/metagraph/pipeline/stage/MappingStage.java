package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.pipeline.PipelineStage;
import com.codemigration.metagraph.planner.MappingGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(4)
@Component
@RequiredArgsConstructor
public class MappingStage implements PipelineStage {

    private final MappingGenerator mappingGenerator;

    @Override
    public String name() {
        return "mapping";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.CLASSIFIED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.MAPPED;
    }

    @Override
    public void run(Project project) {
        mappingGenerator.generate(project);
    }
}
