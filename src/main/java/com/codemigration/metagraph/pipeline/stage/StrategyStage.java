package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.pipeline.PipelineStage;
import com.codemigration.metagraph.planner.StrategyScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Order(5)
@Component
@RequiredArgsConstructor
public class StrategyStage implements PipelineStage {

    private final StrategyScheduler strategyScheduler;

    @Override
    public String name() {
        return "strategy";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.MAPPED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.STRATEGIZED;
    }

    @Override
    public void run(Project project) {
        strategyScheduler.schedule(project.getId());
    }
}
