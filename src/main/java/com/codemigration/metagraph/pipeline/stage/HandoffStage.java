package com.codemigration.metagraph.pipeline.stage;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.pipeline.PipelineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code strategized -> done}: publishes the plan to code generation, which reads the Strategy
 * nodes in priority order and runs outside this service.
 */
@Slf4j
@Order(6)
@Component
@RequiredArgsConstructor
public class HandoffStage implements PipelineStage {

    private final GraphStore graphStore;

    @Override
    public String name() {
        return "handoff";
    }

    @Override
    public ProjectState requires() {
        return ProjectState.STRATEGIZED;
    }

    @Override
    public ProjectState produces() {
        return ProjectState.DONE;
    }

    @Override
    public void run(Project project) {
        long strategies = graphStore.countNodes(project.getId(), NodeLabel.STRATEGY);
        long mappings = graphStore.countNodes(project.getId(), NodeLabel.MAPPING);
        GraphNode node = Report.keyed("handoff", "plan", "Plan of " + strategies + " steps ready for generation")
            .detail("strategies", strategies)
            .detail("mappings", mappings)
            .build()
            .toNode(project.getId());
        graphStore.applyBatch(project.getId(), GraphBatch.builder()
            .node(node)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, project.getId()), node.ref()))
            .build());
        log.info("Plan of {} steps handed off", strategies);
    }
}
