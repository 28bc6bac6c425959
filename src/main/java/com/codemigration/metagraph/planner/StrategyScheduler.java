package com.codemigration.metagraph.planner;

import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.Component;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.Mapping;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.Strategy;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.resolver.DependencyGraph;
import com.codemigration.metagraph.resolver.DependencyGraphReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders components into the migration plan.
 *
 * <p>Files are sorted dependencies-first over the IMPORTS / REFERENCES relation with cycles
 * broken the same way the closure pass breaks them; ties go to discovery order. A component's
 * priority is its rank in that order, so priorities are distinct and run from zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyScheduler {

    static final String REPORT_TYPE = "strategy";
    private static final int BATCH_SIZE = 200;

    private final GraphStore graphStore;
    private final DependencyGraphReader graphReader;

    public List<Strategy> schedule(String projectId) {
        DependencyGraph.CycleBreak cycleBreak = graphReader.read(projectId).breakCycles();
        DependencyGraph acyclic = cycleBreak.graph();
        List<String> order = acyclic.topologicalOrder();

        Map<String, Component> componentsByFile = new HashMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.COMPONENT)) {
            Component component = Component.fromNode(node);
            componentsByFile.put(component.getFilePath(), component);
        }
        Map<String, Mapping> mappingsBySource = new HashMap<>();
        for (GraphNode node : graphStore.findNodes(projectId, NodeLabel.MAPPING)) {
            Mapping mapping = Mapping.fromNode(node);
            mappingsBySource.put(mapping.getSourceKey(), mapping);
        }
        Map<String, Integer> entityCounts = new HashMap<>();
        for (NodeLabel label : List.of(NodeLabel.FUNCTION, NodeLabel.CLASS, NodeLabel.ENUM)) {
            for (GraphNode node : graphStore.findNodes(projectId, label)) {
                node.getString("file_path").ifPresent(path -> entityCounts.merge(path, 1, Integer::sum));
            }
        }

        List<Strategy> strategies = new ArrayList<>();
        for (String file : order) {
            Component component = componentsByFile.get(file);
            if (component == null) {
                log.warn("File {} has no component, leaving it out of the plan", file);
                continue;
            }
            List<String> dependsOn = acyclic.dependenciesOf(file).stream()
                .filter(componentsByFile::containsKey)
                .map(EntityKeys::component)
                .toList();
            strategies.add(Strategy.builder()
                .key(EntityKeys.strategy(component.getKey()))
                .componentKey(component.getKey())
                .filePath(file)
                .priority(strategies.size())
                .actions(actions(component, mappingsBySource.get(component.getKey()),
                    entityCounts.getOrDefault(file, 0), dependsOn.size()))
                .dependsOn(dependsOn)
                .build());
        }

        for (int start = 0; start < strategies.size(); start += BATCH_SIZE) {
            GraphBatch.GraphBatchBuilder batch = GraphBatch.builder();
            for (Strategy strategy : strategies.subList(start, Math.min(strategies.size(), start + BATCH_SIZE))) {
                GraphNode node = strategy.toNode(projectId);
                batch.node(node).edge(GraphEdge.of(RelationshipType.PLANNED_IN,
                    NodeRef.of(NodeLabel.COMPONENT, strategy.getComponentKey()), node.ref()));
            }
            graphStore.applyBatch(projectId, batch.build());
        }

        GraphNode reportNode = Report.keyed(REPORT_TYPE, "plan", "Planned " + strategies.size() + " components")
            .detail("components", strategies.size())
            .detail("order", strategies.stream().map(Strategy::getFilePath).toList())
            .detail("cycles", cycleBreak.cycles().size())
            .detail("dropped_edges", cycleBreak.removedEdges().stream().map(e -> e.get(0) + " -> " + e.get(1)).toList())
            .build()
            .toNode(projectId);
        graphStore.applyBatch(projectId, GraphBatch.builder()
            .node(reportNode)
            .edge(GraphEdge.of(RelationshipType.REPORTED_IN, NodeRef.of(NodeLabel.PROJECT, projectId), reportNode.ref()))
            .build());
        log.info("Migration plan: {} components, {} cycles broken", strategies.size(), cycleBreak.cycles().size());
        return strategies;
    }

    static List<String> actions(Component component, Mapping mapping, int entities, int dependencies) {
        List<String> actions = new ArrayList<>();
        if (dependencies > 0) {
            actions.add("wait for " + dependencies + " migrated dependencies");
        }
        if (mapping == null || Mapping.BY_FALLBACK.equals(mapping.getResolvedBy())) {
            actions.add("review " + component.getFilePath() + " manually");
        }
        if (mapping != null) {
            for (String target : mapping.getTargetKeys()) {
                actions.add("generate " + target);
            }
            if (!mapping.getDataTypeMapping().isEmpty()) {
                actions.add("apply type mapping for " + mapping.getDataTypeMapping().size() + " types");
            }
        }
        if (entities > 0) {
            actions.add("port " + entities + " declarations");
        }
        actions.add("verify " + component.getType().tag() + " component");
        return actions;
    }
}
