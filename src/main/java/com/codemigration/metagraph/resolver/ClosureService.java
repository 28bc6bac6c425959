package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.config.MigrationProperties;
import com.codemigration.metagraph.graph.GraphStore;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes per-file dependency closures and records dependency cycles.
 *
 * <p>Each File node gets {@code report_closure} (bounded by {@code app.resolver.report-closure-depth})
 * and {@code full_closure} (unbounded). Both are taken over the relation after cycle breaking, so
 * they agree with the migration order and the bounded one is always a prefix of the full one. Every
 * cycle becomes a {@code dependency_cycle} report naming the edges dropped to break it; the stored
 * IMPORTS and REFERENCES edges stay as extracted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClosureService {

    static final String CYCLE_REPORT = "dependency_cycle";
    static final String CLOSURE_REPORT = "closure_analysis";
    private static final int BATCH_SIZE = 500;

    private final GraphStore graphStore;
    private final DependencyGraphReader graphReader;
    private final MigrationProperties properties;

    public ClosureSummary compute(String projectId) {
        DependencyGraph graph = graphReader.read(projectId);
        int depth = properties.getResolver().getReportClosureDepth();
        DependencyGraph.CycleBreak cycleBreak = graph.breakCycles();
        DependencyGraph acyclic = cycleBreak.graph();

        List<GraphNode> updates = new ArrayList<>();
        int largest = 0;
        for (String file : graph.nodes()) {
            List<String> reportClosure = acyclic.closure(file, depth);
            List<String> fullClosure = acyclic.closure(file, 0);
            largest = Math.max(largest, fullClosure.size());
            updates.add(GraphNode.builder()
                .label(NodeLabel.FILE)
                .key(EntityKeys.file(file))
                .property("report_closure", reportClosure)
                .property("full_closure", fullClosure)
                .build());
        }
        for (int start = 0; start < updates.size(); start += BATCH_SIZE) {
            graphStore.applyBatch(projectId, GraphBatch.builder()
                .nodes(updates.subList(start, Math.min(updates.size(), start + BATCH_SIZE)))
                .build());
        }

        NodeRef projectRef = NodeRef.of(NodeLabel.PROJECT, projectId);
        GraphBatch.GraphBatchBuilder reports = GraphBatch.builder();
        for (List<String> cycle : cycleBreak.cycles()) {
            String lowest = cycle.get(0);
            List<String> dropped = cycleBreak.removedEdges().stream()
                .filter(e -> e.get(0).equals(lowest) && cycle.contains(e.get(1)))
                .map(e -> e.get(0) + " -> " + e.get(1))
                .toList();
            log.warn("Dependency cycle among {} files starting at {}", cycle.size(), lowest);
            GraphNode node = Report.keyed(CYCLE_REPORT, String.join(",", cycle),
                    "Dependency cycle of " + cycle.size() + " files")
                .detail("files", cycle)
                .detail("broken_at", lowest)
                .detail("dropped_edges", dropped)
                .build()
                .toNode(projectId);
            reports.node(node).edge(GraphEdge.of(RelationshipType.REPORTED_IN, projectRef, node.ref()));
        }
        GraphNode summaryNode = Report.keyed(CLOSURE_REPORT, "closures",
                "Closures for " + graph.nodes().size() + " files")
            .detail("files", graph.nodes().size())
            .detail("edges", graph.edgeCount())
            .detail("report_closure_depth", depth)
            .detail("largest_closure", largest)
            .detail("cycles", cycleBreak.cycles().size())
            .build()
            .toNode(projectId);
        reports.node(summaryNode).edge(GraphEdge.of(RelationshipType.REPORTED_IN, projectRef, summaryNode.ref()));
        graphStore.applyBatch(projectId, reports.build());

        log.info("Closures computed for {} files, {} cycles", graph.nodes().size(), cycleBreak.cycles().size());
        return new ClosureSummary(graph.nodes().size(), cycleBreak.cycles().size(),
            cycleBreak.removedEdges().size(), largest);
    }
}
