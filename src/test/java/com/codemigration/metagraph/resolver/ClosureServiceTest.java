package com.codemigration.metagraph.resolver;

import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.pipeline.ProjectIntake;
import com.codemigration.metagraph.support.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("Closure Service Tests")
class ClosureServiceTest {

    private TestPipeline pipeline;
    private String projectId;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline(mock(SemanticInference.class));
        projectId = pipeline.orchestrator.createProject(ProjectIntake.builder()
            .projectId("closures")
            .sourceDir("/tmp/closures")
            .build()).getId();
    }

    private void files(String... paths) {
        GraphBatch.GraphBatchBuilder batch = GraphBatch.builder();
        for (int i = 0; i < paths.length; i++) {
            batch.node(SourceFile.builder().path(paths[i]).language("python").discoveryIndex(i)
                .parseStatus(SourceFile.PARSED).build().toNode(projectId));
        }
        pipeline.store.applyBatch(projectId, batch.build());
    }

    private void link(RelationshipType type, String from, String to) {
        pipeline.store.upsertEdge(projectId, GraphEdge.of(type, NodeRef.of(NodeLabel.FILE, from),
            NodeRef.of(NodeLabel.FILE, to)));
    }

    private SourceFile file(String path) {
        return SourceFile.fromNode(pipeline.store.findNode(projectId, NodeLabel.FILE, path).orElseThrow());
    }

    @Test
    @DisplayName("Should store bounded and full closures over imports and references")
    void testCompute_ShouldWriteClosures() {
        // Given: a -> b -> c -> d, with b referencing e
        files("a.py", "b.py", "c.py", "d.py", "e.py");
        link(RelationshipType.IMPORTS, "a.py", "b.py");
        link(RelationshipType.IMPORTS, "b.py", "c.py");
        link(RelationshipType.IMPORTS, "c.py", "d.py");
        link(RelationshipType.REFERENCES, "b.py", "e.py");
        pipeline.properties.getResolver().setReportClosureDepth(2);

        // When
        ClosureSummary summary = pipeline.closureService.compute(projectId);

        // Then
        assertEquals(List.of("b.py", "c.py", "e.py"), file("a.py").getReportClosure());
        assertEquals(List.of("b.py", "c.py", "e.py", "d.py"), file("a.py").getFullClosure());
        assertEquals(List.of(), file("d.py").getFullClosure());
        assertEquals(SourceFile.PARSED, file("a.py").getParseStatus(), "Closure update keeps other properties");
        assertEquals(0, summary.cycles());
    }

    @Test
    @DisplayName("Should take closures after cycle breaking and report the dropped edge")
    void testCycle_ShouldBeReported() {
        files("a.py", "b.py");
        link(RelationshipType.IMPORTS, "a.py", "b.py");
        link(RelationshipType.IMPORTS, "b.py", "a.py");

        ClosureSummary summary = pipeline.closureService.compute(projectId);

        assertEquals(1, summary.cycles());
        assertEquals(List.of(), file("a.py").getFullClosure(), "a.py drops its edge into the cycle");
        assertEquals(List.of("a.py"), file("b.py").getFullClosure());
        assertEquals(List.of(), file("a.py").getReportClosure());
        assertEquals(2, pipeline.store.countEdges(projectId, RelationshipType.IMPORTS), "Graph edges are kept");

        Report cycle = Report.fromNode(pipeline.store.findNode(projectId, NodeLabel.REPORT,
            "report:dependency_cycle:a.py,b.py").orElseThrow(() -> new AssertionError("Cycle should be reported")));
        assertEquals("a.py", cycle.getDetails().get("broken_at"));
        assertEquals(List.of("a.py -> b.py"), cycle.getDetails().get("dropped_edges"));
    }

    @Test
    @DisplayName("Should keep the bounded closure a prefix of the full closure on cyclic files")
    void testCycle_ClosuresShouldAgree() {
        // Given: a -> b -> c -> a, and a -> d outside the cycle
        files("a.py", "b.py", "c.py", "d.py");
        link(RelationshipType.IMPORTS, "a.py", "b.py");
        link(RelationshipType.IMPORTS, "b.py", "c.py");
        link(RelationshipType.IMPORTS, "c.py", "a.py");
        link(RelationshipType.REFERENCES, "a.py", "d.py");
        pipeline.properties.getResolver().setReportClosureDepth(1);

        // When
        pipeline.closureService.compute(projectId);

        // Then
        assertEquals(List.of("d.py"), file("a.py").getFullClosure());
        assertEquals(List.of("c.py", "a.py", "d.py"), file("b.py").getFullClosure());
        assertEquals(List.of("c.py"), file("b.py").getReportClosure());
        for (String path : List.of("a.py", "b.py", "c.py", "d.py")) {
            List<String> full = file(path).getFullClosure();
            List<String> bounded = file(path).getReportClosure();
            assertEquals(full.subList(0, bounded.size()), bounded, path + " closures disagree");
            assertFalse(full.contains(path), path + " should not reach itself");
        }
    }
}
