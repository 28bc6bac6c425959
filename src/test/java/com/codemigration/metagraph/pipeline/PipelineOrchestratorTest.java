package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.ProjectState;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.entity.Strategy;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.support.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("Pipeline Orchestrator Tests")
class PipelineOrchestratorTest {

    private static final String MAIN = """
        import utils


        def main(args: list):
            \"\"\"Entry point.\"\"\"
            return utils.VERSION


        class DataProcessor:
            _instance = None

            def process(self, payload) -> dict:
                return {}
        """;

    private static final String UTILS = "VERSION = \"1.0\"\n";

    @TempDir
    Path sourceDir;

    private TestPipeline pipeline;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline(mock(SemanticInference.class));
        orchestrator = pipeline.orchestrator;
    }

    private String create(String projectId, Map<String, String> files) {
        TestPipeline.sourceTree(sourceDir, files);
        return orchestrator.createProject(ProjectIntake.builder()
            .projectId(projectId)
            .name("Legacy " + projectId)
            .sourceDir(sourceDir.toString())
            .targetLanguage("java")
            .build()).getId();
    }

    private List<Report> reportsOfType(String projectId, String type) {
        return pipeline.store.findNodes(projectId, NodeLabel.REPORT, Map.of("type", type)).stream()
            .map(Report::fromNode)
            .toList();
    }

    // =========================================================================
    // End to end
    // =========================================================================

    @Nested
    @DisplayName("End to end")
    class EndToEnd {

        @Test
        @DisplayName("Should take a two-file Python project from upload to done")
        void testRunToCompletion_TwoFileProject() {
            // Given
            String id = create("scenario-1", Map.of("main.py", MAIN, "utils.py", UTILS));

            // When
            ProjectState state = orchestrator.runToCompletion(id);

            // Then
            assertEquals(ProjectState.DONE, state);
            assertEquals(2, pipeline.store.countNodes(id, NodeLabel.FILE));
            assertEquals(1, pipeline.store.countNodes(id, NodeLabel.FUNCTION));
            assertEquals(1, pipeline.store.countNodes(id, NodeLabel.CLASS));
            assertEquals(1, pipeline.store.countEdges(id, RelationshipType.IMPORTS));

            FunctionInfo main = FunctionInfo.fromNode(pipeline.store.findNodes(id, NodeLabel.FUNCTION).get(0));
            assertEquals("main", main.getName());
            assertTrue(main.isStatic());
            assertFalse(main.isAsync());
            ClassInfo processor = ClassInfo.fromNode(pipeline.store.findNodes(id, NodeLabel.CLASS).get(0));
            assertEquals(ClassInfo.KIND_SINGLETON, processor.getKind());
            GraphEdge imports = pipeline.store.findEdges(id, RelationshipType.FILE_DEPENDENCIES).stream()
                .filter(e -> e.getType() == RelationshipType.IMPORTS)
                .findFirst()
                .orElseThrow();
            assertEquals("main.py", imports.getFrom().key());
            assertEquals("utils.py", imports.getTo().key());

            ProjectStatus status = orchestrator.getStatus(id);
            assertEquals(100, status.progress());
            assertEquals(ProjectState.DONE, status.lastCompletedStage());
            assertEquals(1, status.pendingFeedback(), "utils.py has no mapping rule");
            assertNull(status.error());
            assertEquals("python", pipeline.registry.load(id).getSourceLanguage());
            assertEquals(2, pipeline.store.countNodes(id, NodeLabel.STRATEGY));
            assertEquals(2, pipeline.store.countEdges(id, RelationshipType.CLASSIFIES_AS));
            System.out.println("✅ " + id + " done with " + status.reports() + " reports");
        }

        @Test
        @DisplayName("Should finish despite a file that does not parse")
        void testRunToCompletion_MalformedFileIsIsolated() {
            String id = create("scenario-2", Map.of(
                "main.py", MAIN,
                "utils.py", UTILS,
                "broken.py", "def broken(:\n    pass\n"));

            assertEquals(ProjectState.DONE, orchestrator.runToCompletion(id));

            SourceFile broken = SourceFile.fromNode(pipeline.store.findNode(id, NodeLabel.FILE, "broken.py").orElseThrow());
            assertEquals(SourceFile.FAILED, broken.getParseStatus());
            List<Report> malformed = reportsOfType(id, "MalformedInputError");
            assertEquals(1, malformed.size());
            assertEquals("broken.py", malformed.get(0).getDetails().get("path"));
            assertEquals(1, pipeline.store.countNodes(id, NodeLabel.FUNCTION), "Other files are unaffected");
        }

        @Test
        @DisplayName("Should plan a two-file import cycle in a stable order")
        void testRunToCompletion_ImportCycle() {
            String id = create("scenario-3", Map.of(
                "a.py", "import b\n\n\ndef f():\n    return b.g()\n",
                "b.py", "import a\n\n\ndef g():\n    return a.f()\n"));

            assertEquals(ProjectState.DONE, orchestrator.runToCompletion(id));

            List<String> order = pipeline.store.findNodes(id, NodeLabel.STRATEGY).stream()
                .map(Strategy::fromNode)
                .sorted(Comparator.comparingInt(Strategy::getPriority))
                .map(Strategy::getFilePath)
                .toList();
            assertEquals(List.of("a.py", "b.py"), order);
            assertEquals(1, reportsOfType(id, "dependency_cycle").size());
            assertEquals(2, pipeline.store.countEdges(id, RelationshipType.IMPORTS));
        }

        @Test
        @DisplayName("Should complete through the pipeline pool")
        void testRunAsync() {
            String id = create("async", Map.of("utils.py", UTILS));

            CompletableFuture<ProjectState> run = orchestrator.runAsync(id);

            assertEquals(ProjectState.DONE, run.join());
            assertFalse(orchestrator.getStatus(id).running());
        }
    }

    // =========================================================================
    // State machine
    // =========================================================================

    @Test
    @DisplayName("Should advance one stage at a time and pause on pending feedback without blocking")
    void testAdvance_StepByStep() {
        String id = create("steps", Map.of("main.py", MAIN, "utils.py", UTILS));

        assertEquals(ProjectState.UPLOADED, orchestrator.getState(id));
        assertEquals("structure_analysis", orchestrator.nextStage(id).orElseThrow().name());
        assertEquals(ProjectState.STRUCTURE_ANALYZED, orchestrator.advance(id));
        assertEquals(20, orchestrator.getStatus(id).progress());
        assertEquals(ProjectState.CONTENT_ANALYZED, orchestrator.advance(id));
        assertEquals(ProjectState.CLASSIFIED, orchestrator.advance(id));

        assertEquals(ProjectState.NEEDS_FEEDBACK, orchestrator.advance(id));
        ProjectStatus status = orchestrator.getStatus(id);
        assertTrue(status.needsAttention());
        assertEquals(ProjectState.MAPPED, status.lastCompletedStage());
        assertEquals(70, status.progress());

        String feedbackKey = pipeline.feedbackService.listPending(id).get(0).getKey();
        pipeline.feedbackService.resolve(id, feedbackKey, "Keep as a constants class");

        assertEquals(ProjectState.STRATEGIZED, orchestrator.advance(id));
        assertEquals(ProjectState.DONE, orchestrator.advance(id));
        assertTrue(orchestrator.nextStage(id).isEmpty());
        assertEquals(ProjectState.DONE, orchestrator.advance(id), "Terminal states stay put");
    }

    @Test
    @DisplayName("Should retry a stage through a short store outage")
    void testTransientStoreFailure_ShouldBeRetried() {
        String id = create("flaky", Map.of("utils.py", UTILS));
        pipeline.store.failWritesAfter(1, 2);

        assertEquals(ProjectState.STRUCTURE_ANALYZED, orchestrator.advance(id));
        assertEquals(1, pipeline.store.countNodes(id, NodeLabel.FILE));
    }

    @Test
    @DisplayName("Should fail the project once retries are exhausted and keep its last completed stage")
    void testTransientStoreFailure_ShouldFailAfterRetries() {
        String id = create("outage", Map.of("utils.py", UTILS));
        pipeline.store.failWritesAfter(1, 3);

        assertEquals(ProjectState.FAILED, orchestrator.advance(id));

        ProjectStatus status = orchestrator.getStatus(id);
        assertEquals(ProjectState.FAILED, status.state());
        assertEquals(ProjectState.UPLOADED, status.lastCompletedStage());
        assertTrue(status.error().startsWith("TransientStoreError: "));
        Report report = reportsOfType(id, "TransientStoreError").get(0);
        assertEquals("structure_analysis", report.getDetails().get("stage"));
        assertEquals(ProjectState.FAILED, orchestrator.runToCompletion(id));
    }

    @Test
    @DisplayName("Should fail immediately on a non-retryable error")
    void testNonRetryableFailure_ShouldNotRetry() {
        String id = create("violation", Map.of("utils.py", UTILS));
        AtomicInteger runs = new AtomicInteger();
        PipelineStage failing = new PipelineStage() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public ProjectState requires() {
                return ProjectState.UPLOADED;
            }

            @Override
            public ProjectState produces() {
                return ProjectState.STRUCTURE_ANALYZED;
            }

            @Override
            public void run(Project project) {
                runs.incrementAndGet();
                throw new ConstraintViolationException("duplicate key");
            }
        };

        ProjectState state = pipeline.orchestrator(List.of(failing)).advance(id);

        assertEquals(ProjectState.FAILED, state);
        assertEquals(1, runs.get());
        assertEquals("ConstraintViolationError: duplicate key", orchestrator.getStatus(id).error());
    }

    @Test
    @DisplayName("Should fail the project when its source directory is missing")
    void testMissingSourceDir_ShouldFail() {
        String id = orchestrator.createProject(ProjectIntake.builder()
            .projectId("missing")
            .sourceDir(sourceDir.resolve("nowhere").toString())
            .build()).getId();

        assertEquals(ProjectState.FAILED, orchestrator.runToCompletion(id));
        assertTrue(orchestrator.getStatus(id).error().startsWith("MalformedInputError: "));
    }

    @Test
    @DisplayName("Should stop at the next stage boundary after cancellation")
    void testCancel() {
        String id = create("cancelled", Map.of("utils.py", UTILS));
        orchestrator.advance(id);

        orchestrator.cancel(id);

        assertEquals(ProjectState.CANCELLED, orchestrator.advance(id));
        assertEquals(ProjectState.STRUCTURE_ANALYZED, orchestrator.getStatus(id).lastCompletedStage());
        assertEquals(0, pipeline.store.countNodes(id, NodeLabel.FUNCTION));
        assertEquals(ProjectState.CANCELLED, orchestrator.runToCompletion(id));
    }

    @Test
    @DisplayName("Should delete the whole project subgraph on purge")
    void testPurge() {
        String id = create("purged", Map.of("main.py", MAIN, "utils.py", UTILS));
        orchestrator.runToCompletion(id);

        long deleted = orchestrator.purge(id);

        assertTrue(deleted > 0);
        assertEquals(0, pipeline.store.countNodes(id, null));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.getState(id));
    }

    @Test
    @DisplayName("Should reject duplicate project ids and intakes without a source")
    void testCreateProject_Validation() {
        create("dup", Map.of("utils.py", UTILS));

        assertThrows(IllegalArgumentException.class, () -> orchestrator.createProject(ProjectIntake.builder()
            .projectId("dup")
            .sourceDir(sourceDir.toString())
            .build()));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.createProject(ProjectIntake.builder()
            .projectId("no-source")
            .build()));
    }

    @Test
    @DisplayName("Should keep node counts stable when the whole pipeline runs twice")
    void testRerun_ShouldBeIdempotent() {
        String first = create("rerun", Map.of("main.py", MAIN, "utils.py", UTILS));
        orchestrator.runToCompletion(first);
        long nodes = pipeline.store.countNodes(first, null) - pipeline.store.countNodes(first, NodeLabel.REPORT);
        long edges = pipeline.store.countEdges(first, null) - pipeline.store.countEdges(first, RelationshipType.REPORTED_IN);

        Project project = pipeline.registry.load(first);
        for (PipelineStage stage : pipeline.stages) {
            stage.run(project);
        }

        assertEquals(nodes, pipeline.store.countNodes(first, null) - pipeline.store.countNodes(first, NodeLabel.REPORT));
        assertEquals(edges, pipeline.store.countEdges(first, null)
            - pipeline.store.countEdges(first, RelationshipType.REPORTED_IN));
        GraphNode projectNode = pipeline.store.findNode(first, NodeLabel.PROJECT, first).orElseThrow();
        assertEquals("done", projectNode.get("status"));
        assertEquals(2, pipeline.store.findOutgoing(first, NodeRef.of(NodeLabel.PROJECT, first),
            RelationshipType.CONTAINS).size());
    }
}
