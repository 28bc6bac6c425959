package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.exception.TransientInferenceException;
import com.codemigration.metagraph.extraction.parser.ParserRegistry;
import com.codemigration.metagraph.extraction.parser.PythonSkeletonParser;
import com.codemigration.metagraph.extraction.parser.SyntaxParser;
import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.inference.StructureRequest;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.Project;
import com.codemigration.metagraph.model.entity.Provenance;
import com.codemigration.metagraph.model.entity.Report;
import com.codemigration.metagraph.model.entity.SourceFile;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.pipeline.ProjectIntake;
import com.codemigration.metagraph.support.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Extraction Engine Tests")
class ExtractionEngineTest {

    private static final String MAIN = """
        import utils


        def main(args: list):
            return utils.VERSION


        class DataProcessor:
            _instance = None

            def process(self, payload) -> dict:
                return {}
        """;

    @TempDir
    Path sourceDir;

    private SemanticInference inference;
    private TestPipeline pipeline;
    private Project project;

    @BeforeEach
    void setUp() {
        TestPipeline.sourceTree(sourceDir, Map.of(
            "main.py", MAIN,
            "utils.py", "VERSION = \"1.0\"\n",
            "broken.py", "def broken(:\n    pass\n",
            "docs/notes.md", "# Notes\n"));
        inference = mock(SemanticInference.class);
        pipeline = new TestPipeline(inference);
        project = pipeline.orchestrator.createProject(ProjectIntake.builder()
            .projectId("extraction-test")
            .sourceDir(sourceDir.toString())
            .build());
        pipeline.structureScanner.scan(project);
    }

    @Test
    @DisplayName("Should write entities, HAS_* edges and the resolved IMPORTS edge")
    void testAnalyze_ShouldBuildFileSubgraphs() {
        // When
        ExtractionSummary summary = pipeline.extractionEngine.analyze(project);

        // Then
        assertEquals(4, summary.files());
        assertEquals(1, summary.failed());
        assertEquals(1, summary.functions());
        assertEquals(1, summary.classes());
        assertEquals(1, summary.resolution().importEdges());

        String id = project.getId();
        assertEquals(4, pipeline.store.countNodes(id, NodeLabel.FILE));
        assertEquals(1, pipeline.store.countEdges(id, RelationshipType.HAS_FUNCTION));
        assertEquals(1, pipeline.store.countEdges(id, RelationshipType.HAS_CLASS));
        assertEquals("utils.py", pipeline.store.findOutgoing(id, NodeRef.of(NodeLabel.FILE, "main.py"),
            RelationshipType.IMPORTS).get(0).getTo().key());

        GraphNode function = pipeline.store.findNode(id, NodeLabel.FUNCTION, "main.py::fn:main").orElseThrow();
        assertEquals(true, function.get("is_static"));
        assertEquals(false, function.get("is_async"));

        SourceFile notes = SourceFile.fromNode(pipeline.store.findNode(id, NodeLabel.FILE, "docs/notes.md").orElseThrow());
        assertEquals(SourceFile.SKIPPED, notes.getParseStatus(), "No parser and not code");
        verify(inference, never()).inferStructure(any());
    }

    @Test
    @DisplayName("Should keep a File node and a MalformedInputError report for a file that does not parse")
    void testMalformedFile_ShouldBeRecordedAndIsolated() {
        pipeline.extractionEngine.analyze(project);

        String id = project.getId();
        SourceFile broken = SourceFile.fromNode(pipeline.store.findNode(id, NodeLabel.FILE, "broken.py").orElseThrow());
        assertEquals(SourceFile.FAILED, broken.getParseStatus());
        assertTrue(broken.getSize() > 0);
        assertNotNull(broken.getParseError());
        assertTrue(pipeline.store.findOutgoing(id, NodeRef.of(NodeLabel.FILE, "broken.py"),
            RelationshipType.HAS_FUNCTION).isEmpty());

        Report report = Report.fromNode(pipeline.store.findNode(id, NodeLabel.REPORT,
            "report:MalformedInputError:broken.py").orElseThrow(() -> new AssertionError("Should report the parse failure")));
        assertEquals("MalformedInputError", report.getType());
        assertEquals(1, ((Number) report.getDetails().get("line")).intValue());
    }

    @Test
    @DisplayName("Should isolate a parser crash to its file and finish the other files")
    void testParserCrash_ShouldFailOnlyThatFile() {
        // Given: a parser that breaks on utils.py
        PythonSkeletonParser python = new PythonSkeletonParser();
        SyntaxParser crashing = new SyntaxParser() {
            @Override
            public boolean supports(String language) {
                return python.supports(language);
            }

            @Override
            public ParsedSkeleton parse(SourceUnit unit) {
                if (unit.path().equals("utils.py")) {
                    throw new IndexOutOfBoundsException("Index 3 out of bounds for length 3");
                }
                return python.parse(unit);
            }
        };
        FileExtractor extractor = new FileExtractor(pipeline.store, new ParserRegistry(List.of(crashing)),
            pipeline.languageDetector, inference, new InferenceMerger(), pipeline.properties);
        ExtractionEngine engine = new ExtractionEngine(pipeline.store, pipeline.structureScanner, extractor,
            new CrossFileResolver(pipeline.store), TestPipeline.DIRECT);

        // When
        ExtractionSummary summary = engine.analyze(project);

        // Then
        String id = project.getId();
        assertEquals(2, summary.failed());
        assertEquals(1, summary.functions(), "main.py is still extracted");
        SourceFile utils = SourceFile.fromNode(pipeline.store.findNode(id, NodeLabel.FILE, "utils.py").orElseThrow());
        assertEquals(SourceFile.FAILED, utils.getParseStatus());
        assertTrue(utils.getParseError().contains("IndexOutOfBoundsException"));
        assertTrue(pipeline.store.findNode(id, NodeLabel.REPORT, "report:MalformedInputError:utils.py").isPresent());
    }

    @Test
    @DisplayName("Should leave node and relationship counts unchanged when run again")
    void testAnalyzeTwice_ShouldBeIdempotent() {
        String id = project.getId();
        pipeline.extractionEngine.analyze(project);
        long nodes = pipeline.store.countNodes(id, null);
        long edges = pipeline.store.countEdges(id, null);

        pipeline.extractionEngine.analyze(project);

        assertEquals(nodes, pipeline.store.countNodes(id, null));
        assertEquals(edges, pipeline.store.countEdges(id, null));
    }

    @Test
    @DisplayName("Should fill unresolved fields from inference and tag them")
    void testInference_ShouldFillUnresolvedReturnType() {
        when(inference.isAvailable()).thenReturn(true);
        when(inference.inferStructure(any(StructureRequest.class))).thenAnswer(call -> {
            StructureRequest request = call.getArgument(0);
            if (!request.path().equals("main.py")) {
                return ParsedSkeleton.empty();
            }
            return ParsedSkeleton.builder()
                .function(FunctionInfo.builder().name("main").returnType("int").build())
                .build();
        });

        pipeline.extractionEngine.analyze(project);

        FunctionInfo main = FunctionInfo.fromNode(pipeline.store.findNode(project.getId(), NodeLabel.FUNCTION,
            "main.py::fn:main").orElseThrow());
        assertEquals("int", main.getReturnType());
        assertEquals(Provenance.INFERENCE, main.getProvenance().get("return_type"));
        assertEquals(Provenance.SYNTAX, main.getProvenance().get("name"));
        assertTrue(main.getUnresolved().isEmpty());
    }

    @Test
    @DisplayName("Should keep syntactic data and raise one feedback entry when inference fails")
    void testInferenceFailure_ShouldRaiseFeedbackOnce() {
        when(inference.isAvailable()).thenReturn(true);
        when(inference.inferStructure(any())).thenThrow(new TransientInferenceException("timeout"));

        pipeline.extractionEngine.analyze(project);
        pipeline.extractionEngine.analyze(project);

        String id = project.getId();
        GraphNode function = pipeline.store.findNode(id, NodeLabel.FUNCTION, "main.py::fn:main").orElseThrow();
        assertEquals("Any", function.get("return_type"));
        assertEquals(List.of("feedback:TransientInferenceError:main.py"),
            pipeline.feedbackService.listPending(id).stream().map(f -> f.getKey()).toList());
    }

    @Test
    @DisplayName("Should skip content analysis of files over the size limit")
    void testOversizedFile_ShouldBeSkipped() {
        pipeline.properties.getExtraction().setMaxFileSizeBytes(20);

        ExtractionSummary summary = pipeline.extractionEngine.analyze(project);

        assertEquals(0, summary.functions());
        SourceFile main = SourceFile.fromNode(pipeline.store.findNode(project.getId(), NodeLabel.FILE, "main.py")
            .orElseThrow());
        assertEquals(SourceFile.SKIPPED, main.getParseStatus());
        assertTrue(pipeline.store.findEdges(project.getId(), EnumSet.of(RelationshipType.IMPORTS)).isEmpty());
    }
}
