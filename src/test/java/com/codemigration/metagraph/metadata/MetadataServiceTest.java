package com.codemigration.metagraph.metadata;

import com.codemigration.metagraph.inference.SemanticInference;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.codemigration.metagraph.pipeline.ProjectIntake;
import com.codemigration.metagraph.support.TestPipeline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("Metadata Service Tests")
class MetadataServiceTest {

    @TempDir
    Path sourceDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TestPipeline pipeline;
    private MetadataService metadataService;
    private String projectId;

    @BeforeEach
    void setUp() {
        TestPipeline.sourceTree(sourceDir, Map.of(
            "main.py", "import utils\n\n\ndef main(args: list):\n    return utils.VERSION\n",
            "utils.py", "VERSION = \"1.0\"\n",
            "app.yaml", "debug: true\n"));
        pipeline = new TestPipeline(mock(SemanticInference.class));
        metadataService = new MetadataService(pipeline.store, objectMapper);
        projectId = pipeline.orchestrator.createProject(ProjectIntake.builder()
            .projectId("metadata")
            .sourceDir(sourceDir.toString())
            .build()).getId();
        pipeline.orchestrator.runToCompletion(projectId);
    }

    @Test
    @DisplayName("Should count entities, relationships, languages and components")
    void testSummarize() {
        MetadataSummary summary = metadataService.summarize(projectId);

        assertEquals(3, summary.files());
        assertEquals(1, summary.functions());
        assertEquals(0, summary.classes());
        assertEquals(1L, summary.nodesByLabel().get("Project"));
        assertEquals(1L, summary.relationshipsByType().get("IMPORTS"));
        assertEquals(Map.of("python", 2L, "yaml", 1L), summary.filesByLanguage());
        assertEquals(Map.of("logic", 1L, "unknown", 1L, "config", 1L), summary.componentsByType());
        assertEquals(pipeline.store.countEdges(projectId, null), summary.relationships());
    }

    @Test
    @DisplayName("Should export only the requested labels and the relationships between them")
    void testExport_Filtered() {
        GraphExport export = metadataService.export(projectId, Set.of(NodeLabel.PROJECT, NodeLabel.FILE), Set.of());

        assertEquals(4, export.nodes().size());
        assertTrue(export.relationships().stream()
            .allMatch(r -> Set.of("CONTAINS", "IMPORTS", "REFERENCES").contains(r.type())));
        assertEquals(3, export.relationships().stream().filter(r -> r.type().equals("CONTAINS")).count());
    }

    @Test
    @DisplayName("Should dump the graph as JSON with every property")
    void testExportJson() throws Exception {
        String json = metadataService.exportJson(projectId, Set.of(NodeLabel.FUNCTION),
            Set.of(RelationshipType.HAS_FUNCTION));

        JsonNode root = objectMapper.readTree(json);
        assertEquals("metadata", root.path("project_id").asText());
        JsonNode function = root.path("nodes").get(0);
        assertEquals("Function", function.path("label").asText());
        assertEquals("main.py::fn:main", function.path("key").asText());
        assertEquals("list", function.path("properties").path("arguments").get(0).path("type").asText());
        assertEquals(0, root.path("relationships").size(), "File endpoints were not exported");
    }
}
