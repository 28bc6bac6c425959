package com.codemigration.metagraph.graph.impl;

import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.codemigration.metagraph.model.graph.GraphBatch;
import com.codemigration.metagraph.model.graph.GraphEdge;
import com.codemigration.metagraph.model.graph.GraphNode;
import com.codemigration.metagraph.model.graph.NodeLabel;
import com.codemigration.metagraph.model.graph.NodeRef;
import com.codemigration.metagraph.model.graph.RelationshipType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a live Neo4j. Set NEO4J_URI (and NEO4J_USERNAME / NEO4J_PASSWORD) to enable.
 */
@DisplayName("Neo4j Graph Store Tests")
@EnabledIfEnvironmentVariable(named = "NEO4J_URI", matches = ".+")
class Neo4jGraphStoreTest {

    private static final String PROJECT = "neo4j-store-test";

    private static Driver driver;
    private static Neo4jGraphStore store;

    @BeforeAll
    static void connect() {
        driver = GraphDatabase.driver(System.getenv("NEO4J_URI"), AuthTokens.basic(
            Objects.requireNonNullElse(System.getenv("NEO4J_USERNAME"), "neo4j"),
            Objects.requireNonNullElse(System.getenv("NEO4J_PASSWORD"), "password")));
        store = new Neo4jGraphStore(driver, new ObjectMapper());
        store.init();
    }

    @AfterAll
    static void disconnect() {
        driver.close();
    }

    @AfterEach
    void cleanUp() {
        store.deleteProject(PROJECT);
    }

    private static GraphNode file(String path) {
        return GraphNode.builder()
            .label(NodeLabel.FILE)
            .key(path)
            .property("path", path)
            .property("language", "python")
            .build();
    }

    @Test
    @DisplayName("Should upsert nodes idempotently and round-trip nested properties")
    void testUpsertNode_ShouldMergeAndRoundTrip() {
        GraphNode function = GraphNode.builder()
            .label(NodeLabel.FUNCTION)
            .key("main.py::fn:main")
            .property("name", "main")
            .property("arguments", List.of(Map.of("name", "args", "type", "list")))
            .build();

        store.upsertNode(PROJECT, function);
        store.upsertNode(PROJECT, function);

        assertEquals(1, store.countNodes(PROJECT, NodeLabel.FUNCTION));
        GraphNode read = store.findNode(PROJECT, NodeLabel.FUNCTION, "main.py::fn:main").orElseThrow();
        assertEquals("main", read.get("name"));
        assertEquals(List.of(Map.of("name", "args", "type", "list")), read.get("arguments"));
    }

    @Test
    @DisplayName("Should store edges once and follow them transitively")
    void testEdges_ShouldBeReachable() {
        store.applyBatch(PROJECT, GraphBatch.builder()
            .node(file("a.py"))
            .node(file("b.py"))
            .node(file("c.py"))
            .edge(GraphEdge.of(RelationshipType.IMPORTS, NodeRef.of(NodeLabel.FILE, "a.py"),
                NodeRef.of(NodeLabel.FILE, "b.py")))
            .edge(GraphEdge.of(RelationshipType.IMPORTS, NodeRef.of(NodeLabel.FILE, "b.py"),
                NodeRef.of(NodeLabel.FILE, "c.py")))
            .edge(GraphEdge.of(RelationshipType.IMPORTS, NodeRef.of(NodeLabel.FILE, "a.py"),
                NodeRef.of(NodeLabel.FILE, "b.py")))
            .build());

        assertEquals(2, store.countEdges(PROJECT, RelationshipType.IMPORTS));
        assertEquals(Set.of("b.py", "c.py"),
            store.reachableKeys(PROJECT, NodeLabel.FILE, "a.py", Set.of(RelationshipType.IMPORTS), 0));
        assertEquals(Set.of("b.py"),
            store.reachableKeys(PROJECT, NodeLabel.FILE, "a.py", Set.of(RelationshipType.IMPORTS), 1));
    }

    @Test
    @DisplayName("Should roll back the whole batch when an endpoint is missing")
    void testMissingEndpoint_ShouldRollBack() {
        GraphBatch batch = GraphBatch.builder()
            .node(file("a.py"))
            .edge(GraphEdge.of(RelationshipType.IMPORTS, NodeRef.of(NodeLabel.FILE, "a.py"),
                NodeRef.of(NodeLabel.FILE, "missing.py")))
            .build();

        assertThrows(ConstraintViolationException.class, () -> store.applyBatch(PROJECT, batch));
        assertEquals(0, store.countNodes(PROJECT, null));
    }

    @Test
    @DisplayName("Should filter nodes by property and keep projects apart")
    void testFindNodes_ShouldFilterAndIsolate() {
        store.upsertNode(PROJECT, file("a.py"));
        store.upsertNode(PROJECT, file("b.py").toBuilder().property("language", "java").build());
        store.upsertNode("other-" + PROJECT, file("a.py"));
        try {
            assertEquals(List.of("a.py"), store.findNodes(PROJECT, NodeLabel.FILE, Map.of("language", "python"))
                .stream().map(GraphNode::getKey).toList());
            assertEquals(2, store.countNodes(PROJECT, NodeLabel.FILE));
        } finally {
            store.deleteProject("other-" + PROJECT);
        }
    }
}
