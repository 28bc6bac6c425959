package com.codemigration.metagraph.resolver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dependency Graph Tests")
class DependencyGraphTest {

    private static DependencyGraph graph(List<String> nodes, List<List<String>> edges) {
        return new DependencyGraph(nodes, edges);
    }

    @Test
    @DisplayName("Should bound the closure by depth and never revisit files on a cycle")
    void testClosure_ShouldRespectDepthAndCycles() {
        // Given: a -> b -> c -> a, c -> d
        DependencyGraph graph = graph(List.of("a", "b", "c", "d"), List.of(
            List.of("a", "b"), List.of("b", "c"), List.of("c", "a"), List.of("c", "d")));

        // Then
        assertEquals(List.of("b"), graph.closure("a", 1));
        assertEquals(List.of("b", "c"), graph.closure("a", 2));
        assertEquals(List.of("b", "c", "d"), graph.closure("a", 0));
        assertEquals(List.of(), graph.closure("d", 0));
    }

    @Test
    @DisplayName("Should ignore self-loops and edges to unknown files")
    void testConstructor_ShouldDropInvalidEdges() {
        DependencyGraph graph = graph(List.of("a", "b"), List.of(
            List.of("a", "a"), List.of("a", "ghost"), List.of("a", "b"), List.of("a", "b")));

        assertEquals(1, graph.edgeCount());
        assertTrue(graph.cycles().isEmpty());
    }

    @Test
    @DisplayName("Should find strongly connected components ordered by smallest member")
    void testStronglyConnectedComponents() {
        DependencyGraph graph = graph(List.of("x", "b", "a", "y"), List.of(
            List.of("x", "y"), List.of("y", "x"), List.of("a", "b"), List.of("b", "a"), List.of("a", "x")));

        assertEquals(List.of(List.of("a", "b"), List.of("x", "y")), graph.stronglyConnectedComponents());
        assertEquals(2, graph.cycles().size());
    }

    @Test
    @DisplayName("Should drop the lowest member's edges into its cycle and order the rest")
    void testBreakCycles_TwoFileCycle() {
        // Given
        DependencyGraph graph = graph(List.of("a.py", "b.py"), List.of(
            List.of("a.py", "b.py"), List.of("b.py", "a.py")));

        // When
        DependencyGraph.CycleBreak cycleBreak = graph.breakCycles();

        // Then
        assertEquals(List.of(List.of("a.py", "b.py")), cycleBreak.cycles());
        assertEquals(List.of(List.of("a.py", "b.py")), cycleBreak.removedEdges());
        assertEquals(List.of("a.py", "b.py"), cycleBreak.graph().topologicalOrder());
        assertEquals(2, graph.edgeCount(), "Original graph is untouched");
    }

    @Test
    @DisplayName("Should break nested cycles until the graph is acyclic")
    void testBreakCycles_NestedCycles() {
        // a <-> b and b -> c -> a
        DependencyGraph graph = graph(List.of("a", "b", "c"), List.of(
            List.of("a", "b"), List.of("b", "a"), List.of("b", "c"), List.of("c", "a")));

        DependencyGraph.CycleBreak cycleBreak = graph.breakCycles();

        assertTrue(cycleBreak.graph().cycles().isEmpty());
        List<String> order = cycleBreak.graph().topologicalOrder();
        assertEquals(3, order.size());
        assertEquals("a", order.get(0), "a lost its outgoing edges, so nothing precedes it");
        assertEquals(List.of("a", "c", "b"), order);
        assertEquals(cycleBreak.removedEdges(), graph.breakCycles().removedEdges(), "Same input, same break");
    }

    @Test
    @DisplayName("Should place dependencies first and keep discovery order among ready files")
    void testTopologicalOrder() {
        // main -> service -> model, main -> util
        DependencyGraph graph = graph(List.of("main", "util", "service", "model"), List.of(
            List.of("main", "service"), List.of("service", "model"), List.of("main", "util")));

        assertEquals(List.of("util", "model", "service", "main"), graph.topologicalOrder());
    }

    @Test
    @DisplayName("Should refuse to order a cyclic graph")
    void testTopologicalOrder_WithCycle_ShouldThrow() {
        DependencyGraph graph = graph(List.of("a", "b"), List.of(List.of("a", "b"), List.of("b", "a")));

        assertThrows(IllegalStateException.class, graph::topologicalOrder);
    }

    @Test
    @DisplayName("Should handle long import chains without recursion")
    void testDeepChain() {
        List<String> nodes = new ArrayList<>();
        List<List<String>> edges = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            nodes.add("m" + i);
            if (i > 0) {
                edges.add(List.of("m" + (i - 1), "m" + i));
            }
        }
        DependencyGraph graph = graph(nodes, edges);

        assertEquals(19_999, graph.closure("m0", 0).size());
        assertTrue(graph.cycles().isEmpty());
        assertEquals("m19999", graph.topologicalOrder().get(0));
    }
}
