package org.digraph.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.digraph.testutil.TestGraphs.nodes;
import static org.junit.jupiter.api.Assertions.*;

class GraphTraversalTest {

    private static List<String> visit(Graph<String> graph, String start) {
        List<String> out = new ArrayList<>();
        GraphTraversal.visitBreadthFirst(graph, start).forEach(out::add);
        return out;
    }

    @Test
    @DisplayName("Breadth-first order, start only when on a cycle")
    void testBreadthFirstOrder() {
        Graph<String> graph = new Graph<>();
        graph.addEdge("A", "B");
        graph.addEdge("A", "C");
        graph.addEdge("B", "D");
        graph.addEdge("C", "D");
        graph.addEdge("D", "A");
        graph.addEdge("X", "Y");

        assertEquals(nodes("BCDA"), visit(graph, "A"));
        assertEquals(nodes("Y"), visit(graph, "X"));
        assertTrue(visit(graph, "Y").isEmpty());
        assertTrue(visit(graph, "missing").isEmpty());
    }

    @Test
    @DisplayName("Each iterator is a fresh traversal")
    void testRestartable() {
        Graph<String> graph = new Graph<>();
        graph.addPath(nodes("ABC"));
        Iterable<String> reachable = GraphTraversal.visitBreadthFirst(graph, "A");
        Iterator<String> first = reachable.iterator();
        assertEquals("B", first.next());
        assertEquals(nodes("BC"), visit(graph, "A"));
        assertEquals("C", first.next());
        assertFalse(first.hasNext());
        assertThrows(NoSuchElementException.class, first::next);
    }
}
