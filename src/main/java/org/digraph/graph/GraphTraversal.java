package org.digraph.graph;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reachability traversals over a {@link Graph}.
 */
@UtilityClass
public class GraphTraversal {

    /**
     * Lazily yields every node reachable from {@code start}, in breadth-first order.
     *
     * <p>The queue is seeded with the out-neighbors of {@code start}, so {@code start} itself is
     * yielded only when it lies on a cycle. Each call to {@code iterator()} starts a new
     * traversal.</p>
     */
    public <N> Iterable<N> visitBreadthFirst(Graph<N> graph, N start) {
        return () -> new BreadthFirstIterator<>(graph, start);
    }

    private static final class BreadthFirstIterator<N> implements Iterator<N> {
        private final Graph<N> graph;
        private final ArrayDeque<N> queue = new ArrayDeque<>();
        private final ObjectOpenHashSet<N> visited = new ObjectOpenHashSet<>();
        private N next;

        BreadthFirstIterator(Graph<N> graph, N start) {
            this.graph = graph;
            graph.outNeighbors(start).forEach(queue::add);
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public N next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            N current = next;
            for (N neighbor : graph.outNeighbors(current)) {
                if (!visited.contains(neighbor)) {
                    queue.add(neighbor);
                }
            }
            advance();
            return current;
        }

        private void advance() {
            next = null;
            while (!queue.isEmpty()) {
                N candidate = queue.poll();
                if (visited.add(candidate)) {
                    next = candidate;
                    return;
                }
            }
        }
    }
}
