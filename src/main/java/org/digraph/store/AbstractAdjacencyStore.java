package org.digraph.store;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterators;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import org.digraph.core.Edge;
import org.digraph.core.NotFoundException;

import java.util.Map;
import java.util.Objects;

/**
 * Forward-only adjacency: {@code parent -> set of children}.
 *
 * <p>Only out-edges are indexed, so {@link #inNeighbors} and {@link #inDegree} scan every
 * adjacency list (O(total adjacency)). This keeps one set per node instead of two.</p>
 *
 * @param <N> node type.
 */
abstract class AbstractAdjacencyStore<N> implements EdgeStore<N> {

    protected final Object2ObjectLinkedOpenHashMap<N, ObjectLinkedOpenHashSet<N>> adjacency =
            new Object2ObjectLinkedOpenHashMap<>();

    @Override
    public boolean hasEdge(N from, N to) {
        ObjectLinkedOpenHashSet<N> children = adjacency.get(from);
        return children != null && children.contains(to);
    }

    @Override
    public void addEdge(N from, N to) {
        Objects.requireNonNull(to, "to");
        childrenOf(Objects.requireNonNull(from, "from")).add(to);
    }

    @Override
    public void delEdge(N from, N to) {
        ObjectLinkedOpenHashSet<N> children = adjacency.get(from);
        if (children == null || !children.remove(to)) {
            throw new NotFoundException("edge not found: " + from + " -> " + to);
        }
    }

    @Override
    public Iterable<Edge<N>> edges() {
        return () -> adjacency.object2ObjectEntrySet().stream()
                .flatMap(entry -> entry.getValue().stream().map(child -> Edge.of(entry.getKey(), child)))
                .iterator();
    }

    @Override
    public int nEdges() {
        int count = 0;
        for (ObjectLinkedOpenHashSet<N> children : adjacency.values()) {
            count += children.size();
        }
        return count;
    }

    @Override
    public Iterable<N> outNeighbors(N node) {
        return () -> {
            ObjectLinkedOpenHashSet<N> children = adjacency.get(node);
            if (children == null) {
                return ObjectIterators.emptyIterator();
            }
            return ObjectIterators.unmodifiable(children.iterator());
        };
    }

    @Override
    public Iterable<N> inNeighbors(N node) {
        return () -> adjacency.object2ObjectEntrySet().stream()
                .filter(entry -> entry.getValue().contains(node))
                .map(Map.Entry::getKey)
                .iterator();
    }

    @Override
    public int outDegree(N node) {
        ObjectLinkedOpenHashSet<N> children = adjacency.get(node);
        return children == null ? 0 : children.size();
    }

    @Override
    public int inDegree(N node) {
        int degree = 0;
        for (ObjectLinkedOpenHashSet<N> children : adjacency.values()) {
            if (children.contains(node)) {
                degree++;
            }
        }
        return degree;
    }

    /**
     * Returns the child set of {@code node}, creating an empty one if missing.
     */
    protected ObjectLinkedOpenHashSet<N> childrenOf(N node) {
        ObjectLinkedOpenHashSet<N> children = adjacency.get(node);
        if (children == null) {
            children = new ObjectLinkedOpenHashSet<>();
            adjacency.put(node, children);
        }
        return children;
    }
}
