package org.digraph.store;

import it.unimi.dsi.fastutil.objects.ObjectIterators;
import org.digraph.core.NotFoundException;

import java.util.Objects;

/**
 * Combined node and edge store backed by one adjacency map.
 *
 * <p>A node exists exactly when it has an adjacency entry, possibly an empty one. Adding
 * an edge therefore also registers its source node; the target is registered by the
 * graph facade. Deleting a node drops its entry only: callers must remove edges entering
 * the node first (as {@code Graph.delNode} does), otherwise they remain in the
 * neighbors' adjacency sets.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <N> node type.
 */
public final class MapSetNodeEdgeStore<N> extends AbstractAdjacencyStore<N> implements NodeEdgeStore<N> {

    @Override
    public boolean hasNode(N node) {
        return adjacency.containsKey(node);
    }

    @Override
    public void addNode(N node) {
        childrenOf(Objects.requireNonNull(node, "node"));
    }

    @Override
    public void delNode(N node) {
        if (!adjacency.containsKey(node)) {
            throw new NotFoundException("node not found: " + node);
        }
        adjacency.remove(node);
    }

    @Override
    public Iterable<N> nodes() {
        return () -> ObjectIterators.unmodifiable(adjacency.keySet().iterator());
    }

    @Override
    public int nNodes() {
        return adjacency.size();
    }
}
