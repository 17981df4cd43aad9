package org.digraph.store;

import it.unimi.dsi.fastutil.objects.ObjectIterators;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import org.digraph.core.NotFoundException;

import java.util.Objects;

/**
 * Node store backed by an insertion-ordered hash set.
 *
 * <p>Not thread-safe.</p>
 *
 * @param <N> node type.
 */
public final class SetNodeStore<N> implements NodeStore<N> {

    private final ObjectLinkedOpenHashSet<N> nodes = new ObjectLinkedOpenHashSet<>();

    @Override
    public boolean hasNode(N node) {
        return nodes.contains(node);
    }

    @Override
    public void addNode(N node) {
        nodes.add(Objects.requireNonNull(node, "node"));
    }

    @Override
    public void delNode(N node) {
        if (!nodes.remove(node)) {
            throw new NotFoundException("node not found: " + node);
        }
    }

    @Override
    public Iterable<N> nodes() {
        return () -> ObjectIterators.unmodifiable(nodes.iterator());
    }

    @Override
    public int nNodes() {
        return nodes.size();
    }
}
