package org.digraph.store;

import org.digraph.core.NotFoundException;

/**
 * Existence and enumeration of graph nodes.
 *
 * <p>Nodes are opaque identifiers compared by {@code equals}/{@code hashCode}; any attributes
 * live in a {@link PropertyStore}.</p>
 *
 * @param <N> node type.
 */
public interface NodeStore<N> {

    /**
     * Returns whether {@code node} is registered.
     */
    boolean hasNode(N node);

    /**
     * Registers {@code node}. Re-adding an existing node is a no-op.
     */
    void addNode(N node);

    /**
     * Removes {@code node}.
     *
     * @throws NotFoundException if the node is not registered.
     */
    void delNode(N node);

    /**
     * Returns all nodes. Each call to {@code iterator()} starts a fresh, read-only pass.
     */
    Iterable<N> nodes();

    /**
     * Returns the number of registered nodes.
     */
    int nNodes();
}
