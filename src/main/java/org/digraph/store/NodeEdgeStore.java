package org.digraph.store;

/**
 * A single store playing both the node and the edge role.
 *
 * @param <N> node type.
 */
public interface NodeEdgeStore<N> extends NodeStore<N>, EdgeStore<N> {
}
