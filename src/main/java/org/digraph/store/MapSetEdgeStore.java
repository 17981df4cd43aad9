package org.digraph.store;

/**
 * Stand-alone edge store; pair it with any {@link NodeStore}.
 *
 * <p>Not thread-safe.</p>
 *
 * @param <N> node type.
 */
public final class MapSetEdgeStore<N> extends AbstractAdjacencyStore<N> {
}
