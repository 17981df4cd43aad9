package org.digraph.store;

import org.digraph.core.Edge;
import org.digraph.core.NotFoundException;

/**
 * Directed adjacency between nodes, at most one edge per ordered pair.
 *
 * <p>An edge store never registers nodes; keeping endpoints registered is the job of the
 * graph facade. All returned {@link Iterable}s are lazy and restartable: every call to
 * {@code iterator()} reads the current adjacency afresh.</p>
 *
 * @param <N> node type.
 */
public interface EdgeStore<N> {

    boolean hasEdge(N from, N to);

    /**
     * Inserts the edge {@code from -> to}. Re-adding an existing edge is a no-op.
     */
    void addEdge(N from, N to);

    /**
     * Removes the edge {@code from -> to}.
     *
     * @throws NotFoundException if the edge does not exist.
     */
    void delEdge(N from, N to);

    Iterable<Edge<N>> edges();

    int nEdges();

    /**
     * Returns the targets of all edges leaving {@code node}; empty for unknown nodes.
     */
    Iterable<N> outNeighbors(N node);

    /**
     * Returns the sources of all edges entering {@code node}.
     *
     * <p>Implementations that index adjacency only in the forward direction answer this
     * by scanning every adjacency list, i.e. in O(total adjacency).</p>
     */
    Iterable<N> inNeighbors(N node);

    int outDegree(N node);

    /**
     * Returns the number of edges entering {@code node}. Same cost model as {@link #inNeighbors}.
     */
    int inDegree(N node);
}
