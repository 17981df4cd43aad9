package org.digraph.core;

/**
 * Edge together with its weight value at the time it was read.
 *
 * @param from source node.
 * @param to target node.
 * @param weight weight value; {@code null} when neither a weight nor a default applies.
 * @param <N> node type.
 */
public record WeightedEdge<N>(N from, N to, Object weight) {

    public Edge<N> edge() {
        return new Edge<>(from, to);
    }
}
