package org.digraph.core;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered pair of nodes denoting one directed connection.
 *
 * @param from source node.
 * @param to target node.
 * @param <N> node type.
 */
public record Edge<N>(N from, N to) {

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static <N> Edge<N> of(N from, N to) {
        return new Edge<>(from, to);
    }

    /**
     * Returns the edge as a two-element node tuple, the key shape used by property stores.
     */
    public List<N> toList() {
        return List.of(from, to);
    }

    /**
     * Returns the reversed edge {@code (to, from)}.
     */
    public Edge<N> reversed() {
        return new Edge<>(to, from);
    }

    /**
     * Lexicographic order on {@code (from, to)}; requires naturally ordered nodes.
     */
    public static <N> Comparator<Edge<N>> naturalOrder() {
        return Comparator.<Edge<N>, N>comparing(Edge::from, Edge::<N>compareNatural)
                .thenComparing(Edge::to, Edge::<N>compareNatural);
    }

    /**
     * Compares two nodes by their natural order.
     *
     * @throws ClassCastException if {@code a} is not {@link Comparable} to {@code b}.
     */
    public static <N> int compareNatural(N a, N b) {
        @SuppressWarnings("unchecked")
        Comparable<? super N> comparable = (Comparable<? super N>) a;
        return comparable.compareTo(b);
    }
}
