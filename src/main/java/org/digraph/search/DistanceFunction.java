package org.digraph.search;

import org.digraph.graph.Graph;

/**
 * Distance contributed by traversing one edge.
 *
 * <p>Returned distances must be finite and non-negative; the search rejects anything else.</p>
 *
 * @param <N> node type.
 */
@FunctionalInterface
public interface DistanceFunction<N> {

    double distance(Graph<N> graph, N from, N to);

    /**
     * Every edge has distance 1, so searches minimize hop count.
     */
    static <N> DistanceFunction<N> unit() {
        return (graph, from, to) -> 1.0d;
    }

    /**
     * Uses the numeric edge weight, falling back to the graph's default weight and then to 1.
     *
     * @throws SearchGuardrailException at search time if a weight is not a {@link Number}.
     */
    static <N> DistanceFunction<N> weighted() {
        return (graph, from, to) -> {
            Object weight = graph.weight(from, to, 1);
            if (weight instanceof Number number) {
                return number.doubleValue();
            }
            throw new SearchGuardrailException(
                    SearchGuardrailException.REASON_NON_NUMERIC_WEIGHT,
                    "weight of edge " + from + " -> " + to + " is not numeric: " + weight
            );
        };
    }
}
