package org.digraph.search;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.digraph.core.Edge;

import java.util.Set;

/**
 * One shortest-path query between sets of nodes.
 *
 * <p>Begin and end nodes absent from the graph are dropped before the search starts.</p>
 *
 * @param <N> node type.
 */
@Value
@Builder
public class SearchRequest<N> {
    /** Nodes a path may start from. */
    @Singular
    Set<N> begins;
    /** Nodes a path may end at. */
    @Singular
    Set<N> ends;
    /** Per-edge distance; unit distance when not set. */
    DistanceFunction<N> distanceFunction;
    /** Nodes treated as absent for this search. */
    @Singular
    Set<N> excludedNodes;
    /** Edges treated as absent for this search. */
    @Singular
    Set<Edge<N>> excludedEdges;
    /** Acceptance window on goal distances; accepts everything when not set. */
    DistanceWindow distanceWindow;

    public DistanceFunction<N> getDistanceFunction() {
        return distanceFunction == null ? DistanceFunction.unit() : distanceFunction;
    }

    public DistanceWindow getDistanceWindow() {
        return distanceWindow == null ? DistanceWindow.any() : distanceWindow;
    }
}
