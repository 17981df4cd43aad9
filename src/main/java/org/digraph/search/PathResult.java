package org.digraph.search;

import java.util.List;

/**
 * A found path and its total distance.
 *
 * @param path nodes from a begin node to an end node, at least two of them.
 * @param distance sum of edge distances along {@code path}.
 * @param <N> node type.
 */
public record PathResult<N>(List<N> path, double distance) {

    public PathResult {
        path = List.copyOf(path);
    }

    public N begin() {
        return path.get(0);
    }

    public N end() {
        return path.get(path.size() - 1);
    }
}
