package org.digraph.search;

/**
 * One candidate in the search frontier: reach {@code node} at {@code distance} via {@code predecessor}.
 *
 * <p>Ordering is by distance, then by insertion sequence. Node values are never compared,
 * so nodes need no natural order.</p>
 *
 * @param distance cumulative distance from the nearest begin node.
 * @param sequence insertion sequence number assigned by the queue.
 * @param node candidate node.
 * @param predecessor node expanded to reach {@code node}; {@code null} for begin nodes.
 * @param <N> node type.
 */
public record FrontierEntry<N>(double distance, long sequence, N node, N predecessor)
        implements Comparable<FrontierEntry<N>> {

    @Override
    public int compareTo(FrontierEntry<N> other) {
        int byDistance = Double.compare(this.distance, other.distance);
        if (byDistance != 0) {
            return byDistance;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
