package org.digraph.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.digraph.core.Edge;
import org.digraph.graph.Graph;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shortest-path search between sets of nodes.
 *
 * <p>A Dijkstra variant generalized to several begin and end nodes. The frontier is seeded
 * with every begin node at distance 0; the first end node settled at an acceptable distance
 * (see {@link DistanceWindow}) ends the search, and its path is rebuilt from the settled
 * predecessor map (the shortest-path spanning tree). Excluded nodes are pre-settled as dead
 * entries without a predecessor, so they are never reached; excluded edges are skipped during
 * expansion.</p>
 *
 * <p>A path has at least one edge. Begin nodes are settled without a predecessor and are
 * never settled again, so a path from a node to itself is never found, not even when a
 * begin node is also an end node. To find the shortest cycle through {@code X}, search from
 * each out-neighbor {@code Y} of {@code X} to {@code X} with the edge {@code X -> Y} excluded
 * and add that edge back.</p>
 *
 * <p>The search only reads the graph, through {@code hasNode}, {@code outNeighbors} and the
 * distance function. It is synchronous and holds no lock; mutating the graph during a search
 * has undefined results. The only way to bound work is the distance window: a
 * {@link DistanceWindow#TOO_LONG} verdict ends the search.</p>
 */
@Slf4j
public final class ShortestPathSearch {

    /**
     * Finds a shortest path from {@code begin} to {@code end} counting hops.
     */
    public static <N> Optional<PathResult<N>> shortestPath(Graph<N> graph, N begin, N end) {
        return shortestPath(graph, begin, end, DistanceFunction.unit());
    }

    /**
     * Finds a shortest path from {@code begin} to {@code end} under {@code distanceFunction}.
     */
    public static <N> Optional<PathResult<N>> shortestPath(
            Graph<N> graph,
            N begin,
            N end,
            DistanceFunction<N> distanceFunction
    ) {
        return shortestPathBetweenSets(graph, SearchRequest.<N>builder()
                .begin(begin)
                .end(end)
                .distanceFunction(distanceFunction)
                .build());
    }

    /**
     * Runs {@code request} on a fresh search.
     *
     * @see #search(Graph, SearchRequest)
     */
    public static <N> Optional<PathResult<N>> shortestPathBetweenSets(Graph<N> graph, SearchRequest<N> request) {
        return new ShortestPathSearch().search(graph, request);
    }

    /**
     * Finds a shortest path from any begin node to any end node.
     *
     * @param graph graph to search; not modified.
     * @param request begins, ends, exclusions, distance function and window.
     * @return the path and its distance, or empty when no acceptable path exists.
     * @throws ExclusionException if exclusions remove every begin node or every end node.
     * @throws SearchGuardrailException if an edge distance is invalid.
     */
    public <N> Optional<PathResult<N>> search(Graph<N> graph, SearchRequest<N> request) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(request, "request");

        Set<N> begins = presentNodes(graph, request.getBegins());
        Set<N> ends = presentNodes(graph, request.getEnds());
        if (begins.isEmpty() || ends.isEmpty()) {
            log.debug("No begin or end node present in graph; begins={}, ends={}",
                    request.getBegins(), request.getEnds());
            return Optional.empty();
        }

        Set<N> excludedNodes = request.getExcludedNodes();
        validateExclusions(begins, ends, excludedNodes);

        Object2ObjectOpenHashMap<N, Settled<N>> spst = new Object2ObjectOpenHashMap<>();
        for (N excluded : excludedNodes) {
            spst.put(excluded, Settled.dead());
        }
        FrontierQueue<N> frontier = new FrontierQueue<>();
        for (N begin : begins) {
            frontier.insert(0.0d, begin, null);
        }

        Set<Edge<N>> excludedEdges = request.getExcludedEdges();
        DistanceFunction<N> distanceFunction = request.getDistanceFunction();
        DistanceWindow window = request.getDistanceWindow();
        int settledNodes = 0;

        while (!frontier.isEmpty()) {
            FrontierEntry<N> entry = frontier.extractMin();
            double distance = entry.distance();
            int verdict = window.evaluate(distance);
            if (verdict > 0) {
                log.debug("Search stopped: distance {} beyond window after settling {} nodes",
                        distance, settledNodes);
                return Optional.empty();
            }

            N node = entry.node();
            if (spst.containsKey(node)) {
                continue;
            }
            spst.put(node, new Settled<>(distance, entry.predecessor()));
            settledNodes++;

            if (verdict == 0 && entry.predecessor() != null && ends.contains(node)) {
                List<N> path = buildPath(spst, node);
                log.debug("Found path of {} nodes, distance {}, settled {}, peak frontier {}",
                        path.size(), distance, settledNodes, frontier.getPeakSize());
                return Optional.of(new PathResult<>(path, distance));
            }

            for (N neighbor : graph.outNeighbors(node)) {
                if (spst.containsKey(neighbor)) {
                    continue;
                }
                if (!excludedEdges.isEmpty() && excludedEdges.contains(Edge.of(node, neighbor))) {
                    continue;
                }
                double step = distanceFunction.distance(graph, node, neighbor);
                ensureValidDistance(step, node, neighbor);
                frontier.insert(distance + step, neighbor, node);
            }
        }

        log.debug("Frontier exhausted after settling {} nodes", settledNodes);
        return Optional.empty();
    }

    private static <N> Set<N> presentNodes(Graph<N> graph, Set<N> nodes) {
        ObjectLinkedOpenHashSet<N> present = new ObjectLinkedOpenHashSet<>();
        for (N node : nodes) {
            if (graph.hasNode(node)) {
                present.add(node);
            }
        }
        return present;
    }

    /**
     * Fails when exclusions remove all begins or all ends; warns when they remove only some.
     */
    private static <N> void validateExclusions(Set<N> begins, Set<N> ends, Set<N> excludedNodes) {
        if (excludedNodes.isEmpty()) {
            return;
        }
        int excludedBegins = countExcluded(begins, excludedNodes);
        if (excludedBegins == begins.size()) {
            throw new ExclusionException(
                    ExclusionException.REASON_ALL_BEGINS_EXCLUDED,
                    "all begin nodes are excluded: " + begins
            );
        }
        int excludedEnds = countExcluded(ends, excludedNodes);
        if (excludedEnds == ends.size()) {
            throw new ExclusionException(
                    ExclusionException.REASON_ALL_ENDS_EXCLUDED,
                    "all end nodes are excluded: " + ends
            );
        }
        if (excludedBegins > 0) {
            log.warn("{} of {} begin nodes are excluded and will be ignored", excludedBegins, begins.size());
        }
        if (excludedEnds > 0) {
            log.warn("{} of {} end nodes are excluded and will be ignored", excludedEnds, ends.size());
        }
    }

    private static <N> int countExcluded(Set<N> nodes, Set<N> excludedNodes) {
        int count = 0;
        for (N node : nodes) {
            if (excludedNodes.contains(node)) {
                count++;
            }
        }
        return count;
    }

    private static void ensureValidDistance(double step, Object from, Object to) {
        if (!Double.isFinite(step) || step < 0.0d) {
            throw new SearchGuardrailException(
                    SearchGuardrailException.REASON_INVALID_DISTANCE,
                    "distance of edge " + from + " -> " + to + " must be finite and >= 0, got " + step
            );
        }
    }

    /**
     * Walks predecessors from {@code end} back to a begin node and returns the path in forward order.
     */
    private static <N> List<N> buildPath(Object2ObjectOpenHashMap<N, Settled<N>> spst, N end) {
        ObjectArrayList<N> reversed = new ObjectArrayList<>();
        N cursor = end;
        while (cursor != null) {
            reversed.add(cursor);
            cursor = spst.get(cursor).predecessor();
        }
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * Settled entry of the shortest-path spanning tree. Begin nodes and dead (excluded)
     * nodes have no predecessor.
     */
    private record Settled<N>(double distance, N predecessor) {
        static <N> Settled<N> dead() {
            return new Settled<>(Double.POSITIVE_INFINITY, null);
        }
    }
}
