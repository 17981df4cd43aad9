package org.digraph.graph;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.digraph.core.ConstructionException;
import org.digraph.core.Edge;
import org.digraph.core.NotFoundException;
import org.digraph.core.WeightedEdge;
import org.digraph.store.EdgeStore;
import org.digraph.store.MapPropertyStore;
import org.digraph.store.MapSetEdgeStore;
import org.digraph.store.MapSetNodeEdgeStore;
import org.digraph.store.NodeEdgeStore;
import org.digraph.store.NodeStore;
import org.digraph.store.PropertyStore;
import org.digraph.store.SetNodeStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Directed graph facade over a {@link NodeStore}, an {@link EdgeStore} and a {@link PropertyStore}.
 *
 * <p>The facade owns the structural contracts the stores do not enforce on their own:</p>
 * <ul>
 * <li>Edge endpoints are always registered nodes: {@link #addEdge} registers both first.</li>
 * <li>{@link #delEdge} removes the edge weight before the adjacency entry.</li>
 * <li>{@link #delNode} deletes every incident in- and out-edge (through {@link #delEdge})
 * before removing the node.</li>
 * </ul>
 *
 * <p>One property key is designated as the weight key. Edge weights are ordinary edge
 * properties stored under it, and a configured default weight is installed as that key's
 * store-wide default.</p>
 *
 * <p>Not thread-safe. Mutating a graph while a search or iteration over it is running has
 * undefined results.</p>
 *
 * @param <N> node type; needs {@code equals}/{@code hashCode}, and a natural order only for
 * sorted serialization.
 */
@Slf4j
public final class Graph<N> {
    public static final String DEFAULT_WEIGHT_KEY = "weight";

    private final NodeStore<N> nodeStore;
    private final EdgeStore<N> edgeStore;
    @Getter
    @Accessors(fluent = true)
    private final PropertyStore<N> propertyStore;
    @Getter
    @Accessors(fluent = true)
    private final String weightKey;

    /**
     * Creates an empty graph on a combined adjacency store with weight key {@value #DEFAULT_WEIGHT_KEY}.
     */
    public Graph() {
        this(null, null, null, null, null);
    }

    /**
     * Creates a graph over the given stores.
     *
     * <p>When neither node nor edge store is given, one {@link MapSetNodeEdgeStore} plays both
     * roles. A given {@link NodeEdgeStore} without an edge store also plays both roles.</p>
     *
     * @param nodeStore optional node store.
     * @param edgeStore optional edge store.
     * @param propertyStore optional property store (defaults to {@link MapPropertyStore}).
     * @param weightKey optional weight property key (defaults to {@value #DEFAULT_WEIGHT_KEY}).
     * @param defaultWeight optional weight returned for edges without one.
     */
    @Builder
    public Graph(
            NodeStore<N> nodeStore,
            EdgeStore<N> edgeStore,
            PropertyStore<N> propertyStore,
            String weightKey,
            Object defaultWeight
    ) {
        if (nodeStore == null && edgeStore == null) {
            MapSetNodeEdgeStore<N> combined = new MapSetNodeEdgeStore<>();
            this.nodeStore = combined;
            this.edgeStore = combined;
        } else if (nodeStore == null) {
            this.nodeStore = edgeStore instanceof NodeEdgeStore<N> combined
                    ? combined
                    : new SetNodeStore<>();
            this.edgeStore = edgeStore;
        } else {
            this.nodeStore = nodeStore;
            if (edgeStore != null) {
                this.edgeStore = edgeStore;
            } else if (nodeStore instanceof NodeEdgeStore<N> combined) {
                this.edgeStore = combined;
            } else {
                this.edgeStore = new MapSetEdgeStore<>();
            }
        }
        this.propertyStore = propertyStore == null ? new MapPropertyStore<>() : propertyStore;
        this.weightKey = weightKey == null ? DEFAULT_WEIGHT_KEY : weightKey;
        if (defaultWeight != null) {
            this.propertyStore.setPropertyDefault(this.weightKey, defaultWeight);
        }
    }

    // Construction and serialization

    /**
     * Builds a graph from node and edge items.
     *
     * <p>Each item is {@code [node]}, {@code [node, null]} (an isolated node) or
     * {@code [from, to]} (an edge).</p>
     *
     * @throws ConstructionException for an item of any other shape.
     */
    public static <N> Graph<N> fromNodesEdges(Iterable<? extends List<? extends N>> items) {
        Graph<N> graph = new Graph<>();
        for (List<? extends N> item : items) {
            int arity = item == null ? 0 : item.size();
            if (arity == 1 || (arity == 2 && item.get(1) == null)) {
                graph.addNode(item.get(0));
            } else if (arity == 2) {
                graph.addEdge(item.get(0), item.get(1));
            } else {
                throw new ConstructionException("not interpretable as a node or edge: " + item);
            }
        }
        return graph;
    }

    /**
     * Like {@link #fromNodesEdges}, additionally accepting weighted edges {@code [from, to, weight]}
     * as produced by {@link #toNodesEdgesWeights}. A {@code null} weight leaves the edge unweighted.
     *
     * @throws ConstructionException for an item of any other shape.
     */
    @SuppressWarnings("unchecked")
    public static <N> Graph<N> fromNodesEdgesWeights(Iterable<? extends List<?>> items) {
        Graph<N> graph = new Graph<>();
        for (List<?> item : items) {
            int arity = item == null ? 0 : item.size();
            if (arity == 1 || (arity == 2 && item.get(1) == null)) {
                graph.addNode((N) item.get(0));
            } else if (arity == 2 || arity == 3) {
                Object weight = arity == 3 ? item.get(2) : null;
                graph.addEdge((N) item.get(0), (N) item.get(1), weight);
            } else {
                throw new ConstructionException("not interpretable as a node or weighted edge: " + item);
            }
        }
        return graph;
    }

    /**
     * Returns all nodes as {@code [node]} items followed by all edges as {@code [from, to]} items.
     *
     * <p>The result is lazy and restartable. With {@code sort}, nodes and edges are each sorted
     * by natural order, which fails with {@link ClassCastException} for non-comparable nodes.</p>
     */
    public Iterable<List<N>> toNodesEdges(boolean sort) {
        return () -> Stream.concat(
                nodeStream(sort).map(node -> List.of(node)),
                edgeStream(sort).map(Edge::toList)
        ).iterator();
    }

    public Iterable<List<N>> toNodesEdges() {
        return toNodesEdges(false);
    }

    /**
     * Returns all nodes as {@code [node]} items followed by all edges as {@code [from, to, weight]} items.
     *
     * @see #toNodesEdges(boolean)
     */
    public Iterable<List<Object>> toNodesEdgesWeights(boolean sort) {
        return () -> Stream.concat(
                nodeStream(sort).map(node -> List.<Object>of(node)),
                edgeStream(sort).map(edge -> Collections.unmodifiableList(
                        Arrays.<Object>asList(edge.from(), edge.to(), weight(edge.from(), edge.to()))))
        ).iterator();
    }

    public Iterable<List<Object>> toNodesEdgesWeights() {
        return toNodesEdgesWeights(false);
    }

    private Stream<N> nodeStream(boolean sort) {
        Stream<N> nodes = StreamSupport.stream(nodes().spliterator(), false);
        return sort ? nodes.sorted(Edge::<N>compareNatural) : nodes;
    }

    private Stream<Edge<N>> edgeStream(boolean sort) {
        Stream<Edge<N>> edges = StreamSupport.stream(edges().spliterator(), false);
        return sort ? edges.sorted(Edge.naturalOrder()) : edges;
    }

    // Read-only queries

    public boolean hasNode(N node) {
        return nodeStore.hasNode(node);
    }

    public boolean hasEdge(N from, N to) {
        return edgeStore.hasEdge(from, to);
    }

    /**
     * Returns whether consecutive nodes of {@code nodes} are joined by edges.
     *
     * <p>The empty sequence is a path of every graph; a single node is a path when it is
     * registered. With {@code closed}, an edge from the last node back to the first is
     * also required.</p>
     */
    public boolean hasPath(Iterable<N> nodes, boolean closed) {
        Iterator<N> iterator = nodes.iterator();
        if (!iterator.hasNext()) {
            return true;
        }
        N first = iterator.next();
        if (!hasNode(first)) {
            return false;
        }
        N previous = first;
        while (iterator.hasNext()) {
            N next = iterator.next();
            if (!hasEdge(previous, next)) {
                return false;
            }
            previous = next;
        }
        return !closed || hasEdge(previous, first);
    }

    public boolean hasPath(Iterable<N> nodes) {
        return hasPath(nodes, false);
    }

    public boolean hasCycle(Iterable<N> nodes) {
        return hasPath(nodes, true);
    }

    public int nNodes() {
        return nodeStore.nNodes();
    }

    public int nEdges() {
        return edgeStore.nEdges();
    }

    public Iterable<N> nodes() {
        return nodeStore.nodes();
    }

    public Iterable<Edge<N>> edges() {
        return edgeStore.edges();
    }

    public Iterable<N> outNeighbors(N node) {
        return edgeStore.outNeighbors(node);
    }

    /**
     * Returns the sources of edges entering {@code node}; O(total adjacency) on forward-only stores.
     */
    public Iterable<N> inNeighbors(N node) {
        return edgeStore.inNeighbors(node);
    }

    public int outDegree(N node) {
        return edgeStore.outDegree(node);
    }

    public int inDegree(N node) {
        return edgeStore.inDegree(node);
    }

    // Weights

    /**
     * Returns whether a weight is set specifically on the edge; the default weight does not count.
     */
    public boolean hasWeight(N from, N to) {
        return propertyStore.hasProperty(weightKey, List.of(from, to));
    }

    /**
     * Returns the edge weight, else the default weight, else {@code valueIfAbsent}.
     */
    public Object weight(N from, N to, Object valueIfAbsent) {
        return edgeProperty(weightKey, from, to, valueIfAbsent);
    }

    public Object weight(N from, N to) {
        return weight(from, to, null);
    }

    public Iterable<WeightedEdge<N>> edgesWeights() {
        return () -> StreamSupport.stream(edges().spliterator(), false)
                .map(edge -> new WeightedEdge<>(edge.from(), edge.to(), weight(edge.from(), edge.to())))
                .iterator();
    }

    public Iterable<WeightedEdge<N>> outNeighborsWeights(N node) {
        return () -> StreamSupport.stream(outNeighbors(node).spliterator(), false)
                .map(neighbor -> new WeightedEdge<>(node, neighbor, weight(node, neighbor)))
                .iterator();
    }

    public Iterable<WeightedEdge<N>> inNeighborsWeights(N node) {
        return () -> StreamSupport.stream(inNeighbors(node).spliterator(), false)
                .map(neighbor -> new WeightedEdge<>(neighbor, node, weight(neighbor, node)))
                .iterator();
    }

    // Properties

    public boolean hasProperty(String key, List<N> nodes) {
        return propertyStore.hasProperty(key, nodes);
    }

    /**
     * Returns the value of {@code key} on the node tuple, else the key default, else {@code valueIfAbsent}.
     */
    public Object property(String key, List<N> nodes, Object valueIfAbsent) {
        return propertyStore.getProperty(key, nodes, valueIfAbsent);
    }

    public void setProperty(String key, Object value, List<N> nodes) {
        propertyStore.setProperty(key, value, nodes);
    }

    public void delProperty(String key, List<N> nodes) {
        propertyStore.delProperty(key, nodes);
    }

    public boolean hasNodeProperty(String key, N node) {
        return hasProperty(key, List.of(node));
    }

    public Object nodeProperty(String key, N node, Object valueIfAbsent) {
        return property(key, List.of(node), valueIfAbsent);
    }

    public void setNodeProperty(String key, Object value, N node) {
        setProperty(key, value, List.of(node));
    }

    public boolean hasEdgeProperty(String key, N from, N to) {
        return hasProperty(key, List.of(from, to));
    }

    public Object edgeProperty(String key, N from, N to, Object valueIfAbsent) {
        return property(key, List.of(from, to), valueIfAbsent);
    }

    public void setEdgeProperty(String key, Object value, N from, N to) {
        setProperty(key, value, List.of(from, to));
    }

    // Mutations

    /**
     * Registers {@code node}; no-op if already present.
     */
    public void addNode(N node) {
        nodeStore.addNode(node);
    }

    public void addNodes(Iterable<N> nodes) {
        for (N node : nodes) {
            addNode(node);
        }
    }

    /**
     * Registers both endpoints and inserts the edge. An existing weight is left untouched.
     */
    public void addEdge(N from, N to) {
        nodeStore.addNode(from);
        nodeStore.addNode(to);
        edgeStore.addEdge(from, to);
    }

    /**
     * Registers both endpoints, inserts the edge and, if {@code weight} is non-null, sets its weight.
     */
    public void addEdge(N from, N to, Object weight) {
        addEdge(from, to);
        if (weight != null) {
            setWeight(from, to, weight);
        }
    }

    public void addEdges(Iterable<Edge<N>> edges) {
        for (Edge<N> edge : edges) {
            addEdge(edge.from(), edge.to());
        }
    }

    /**
     * Adds an edge between each pair of consecutive nodes, plus one from the last node back
     * to the first when {@code closed}. A single node is just registered.
     */
    public void addPath(Iterable<N> nodes, boolean closed) {
        Iterator<N> iterator = nodes.iterator();
        if (!iterator.hasNext()) {
            return;
        }
        N first = iterator.next();
        addNode(first);
        N previous = first;
        while (iterator.hasNext()) {
            N next = iterator.next();
            addEdge(previous, next);
            previous = next;
        }
        if (closed) {
            addEdge(previous, first);
        }
    }

    public void addPath(Iterable<N> nodes) {
        addPath(nodes, false);
    }

    /**
     * Sets the edge weight, adding the edge (and its endpoints) first if missing.
     */
    public void setWeight(N from, N to, Object weight) {
        if (!hasEdge(from, to)) {
            addEdge(from, to);
        }
        setEdgeProperty(weightKey, weight, from, to);
    }

    /**
     * Removes the specific weight of the edge; no-op if none is set.
     */
    public void delWeight(N from, N to) {
        delProperty(weightKey, List.of(from, to));
    }

    /**
     * Deletes every edge entering or leaving {@code node}, then the node itself.
     *
     * @throws NotFoundException if the node does not exist.
     */
    public void delNode(N node) {
        if (!hasNode(node)) {
            throw new NotFoundException("node not found: " + node);
        }
        List<N> parents = snapshot(inNeighbors(node));
        for (N parent : parents) {
            delEdge(parent, node);
        }
        // Recomputed after the in-edges are gone so a self-loop is not deleted twice
        List<N> children = snapshot(outNeighbors(node));
        for (N child : children) {
            delEdge(node, child);
        }
        nodeStore.delNode(node);
        log.debug("Deleted node {} with {} in-edges and {} out-edges", node, parents.size(), children.size());
    }

    public void delNodes(Iterable<N> nodes) {
        for (N node : nodes) {
            delNode(node);
        }
    }

    /**
     * Deletes the edge weight, if any, then the edge. A missing edge leaves the graph unchanged.
     *
     * @throws NotFoundException if the edge does not exist.
     */
    public void delEdge(N from, N to) {
        if (!hasEdge(from, to)) {
            throw new NotFoundException("edge not found: " + from + " -> " + to);
        }
        if (hasWeight(from, to)) {
            delWeight(from, to);
        }
        edgeStore.delEdge(from, to);
    }

    public void delEdges(Iterable<Edge<N>> edges) {
        for (Edge<N> edge : edges) {
            delEdge(edge.from(), edge.to());
        }
    }

    private static <N> List<N> snapshot(Iterable<N> nodes) {
        List<N> copy = new ArrayList<>();
        nodes.forEach(copy::add);
        return copy;
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nNodes() + ", edges=" + nEdges() + ", weightKey=" + weightKey + '}';
    }
}
