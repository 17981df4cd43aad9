package org.digraph.core;

/**
 * Thrown by bulk graph construction when an item is not interpretable as a node or an edge.
 */
public final class ConstructionException extends GraphException {
    public static final String REASON_MALFORMED_ITEM = "GRAPH_MALFORMED_ITEM";

    public ConstructionException(String message) {
        super(REASON_MALFORMED_ITEM, message);
    }
}
