package org.digraph.core;

/**
 * Thrown when deleting (or strictly reading) a node, edge or property default that does not exist.
 *
 * <p>Adds are idempotent and never raise this.</p>
 */
public final class NotFoundException extends GraphException {
    public static final String REASON_NOT_FOUND = "GRAPH_NOT_FOUND";

    public NotFoundException(String message) {
        super(REASON_NOT_FOUND, message);
    }
}
