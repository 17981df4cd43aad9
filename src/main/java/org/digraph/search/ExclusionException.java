package org.digraph.search;

import org.digraph.core.GraphException;

/**
 * Thrown before a search starts when exclusions remove every begin node or every end node.
 *
 * <p>This is a usage error, distinct from a search that simply finds no path.</p>
 */
public final class ExclusionException extends GraphException {
    public static final String REASON_ALL_BEGINS_EXCLUDED = "SEARCH_ALL_BEGINS_EXCLUDED";
    public static final String REASON_ALL_ENDS_EXCLUDED = "SEARCH_ALL_ENDS_EXCLUDED";

    public ExclusionException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
