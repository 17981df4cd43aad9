package org.digraph.search;

import org.digraph.core.GraphException;

/**
 * Deterministic failure of a numeric search guardrail: an edge distance the search cannot use.
 */
public final class SearchGuardrailException extends GraphException {
    public static final String REASON_INVALID_DISTANCE = "SEARCH_INVALID_DISTANCE";
    public static final String REASON_NON_NUMERIC_WEIGHT = "SEARCH_NON_NUMERIC_WEIGHT";

    public SearchGuardrailException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
