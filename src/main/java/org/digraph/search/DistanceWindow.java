package org.digraph.search;

/**
 * Acceptance window applied to the distance of every entry popped from the search frontier.
 *
 * <ul>
 * <li>{@link #TOO_SHORT}: keep searching; the node is settled but is not a valid goal.</li>
 * <li>{@link #ACCEPTABLE}: the node is a valid goal if it is an end node.</li>
 * <li>{@link #TOO_LONG}: stop the whole search with no result. Frontier distances never
 * decrease, so nothing acceptable can follow.</li>
 * </ul>
 *
 * <p>Negative and positive return values other than -1 and 1 are read as too short and too long.</p>
 */
@FunctionalInterface
public interface DistanceWindow {
    int TOO_SHORT = -1;
    int ACCEPTABLE = 0;
    int TOO_LONG = 1;

    int evaluate(double distance);

    static DistanceWindow any() {
        return distance -> ACCEPTABLE;
    }

    /**
     * Accepts distances {@code >= min}.
     */
    static DistanceWindow atLeast(double min) {
        return distance -> distance < min ? TOO_SHORT : ACCEPTABLE;
    }

    /**
     * Accepts distances {@code <= max}; anything longer ends the search.
     */
    static DistanceWindow atMost(double max) {
        return distance -> distance > max ? TOO_LONG : ACCEPTABLE;
    }

    /**
     * Accepts distances in {@code [min, max]}.
     *
     * @throws IllegalArgumentException if {@code min > max}.
     */
    static DistanceWindow between(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max, got " + min + " > " + max);
        }
        return distance -> {
            if (distance < min) {
                return TOO_SHORT;
            }
            return distance > max ? TOO_LONG : ACCEPTABLE;
        };
    }
}
