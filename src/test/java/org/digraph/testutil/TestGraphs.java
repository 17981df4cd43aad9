package org.digraph.testutil;

import org.digraph.graph.Graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared graph fixtures for graph and search tests.
 *
 * <p>Nodes are single-letter strings. Edges are written as two-letter strings such as
 * {@code "UD"} and are always added in both directions with the same weight.</p>
 */
public final class TestGraphs {

    private TestGraphs() {
    }

    /**
     * <pre>
     *      1      1
     *   U------D------Y
     * 2 |    5 |    8 |
     *   |  1   |  2   |
     *   J------K------W
     * 9 |    6 |    1 |
     *   |  2   |  2   |
     *   S------M------P
     * </pre>
     */
    public static Map<String, Integer> gridSPath() {
        return distances(
                "UD", 1, "DY", 1,
                "UJ", 2, "DK", 5, "YW", 8,
                "JK", 1, "KW", 2,
                "JS", 9, "KM", 6, "WP", 1,
                "SM", 2, "MP", 2
        );
    }

    /**
     * <pre>
     *      18      8      5     19      7
     *    W------T------M------P------G------Y
     * 14 |    6 |   10 |   16 |    9 |   14 |
     *    |  1   |  5   | 13   | 16   | 14   |
     *    E------X------U------L------K------A
     * 20 |   11 |   15 |   10 |    1 |    6 |
     *    |  2   |  9   |  7   | 11   | 17   |
     *    Q------B------N------J------S------F
     *  2 |   14 |   12 |    7 |    3 |    6 |
     *    | 11   | 12   |  8   |  6   | 10   |
     *    H------V------Z------D------C------R
     * </pre>
     */
    public static Map<String, Integer> grid4x6() {
        return distances(
                "WT", 18, "TM", 8, "MP", 5, "PG", 19, "GY", 7,
                "WE", 14, "TX", 6, "MU", 10, "PL", 16, "GK", 9, "YA", 14,
                "EX", 1, "XU", 5, "UL", 13, "LK", 16, "KA", 14,
                "EQ", 20, "XB", 11, "UN", 15, "LJ", 10, "KS", 1, "AF", 6,
                "QB", 2, "BN", 9, "NJ", 7, "JS", 11, "SF", 17,
                "QH", 2, "BV", 14, "NZ", 12, "JD", 7, "SC", 3, "FR", 6,
                "HV", 11, "VZ", 12, "ZD", 8, "DC", 6, "CR", 10
        );
    }

    /**
     * Two 4-cliques-with-hub joined by the bridge {@code F-G-H-I}; unweighted.
     */
    public static List<String> barbell() {
        return List.of("AB", "AE", "AL", "BF", "BK", "EF", "EK", "FL", "KL",
                "FG", "GH", "HI",
                "CD", "CI", "CN", "DJ", "DM", "IJ", "IM", "JN", "MN");
    }

    /**
     * Chain {@code A..I} of unit edges, each node also joined directly to {@code K}
     * by a decreasing weight.
     */
    public static Map<String, Integer> decreasingPaths() {
        return distances(
                "AB", 1, "AK", 17, "BC", 1, "BK", 15, "CD", 1, "CK", 13,
                "DE", 1, "DK", 11, "EF", 1, "EK", 9, "FG", 1, "FK", 7,
                "GH", 1, "GK", 5, "HI", 1, "HK", 3, "IK", 1
        );
    }

    /**
     * Pascal's triangle; each edge weighs the binomial value of the lower node.
     */
    public static Map<String, Integer> pascalTriangle() {
        return distances(
                "AB", 1, "AC", 1,
                "BD", 1, "BE", 2, "CE", 2, "CF", 1,
                "DG", 1, "DH", 3, "EH", 3, "EI", 3, "FI", 3, "FJ", 1,
                "GK", 1, "GL", 4, "HL", 4, "HM", 6, "IM", 6, "IN", 4, "JN", 4, "JO", 1,
                "KP", 1, "KQ", 5, "LQ", 5, "LR", 10, "MR", 10,
                "MS", 10, "NS", 10, "NT", 5, "OT", 5, "OU", 1,
                "PV", 1, "PW", 6, "QW", 6, "QX", 15, "RX", 15, "RY", 20,
                "SY", 20, "SZ", 15, "TZ", 15, "Ta", 6, "Ua", 6, "Ub", 1
        );
    }

    /**
     * Builds a graph with default weight 1 where every listed pair is an edge in both directions.
     */
    public static Graph<String> undirected(Map<String, Integer> distances) {
        Graph<String> graph = Graph.<String>builder().defaultWeight(1).build();
        distances.forEach((pair, weight) -> {
            String a = pair.substring(0, 1);
            String b = pair.substring(1, 2);
            graph.addEdge(a, b, weight);
            graph.addEdge(b, a, weight);
        });
        return graph;
    }

    public static Graph<String> undirected(List<String> pairs) {
        Graph<String> graph = Graph.<String>builder().defaultWeight(1).build();
        for (String pair : pairs) {
            String a = pair.substring(0, 1);
            String b = pair.substring(1, 2);
            graph.addEdge(a, b);
            graph.addEdge(b, a);
        }
        return graph;
    }

    /**
     * Splits a string into single-letter nodes.
     */
    public static List<String> nodes(String letters) {
        List<String> nodes = new ArrayList<>(letters.length());
        for (char c : letters.toCharArray()) {
            nodes.add(String.valueOf(c));
        }
        return nodes;
    }

    private static Map<String, Integer> distances(Object... pairsAndWeights) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        for (int i = 0; i < pairsAndWeights.length; i += 2) {
            distances.put((String) pairsAndWeights[i], (Integer) pairsAndWeights[i + 1]);
        }
        return distances;
    }
}
