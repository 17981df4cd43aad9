package org.digraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class CoreTypesTest {

    @Test
    @DisplayName("Present null differs from absent")
    void testPropertyValuePresence() {
        PropertyValue<String> nullValue = PropertyValue.of(null);
        PropertyValue<String> absent = PropertyValue.absent();

        assertTrue(nullValue.isPresent());
        assertNull(nullValue.get());
        assertNull(nullValue.orElse("fallback"));
        assertFalse(absent.isPresent());
        assertEquals("fallback", absent.orElse("fallback"));
        assertThrows(NoSuchElementException.class, absent::get);
        assertNotEquals(nullValue, absent);
        assertEquals(PropertyValue.of("x"), absent.or(PropertyValue.of("x")));
        assertSame(nullValue, nullValue.or(PropertyValue.of("x")));
    }

    @Test
    @DisplayName("Edge tuple, reversal and natural order")
    void testEdge() {
        Edge<String> edge = Edge.of("A", "B");
        assertEquals(List.of("A", "B"), edge.toList());
        assertEquals(Edge.of("B", "A"), edge.reversed());
        assertThrows(NullPointerException.class, () -> Edge.of("A", null));

        List<Edge<String>> edges = new ArrayList<>(List.of(Edge.of("B", "A"), Edge.of("A", "C"), Edge.of("A", "B")));
        edges.sort(Edge.naturalOrder());
        assertEquals(List.of(Edge.of("A", "B"), Edge.of("A", "C"), Edge.of("B", "A")), edges);
        assertEquals(edge, new WeightedEdge<>("A", "B", 3).edge());

        assertTrue(Edge.compareNatural(1, 2) < 0);
        assertEquals(0, Edge.compareNatural("A", "A"));
        List<Edge<Integer>> numbered = new ArrayList<>(List.of(Edge.of(10, 2), Edge.of(9, 30), Edge.of(10, 1)));
        numbered.sort(Edge.naturalOrder());
        assertEquals(List.of(Edge.of(9, 30), Edge.of(10, 1), Edge.of(10, 2)), numbered);
    }

    @Test
    @DisplayName("Exception messages carry the reason code")
    void testReasonCodes() {
        GraphException ex = new GraphException("CUSTOM", "details");
        assertEquals("CUSTOM", ex.reasonCode());
        assertEquals("[CUSTOM] details", ex.getMessage());

        IllegalStateException cause = new IllegalStateException("boom");
        assertSame(cause, new GraphException("CUSTOM", "wrapped", cause).getCause());
        assertThrows(IllegalArgumentException.class, () -> new GraphException(" ", "details"));
        assertEquals(ConstructionException.REASON_MALFORMED_ITEM, new ConstructionException("bad").reasonCode());
    }
}
