package org.digraph.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DistanceWindowTest {

    @ParameterizedTest
    @CsvSource({
            "9.99, -1",
            "10, 0",
            "15, 0",
            "20, 0",
            "20.01, 1"
    })
    void testBetween(double distance, int expected) {
        assertEquals(expected, DistanceWindow.between(10, 20).evaluate(distance));
    }

    @Test
    @DisplayName("One-sided windows")
    void testOneSided() {
        assertEquals(DistanceWindow.TOO_SHORT, DistanceWindow.atLeast(3).evaluate(2));
        assertEquals(DistanceWindow.ACCEPTABLE, DistanceWindow.atLeast(3).evaluate(3));
        assertEquals(DistanceWindow.ACCEPTABLE, DistanceWindow.atMost(3).evaluate(3));
        assertEquals(DistanceWindow.TOO_LONG, DistanceWindow.atMost(3).evaluate(3.5));
        assertEquals(DistanceWindow.ACCEPTABLE, DistanceWindow.any().evaluate(Double.MAX_VALUE));
    }

    @Test
    @DisplayName("Inverted range is rejected")
    void testInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> DistanceWindow.between(5, 4));
    }
}
