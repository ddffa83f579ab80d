package com.entity.consolidation.similarity;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LevenshteinDistance.
 */
class LevenshteinDistanceTest {

    @ParameterizedTest
    @CsvSource({
            "kitten, sitting, 3",
            "flaw, lawn, 2",
            "epstein, epstien, 2",
            "maxwell, maxwel, 1",
            "abc, abc, 0",
            "'', abc, 3"
    })
    void computesEditDistance(String a, String b, int expected) {
        assertEquals(expected, LevenshteinDistance.compute(a, b));
        assertEquals(expected, LevenshteinDistance.compute(b, a));
    }

    @Test
    void nullIsEmptyString() {
        assertEquals(4, LevenshteinDistance.compute(null, "test"));
        assertEquals(0, LevenshteinDistance.compute(null, null));
    }
}
