package com.entity.consolidation.merge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the redirect forest.
 */
class DisjointSetTest {

    @Test
    void unknownIdIsItsOwnRoot() {
        DisjointSet set = new DisjointSet();
        assertEquals(42, set.find(42));
        assertFalse(set.isRedirected(42));
    }

    @Test
    void findFollowsChainAndCompressesPath() {
        DisjointSet set = new DisjointSet();
        set.attach(3, 4);
        set.attach(2, 3);
        set.attach(1, 2);

        assertEquals(4, set.find(1));
        // after compression every node points straight at the root
        set.attach(4, 5);
        assertEquals(5, set.find(1));
        assertEquals(5, set.find(2));
    }

    @Test
    void attachingTwiceIsRejected() {
        DisjointSet set = new DisjointSet();
        set.attach(1, 2);
        assertThrows(IllegalStateException.class, () -> set.attach(1, 3));
        assertThrows(IllegalArgumentException.class, () -> set.attach(7, 7));
    }
}
