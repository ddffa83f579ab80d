package com.entity.consolidation.merge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MergeResult and MergeError.
 */
class MergeResultTest {

    @Test
    void successCarriesValue() {
        MergeResult<String> result = MergeResult.success("done");

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("done", result.value());
        assertNull(result.error());
    }

    @Test
    void failureCarriesError() {
        MergeResult<String> result = MergeResult.failure(MergeError.notFound("Entity 9 no longer exists"));

        assertTrue(result.isFailure());
        assertEquals(MergeError.Kind.NOT_FOUND, result.error().kind());
        assertNull(result.value());
    }

    @Test
    void valueAndErrorAreExclusive() {
        assertThrows(IllegalArgumentException.class,
                () -> new MergeResult<>("x", MergeError.other("E", "boom")));
        assertThrows(IllegalArgumentException.class, () -> new MergeResult<String>(null, null));
    }
}
