package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.core.model.MergeCandidate;
import org.junit.jupiter.api.Test;

import static com.entity.consolidation.candidate.TestEntities.person;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CandidateCollector orientation and deduplication.
 */
class CandidateCollectorTest {

    private final CandidateCollector collector = new CandidateCollector();

    @Test
    void entityWithMoreMentionsBecomesTarget() {
        Entity low = person(1, "Jeffrey Epstein", 3);
        Entity high = person(2, "jeffrey epstein", 40);

        assertTrue(collector.offer(high, low, MatchMethod.EXACT_MATCH, "test"));

        MergeCandidate c = collector.getCandidates().get(0);
        assertEquals(1, c.sourceId());
        assertEquals(2, c.targetId());
        assertEquals(3, c.sourceMentions());
        assertEquals(40, c.targetMentions());
        assertEquals(100.0, c.confidence());
    }

    @Test
    void tieOnMentionsKeepsLowestIdAsTarget() {
        Entity first = person(7, "Jeffrey Epstein", 5);
        Entity second = person(3, "jeffrey epstein", 5);

        collector.offer(first, second, MatchMethod.EXACT_MATCH, "test");

        MergeCandidate c = collector.getCandidates().get(0);
        assertEquals(3, c.targetId());
        assertEquals(7, c.sourceId());
    }

    @Test
    void samePairIsCollectedOnceAcrossMethods() {
        Entity a = person(1, "Jeffrey Epstein", 1);
        Entity b = person(2, "Epstein Jeffrey", 9);

        assertTrue(collector.offer(a, b, MatchMethod.EXACT_MATCH, "first"));
        assertFalse(collector.offer(b, a, MatchMethod.NAME_REORDERING, "second"));

        assertEquals(1, collector.size());
        assertEquals(MatchMethod.EXACT_MATCH, collector.getCandidates().get(0).method());
    }

    @Test
    void selfPairIsRejected() {
        Entity a = person(1, "Jeffrey Epstein", 1);

        assertFalse(collector.offer(a, a, MatchMethod.EXACT_MATCH, "self"));
        assertEquals(0, collector.size());
    }

    @Test
    void typoConfidenceUsesEditDistance() {
        collector.offer(person(1, "a", 1), person(2, "b", 2), MatchMethod.TYPO_CORRECTION, 2, "typo");

        MergeCandidate c = collector.getCandidates().get(0);
        assertEquals(95.0, c.confidence());
        assertEquals(2, c.editDistance());
    }

    @Test
    void candidatesViewIsUnmodifiable() {
        collector.offer(person(1, "a", 1), person(2, "b", 2), MatchMethod.EXACT_MATCH, "x");

        assertThrows(UnsupportedOperationException.class, () -> collector.getCandidates().clear());
    }

    @Test
    void directedOfferKeepsGivenTarget() {
        Entity canonical = person(1, "Acme Corporation", 2);
        Entity variant = person(2, "ACME", 90);

        assertTrue(collector.offerDirected(variant, canonical, MatchMethod.KNOWN_ALIAS, 0, "alias"));
        assertFalse(collector.offer(canonical, variant, MatchMethod.EXACT_MATCH, "reversed"));

        assertEquals(1, collector.size());
        MergeCandidate c = collector.getCandidates().get(0);
        assertEquals(2, c.sourceId());
        assertEquals(1, c.targetId());
        assertEquals(MatchMethod.KNOWN_ALIAS, c.method());
    }
}
