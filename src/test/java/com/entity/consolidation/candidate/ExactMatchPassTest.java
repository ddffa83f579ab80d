package com.entity.consolidation.candidate;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.MatchMethod;
import com.entity.consolidation.core.model.MergeCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.entity.consolidation.candidate.TestEntities.person;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExactMatchPass.
 */
class ExactMatchPassTest {

    private List<MergeCandidate> run(List<Entity> entities) {
        CandidateCollector collector = new CandidateCollector();
        new ExactMatchPass().findCandidates(entities, collector);
        return collector.getCandidates();
    }

    @Test
    void groupsCaseAndPunctuationVariantsOntoMostMentionedEntity() {
        List<MergeCandidate> candidates = run(List.of(
                person(1, "Jeffrey Epstein", 5),
                person(2, "JEFFREY EPSTEIN", 12),
                person(3, "jeffrey  epstein!", 5)));

        assertEquals(2, candidates.size());
        for (MergeCandidate c : candidates) {
            assertEquals(2, c.targetId());
            assertEquals(100.0, c.confidence());
            assertEquals(MatchMethod.EXACT_MATCH, c.method());
            assertEquals("Exact match (case-insensitive)", c.reason());
        }
        assertEquals(List.of(1L, 3L), candidates.stream().map(MergeCandidate::sourceId).toList());
    }

    @Test
    void skipsNamesShorterThanThreeCharacters() {
        assertTrue(run(List.of(person(1, "Al", 1), person(2, "AL", 2))).isEmpty());
    }

    @Test
    void distinctNamesProduceNothing() {
        assertTrue(run(List.of(person(1, "Jeffrey Epstein", 1), person(2, "Ghislaine Maxwell", 1))).isEmpty());
    }
}
