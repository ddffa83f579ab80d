package com.entity.consolidation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core model Tests")
class ModelTest {

    @Nested
    class EntityTypes {

        @ParameterizedTest
        @CsvSource({"Person, PERSON", "person, PERSON", "ORGANIZATION, ORGANIZATION", "Location, UNKNOWN", "'', UNKNOWN"})
        void fromLabel(String label, EntityType expected) {
            assertEquals(expected, EntityType.fromLabel(label));
        }

        @Test
        void nullIsUnknown() {
            assertEquals(EntityType.UNKNOWN, EntityType.fromLabel(null));
        }
    }

    @Nested
    class MatchMethods {

        @ParameterizedTest
        @CsvSource({"exact, EXACT_MATCH", "reordering, NAME_REORDERING", "typo, TYPO_CORRECTION",
                "fuzzy, TYPO_CORRECTION", "prefix, PREFIX_STRIPPING", "Nickname, NICKNAME_RESOLUTION",
                "exact_match, EXACT_MATCH", "known, KNOWN_ALIAS", "alias, KNOWN_ALIAS"})
        void fromPassName(String name, MatchMethod expected) {
            assertEquals(expected, MatchMethod.fromPassName(name));
        }

        @Test
        void unknownPassIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> MatchMethod.fromPassName("phonetic"));
        }
    }

    @Nested
    class Entities {

        @Test
        void normalizedNameIsDerived() {
            Entity entity = Entity.builder().id(1).fullName("  Jeffrey  EPSTEIN. ").build();

            assertEquals("jeffrey epstein", entity.getNormalizedName());
            assertEquals(EntityType.UNKNOWN, entity.getType());
        }

        @Test
        void aliasesSkipBlanksAndKeepOrder() {
            Entity entity = Entity.builder().id(1).fullName("x")
                    .aliases(List.of(" b ", "", "a"))
                    .alias(null)
                    .build();

            assertEquals(List.of("b", "a"), List.copyOf(entity.getAliases()));
        }

        @Test
        void equalityById() {
            assertEquals(Entity.builder().id(1).fullName("a").build(), Entity.builder().id(1).fullName("b").build());
            assertThrows(NullPointerException.class, () -> Entity.builder().id(1).build());
        }
    }

    @Nested
    class Candidates {

        @Test
        void sourceAndTargetMustDiffer() {
            assertThrows(IllegalArgumentException.class, () -> new MergeCandidate(1, "a", 1, 1, "a", 1,
                    100, MatchMethod.EXACT_MATCH, 0, "x"));
        }

        @Test
        void withTargetKeepsScoring() {
            MergeCandidate c = new MergeCandidate(1, "a", 1, 2, "b", 5, 97.5, MatchMethod.TYPO_CORRECTION, 1, "typo");
            MergeCandidate moved = c.withTarget(3, "c", 9);

            assertEquals(3, moved.targetId());
            assertEquals("c", moved.targetName());
            assertEquals(9, moved.targetMentions());
            assertEquals(97.5, moved.confidence());
            assertEquals(1, moved.editDistance());
        }
    }
}
