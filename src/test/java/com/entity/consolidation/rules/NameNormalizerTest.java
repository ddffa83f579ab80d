package com.entity.consolidation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameNormalizer Tests")
class NameNormalizerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "Jeffrey  Epstein!|jeffrey epstein",
                "  JEFFREY EPSTEIN  |jeffrey epstein",
                "Epstein, Jeffrey E.|epstein jeffrey e",
                "O'Brien|obrien",
                "Jean-Luc Brunel|jeanluc brunel",
                "Bill\tClinton|bill clinton"
        })
        void normalizesRawNames(String raw, String expected) {
            assertEquals(expected, NameNormalizer.normalize(raw));
        }

        @Test
        void nullAndBlankYieldEmpty() {
            assertEquals("", NameNormalizer.normalize(null));
            assertEquals("", NameNormalizer.normalize("   "));
            assertEquals("", NameNormalizer.normalize("!!!"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"\u00A0", "\u2003", "\u2009", "\u202F", "\u3000", "\uFEFF", "\t"})
        void unicodeWhitespaceSeparatesTokens(String space) {
            assertEquals("jeffrey epstein", NameNormalizer.normalize("Jeffrey" + space + "Epstein"));
            assertEquals("jeffrey epstein", NameNormalizer.normalize(space + "Jeffrey " + space + " Epstein" + space));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Jeffrey  Epstein!", "a . b", " - x - ", "Dr. J. R. R. Tolkien", " Ghislaine Maxwell"})
        void isIdempotent(String raw) {
            String once = NameNormalizer.normalize(raw);
            assertEquals(once, NameNormalizer.normalize(once));
        }

        @Test
        void punctuationBetweenSpacesCollapses() {
            assertEquals("a b", NameNormalizer.normalize("a . b"));
        }
    }

    @Nested
    @DisplayName("tokens and reordering")
    class Tokens {

        @Test
        void tokensSplitNormalizedName() {
            assertEquals(List.of("ghislaine", "maxwell"), NameNormalizer.tokens("Ghislaine  MAXWELL"));
            assertTrue(NameNormalizer.tokens("").isEmpty());
        }

        @Test
        void tokenSortKeyIgnoresOrder() {
            assertEquals("epstein jeffrey", NameNormalizer.tokenSortKey("Jeffrey Epstein"));
            assertEquals("epstein jeffrey", NameNormalizer.tokenSortKey("Epstein, Jeffrey"));
        }

        @Test
        void detectsReordering() {
            assertTrue(NameNormalizer.isReordering("Jeffrey Epstein", "Epstein Jeffrey"));
            assertTrue(NameNormalizer.isReordering("Jeffrey Epstein", "jeffrey epstein"));
        }

        @Test
        void singleTokenNamesAreNeverReorderings() {
            assertFalse(NameNormalizer.isReordering("Epstein", "epstein"));
        }

        @Test
        void differentTokensAreNotReorderings() {
            assertFalse(NameNormalizer.isReordering("Jeffrey Epstein", "Mark Epstein"));
            assertFalse(NameNormalizer.isReordering("Jeffrey Epstein", "Jeffrey E Epstein"));
        }
    }
}
