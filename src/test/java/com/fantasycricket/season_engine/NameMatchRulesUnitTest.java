package com.fantasycricket.season_engine;

import com.fantasycricket.season_engine.service.LevenshteinSimilarity;
import com.fantasycricket.season_engine.service.NameMatchRules;
import com.fantasycricket.season_engine.service.NameNormalizer;
import com.fantasycricket.util.TestFixtures;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Each name-matching rule on its own, then combined through evaluate().
 */
class NameMatchRulesUnitTest {

    private NameMatchRules rules;

    @BeforeEach
    void setUp() {
        rules = TestFixtures.defaultMatchRules();
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("stripsPunctuation_lowercases_andJoinsTokens")
        void stripsPunctuation_lowercases_andJoinsTokens() {
            assertEquals("jdevries", NameNormalizer.normalize("J. de Vries"));
            assertEquals("ryantendoeschate", NameNormalizer.normalize("Ryan ten-Doeschate"));
            assertEquals(List.of("s", "oneil"), NameNormalizer.tokens("  S.  O'Neil "));
        }

        @Test
        @DisplayName("punctuationWithoutSpace_stillSeparatesTokens")
        void punctuationWithoutSpace_stillSeparatesTokens() {
            assertEquals(List.of("j", "de", "vries"), NameNormalizer.tokens("J.de Vries"));
            assertEquals(NameNormalizer.tokens("J. de Vries"), NameNormalizer.tokens("J.de Vries"));
            assertEquals(List.of("ryan", "ten", "doeschate"), NameNormalizer.tokens("Ryan ten-Doeschate"));
        }

        @Test
        @DisplayName("keepsAccentedLetters")
        void keepsAccentedLetters() {
            assertEquals("renéclaassen", NameNormalizer.normalize("René Claassen"));
        }

        @Test
        @DisplayName("nullOrPunctuationOnly_isEmpty")
        void nullOrPunctuationOnly_isEmpty() {
            assertEquals("", NameNormalizer.normalize(null));
            assertEquals("", NameNormalizer.normalize(" .- "));
        }
    }

    @Nested
    @DisplayName("Similarity threshold")
    class Threshold {

        @Test
        @DisplayName("levenshteinRatio_isOneMinusDistanceOverLongerLength")
        void levenshteinRatio_isOneMinusDistanceOverLongerLength() {
            LevenshteinSimilarity similarity = new LevenshteinSimilarity();

            assertEquals(1.0, similarity.ratio("", ""), 1e-9);
            assertEquals(1.0, similarity.ratio("jandevries", "jandevries"), 1e-9);
            assertEquals(1.0 - 1.0 / 11, similarity.ratio("jandevries", "jandevriess"), 1e-9);
            assertEquals(0.0, similarity.ratio("abc", "xyz"), 1e-9);
        }

        @Test
        @DisplayName("accepts_atOrAboveThreshold_only")
        void accepts_atOrAboveThreshold_only() {
            assertTrue(rules.meetsThreshold(0.85));
            assertTrue(rules.meetsThreshold(0.91));
            assertFalse(rules.meetsThreshold(0.849));
        }

        @Test
        @DisplayName("oneTypo_inLongName_matches")
        void oneTypo_inLongName_matches() {
            assertTrue(rules.evaluate("Jan de Vriess", "Jan de Vries").isPresent());
        }

        @Test
        @DisplayName("rejectsThreshold_outOfRange")
        void rejectsThreshold_outOfRange() {
            assertThrows(IllegalStateException.class,
                    () -> new NameMatchRules(new LevenshteinSimilarity(), 0.0, 3, 3));
            assertThrows(IllegalStateException.class,
                    () -> new NameMatchRules(new LevenshteinSimilarity(), 1.2, 3, 3));
        }
    }

    @Nested
    @DisplayName("Containment")
    class Containment {

        @Test
        @DisplayName("surnameOnly_isContainedInFullName")
        void surnameOnly_isContainedInFullName() {
            assertTrue(rules.isContainment("vries", "jandevries"));
            assertTrue(rules.evaluate("Vries", "Jan de Vries").isPresent());
        }

        @Test
        @DisplayName("tooShortFragment_isNotContainment")
        void tooShortFragment_isNotContainment() {
            assertFalse(rules.isContainment("de", "jandevries"));
            assertTrue(rules.evaluate("de", "Jan de Vries").isEmpty());
        }
    }

    @Nested
    @DisplayName("Positional abbreviation")
    class Abbreviation {

        @Test
        @DisplayName("initial_plusMatchingSurname_matches")
        void initial_plusMatchingSurname_matches() {
            assertTrue(rules.isPositionalAbbreviation(
                    NameNormalizer.tokens("J. de Vries"), NameNormalizer.tokens("Jan de Vries")));
            assertTrue(rules.evaluate("M. Singh", "Manpreet Singh").isPresent());
        }

        @Test
        @DisplayName("differentInitials_doNotMatch")
        void differentInitials_doNotMatch() {
            assertTrue(rules.evaluate("A. Khan", "B. Khan").isEmpty());
        }

        @Test
        @DisplayName("initialsOnly_withoutFullTokenAgreement_doNotMatch")
        void initialsOnly_withoutFullTokenAgreement_doNotMatch() {
            assertFalse(rules.isPositionalAbbreviation(
                    NameNormalizer.tokens("J. D."), NameNormalizer.tokens("Jan Dirk")));
        }

        @Test
        @DisplayName("differentTokenCounts_doNotMatch")
        void differentTokenCounts_doNotMatch() {
            assertFalse(rules.isPositionalAbbreviation(
                    NameNormalizer.tokens("J. Vries"), NameNormalizer.tokens("Jan de Vries")));
        }

        @Test
        @DisplayName("mismatchedMiddleToken_doesNotMatch")
        void mismatchedMiddleToken_doesNotMatch() {
            assertTrue(rules.evaluate("J. de Vries", "Jan van Vries").isEmpty());
        }
    }
}
