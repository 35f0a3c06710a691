package com.sportsync.resolution.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameNormalizer")
class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer();

    @Nested
    @DisplayName("Player names")
    class PlayerNames {

        @ParameterizedTest
        @DisplayName("Should fold case, accents and punctuation")
        @CsvSource({
                "'LeBron James', 'lebron james'",
                "'Nikola Jokić', 'nikola jokic'",
                "'Luka Dončić', 'luka doncic'",
                "'P.J. Tucker', 'pj tucker'",
                "'Karl-Anthony Towns', 'karl anthony towns'",
                "'  Stephen   Curry ', 'stephen curry'"
        })
        void normalizesPlayerNames(String raw, String expected) {
            NormalizedName name = normalizer.normalizePlayer(raw);
            assertEquals(expected, name.value());
            assertEquals(GenerationalSuffix.NONE, name.suffix());
        }

        @ParameterizedTest
        @DisplayName("Should extract a trailing generational suffix")
        @CsvSource({
                "'Tim Hardaway Jr.', 'tim hardaway', JR",
                "'Tim Hardaway Sr', 'tim hardaway', SR",
                "'Gary Trent, Jr.', 'gary trent', JR",
                "'Robert Williams III', 'robert williams', III",
                "'Marvin Bagley II', 'marvin bagley', II"
        })
        void extractsSuffix(String raw, String expected, GenerationalSuffix suffix) {
            NormalizedName name = normalizer.normalizePlayer(raw);
            assertEquals(expected, name.value());
            assertEquals(suffix, name.suffix());
        }

        @Test
        @DisplayName("Alias key keeps father and son apart")
        void keyIncludesSuffix() {
            assertEquals("tim hardaway jr", normalizer.normalizePlayer("Tim Hardaway Jr.").key());
            assertEquals("tim hardaway sr", normalizer.normalizePlayer("Tim Hardaway Sr.").key());
            assertEquals("tim hardaway", normalizer.normalizePlayer("Tim Hardaway").key());
        }

        @Test
        @DisplayName("Null input normalizes to an empty name")
        void nullIsEmpty() {
            assertTrue(normalizer.normalizePlayer(null).isEmpty());
            assertTrue(normalizer.normalizePlayer("...").isEmpty());
        }
    }

    @Nested
    @DisplayName("Team names")
    class TeamNames {

        @ParameterizedTest
        @CsvSource({
                "'The Los Angeles Lakers', 'los angeles lakers'",
                "'St. Louis Blues', 'saint louis blues'",
                "'Brooklyn & Queens', 'brooklyn and queens'",
                "'PHI 76ers', 'phi 76ers'"
        })
        void normalizesTeamNames(String raw, String expected) {
            assertEquals(expected, normalizer.normalizeTeam(raw));
        }

        @Test
        @DisplayName("Team rules do not apply to player names")
        void teamRulesScoped() {
            assertEquals("the rock", normalizer.normalizePlayer("The Rock").value());
        }
    }

    @Nested
    @DisplayName("Custom rules")
    class CustomRules {

        @Test
        @DisplayName("Rules run in priority order")
        void rulesRunInPriorityOrder() {
            NameNormalizer custom = new NameNormalizer(List.of(
                    NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                    NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));

            assertEquals("cc", custom.normalizeTeam("ab"));
        }
    }

    @Test
    @DisplayName("Suffixes conflict only when both are present and differ")
    void suffixConflicts() {
        assertTrue(GenerationalSuffix.JR.conflictsWith(GenerationalSuffix.SR));
        assertFalse(GenerationalSuffix.JR.conflictsWith(GenerationalSuffix.JR));
        assertFalse(GenerationalSuffix.JR.conflictsWith(GenerationalSuffix.NONE));
        assertFalse(GenerationalSuffix.NONE.conflictsWith(GenerationalSuffix.SR));
        assertEquals(GenerationalSuffix.JR, GenerationalSuffix.fromToken("Jr."));
        assertEquals(GenerationalSuffix.NONE, GenerationalSuffix.fromToken(null));
    }
}
