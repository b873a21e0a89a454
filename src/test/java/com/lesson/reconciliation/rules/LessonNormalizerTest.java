package com.lesson.reconciliation.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LessonNormalizerTest {

    private LessonNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new LessonNormalizer();
    }

    @Nested
    @DisplayName("normalizeName")
    class NameTests {

        @ParameterizedTest
        @DisplayName("Should canonicalize student names")
        @CsvSource({
                "'Alice Smith','alice smith'",
                "'  ALICE   SMITH  ','alice smith'",
                "'O''Brien, Jr.','obrien jr'",
                "'Zoë-Ann','zoëann'",
                "'Student 2','student 2'"
        })
        void testCanonicalForm(String input, String expected) {
            assertEquals(expected, normalizer.normalizeName(input));
        }

        @Test
        @DisplayName("Null and blank names normalize to empty string")
        void testNullAndBlank() {
            assertEquals("", normalizer.normalizeName(null));
            assertEquals("", normalizer.normalizeName(""));
            assertEquals("", normalizer.normalizeName("   \t"));
        }

        @Test
        @DisplayName("Names made only of punctuation normalize to empty string")
        void testOnlyPunctuation() {
            assertEquals("", normalizer.normalizeName("?!."));
        }

        @ParameterizedTest
        @DisplayName("Normalizing twice equals normalizing once")
        @ValueSource(strings = {"Alice  Smith", " Mc'Donald ", "ÉLODIE  d'Arc", "a\t\tb", "x.y.z"})
        void testIdempotent(String input) {
            String once = normalizer.normalizeName(input);
            assertEquals(once, normalizer.normalizeName(once));
        }
    }

    @Nested
    @DisplayName("normalizeDate")
    class DateTests {

        @ParameterizedTest
        @DisplayName("Should convert supported formats to ISO")
        @CsvSource({
                "2024-01-15,2024-01-15",
                "15/01/2024,2024-01-15",
                "5/1/2024,2024-01-05",
                "01/15/2024,2024-01-15",
                "' 2024-03-01 ',2024-03-01"
        })
        void testSupportedFormats(String input, String expected) {
            assertEquals(expected, normalizer.normalizeDate(input));
        }

        @Test
        @DisplayName("Day-first reading wins when both readings are valid")
        void testDayFirstPreferred() {
            assertEquals("2024-02-03", normalizer.normalizeDate("03/02/2024"));
        }

        @Test
        @DisplayName("Null and blank dates normalize to null")
        void testNullAndBlank() {
            assertNull(normalizer.normalizeDate(null));
            assertNull(normalizer.normalizeDate("  "));
        }

        @ParameterizedTest
        @DisplayName("Unparseable dates are returned trimmed")
        @ValueSource(strings = {"next monday", "2024-13-45", "32/13/2024", "Jan 5 2024"})
        void testUnparseableReturnedAsIs(String input) {
            assertEquals(input.trim(), normalizer.normalizeDate(" " + input + " "));
        }

        @Test
        @DisplayName("Normalizing a date twice equals normalizing once")
        void testIdempotent() {
            String once = normalizer.normalizeDate("15/01/2024");
            assertEquals(once, normalizer.normalizeDate(once));
        }
    }

    @Nested
    @DisplayName("parseDate")
    class ParseTests {

        @Test
        @DisplayName("Should parse the same formats as normalizeDate")
        void testParse() {
            assertEquals(Optional.of(LocalDate.of(2024, 1, 15)), normalizer.parseDate("15/01/2024"));
            assertEquals(Optional.of(LocalDate.of(2024, 1, 15)), normalizer.parseDate("2024-01-15"));
        }

        @Test
        @DisplayName("Should return empty for missing or unreadable dates")
        void testEmpty() {
            assertTrue(normalizer.parseDate(null).isEmpty());
            assertTrue(normalizer.parseDate("").isEmpty());
            assertTrue(normalizer.parseDate("soon").isEmpty());
            assertTrue(normalizer.parseDate("2023-02-29").isEmpty());
        }
    }
}
