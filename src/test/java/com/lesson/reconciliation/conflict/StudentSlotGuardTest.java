package com.lesson.reconciliation.conflict;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.store.AlignedFields;
import com.lesson.reconciliation.store.InMemoryLessonStore;
import com.lesson.reconciliation.store.LessonStore;
import com.lesson.reconciliation.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StudentSlotGuardTest {

    private InMemoryLessonStore store;
    private StudentSlotGuard guard;

    @BeforeEach
    void setUp() {
        store = new InMemoryLessonStore()
                .addTeacher("t-1", "Maria")
                .addSubject("s-1", "Piano")
                .addLesson(DbLesson.builder()
                        .id("L2")
                        .studentName("Alice")
                        .duration(30)
                        .teacher("t-1", null)
                        .slot(1, "10:00")
                        .subject("s-1", null)
                        .dateRange("2024-01-01", "2024-06-01")
                        .build());
        guard = new StudentSlotGuard(store);
    }

    private static AlignedFields fields(String student, Integer day, String time, String start, String end) {
        return new AlignedFields(student, 30, "t-1", "s-1", start, day, time, end);
    }

    @Test
    @DisplayName("Same student, slot and overlapping dates is blocked")
    void testBlocked() {
        GuardResult result = guard.check("L1", fields("Alice", 1, "10:00", "2024-03-01", null));

        assertTrue(result.blocked());
        assertEquals("Overlapping lesson found for Alice on day 1 at 10:00 (2024-01-01 - 2024-06-01)", result.reason());
    }

    @Test
    @DisplayName("The lesson being aligned is not its own duplicate")
    void testSelfExcluded() {
        assertTrue(guard.check("L2", fields("Alice", 1, "10:00", "2024-03-01", null)).isClear());
    }

    @Test
    @DisplayName("Different slot or different student is clear")
    void testDifferentSlot() {
        assertTrue(guard.check("L1", fields("Alice", 2, "10:00", null, null)).isClear());
        assertTrue(guard.check("L1", fields("Alice", 1, "11:00", null, null)).isClear());
        assertTrue(guard.check("L1", fields("Bob", 1, "10:00", null, null)).isClear());
    }

    @Test
    @DisplayName("Unscheduled lessons are not checked")
    void testUnscheduled() {
        assertTrue(guard.check("L1", fields("Alice", null, null, null, null)).isClear());
    }

    @Test
    @DisplayName("Date ranges that do not meet are clear")
    void testSeparateRanges() {
        assertTrue(guard.check("L1", fields("Alice", 1, "10:00", "2024-07-01", "2024-12-01")).isClear());
    }

    @Test
    @DisplayName("A range starting on the other lesson's end date is clear")
    void testStartsOnEndDate() {
        assertTrue(guard.check("L1", fields("Alice", 1, "10:00", "2024-06-01", null)).isClear());
        assertTrue(guard.check("L1", fields("Alice", 1, "10:00", "2023-09-01", "2024-01-01")).isClear());
        assertTrue(guard.check("L1", fields("Alice", 1, "10:00", "2024-05-31", null)).blocked());
    }

    @ParameterizedTest
    @DisplayName("Range overlap treats end dates as exclusive and missing bounds as open")
    @CsvSource(value = {
            "2024-01-01,2024-02-01,2024-02-01,2024-03-01,false",
            "2024-01-01,2024-02-02,2024-02-01,2024-03-01,true",
            "2024-01-01,2024-01-31,2024-02-01,2024-03-01,false",
            "NULL,NULL,2024-02-01,2024-03-01,true",
            "2024-04-01,NULL,2024-02-01,2024-03-01,false",
            "NULL,2024-01-15,2024-01-15,NULL,false",
            "NULL,2024-01-16,2024-01-15,NULL,true",
            "01/02/2024,NULL,2024-01-01,2024-02-15,true"
    }, nullValues = "NULL")
    void testRangesOverlap(String startA, String endA, String startB, String endB, boolean expected) {
        assertEquals(expected, guard.rangesOverlap(startA, endA, startB, endB));
    }

    @Test
    @DisplayName("Store failure blocks the alignment")
    void testStoreFailure() {
        LessonStore failing = mock(LessonStore.class);
        when(failing.findStudentSlotLessons(anyString(), anyInt(), anyString(), anyString()))
                .thenThrow(new StoreException("read timeout"));

        GuardResult result = new StudentSlotGuard(failing).check("L1", fields("Alice", 1, "10:00", null, null));

        assertTrue(result.blocked());
        assertEquals("Error checking for duplicate student lessons: read timeout", result.reason());
    }
}
