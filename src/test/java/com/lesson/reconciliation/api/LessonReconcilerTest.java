package com.lesson.reconciliation.api;

import com.lesson.reconciliation.align.ApplyResult;
import com.lesson.reconciliation.audit.AuditAction;
import com.lesson.reconciliation.audit.AuditEntry;
import com.lesson.reconciliation.conflict.GuardResult;
import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.LessonMismatch;
import com.lesson.reconciliation.core.model.OutcomeType;
import com.lesson.reconciliation.core.model.ReconciliationResult;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.metrics.MicrometerMetricsService;
import com.lesson.reconciliation.source.LessonSourceException;
import com.lesson.reconciliation.source.SheetLessonSource;
import com.lesson.reconciliation.store.InMemoryLessonStore;
import com.lesson.reconciliation.tracing.Span;
import com.lesson.reconciliation.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("LessonReconciler Tests")
class LessonReconcilerTest {

    private static final String SCHOOL = "school-1";

    private InMemoryLessonStore store;
    private List<SheetLesson> sheet;
    private LessonReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryLessonStore()
                .addTeacher("t-1", "Maria")
                .addTeacher("t-2", "John")
                .addSubject("s-1", "Piano")
                .addSubject("s-2", "Guitar")
                .addLesson(lesson("L1", "Alice Smith", "t-1", "10:00", "s-1"))
                .addLesson(lesson("L2", "Bob Jones", "t-1", "11:00", "s-2"))
                .addLesson(lesson("L3", "Carla", "t-2", "10:00", "s-1"))
                .addLesson(lesson("L4", "Unnamed Student", "t-2", "11:00", "s-1"));
        sheet = List.of(
                new SheetLesson("alice smith", 30, "maria", "2024-01-01", "piano", 2),
                new SheetLesson("Bob Jones", 45, "Maria", "01/01/2024", "Guitar", 3),
                new SheetLesson("Dan", 30, "John", "2024-01-01", "Piano", 4),
                new SheetLesson("", 30, "John", "2024-01-01", "Piano", 5));
        reconciler = LessonReconciler.builder()
                .dbLessonSource(store)
                .sheetLessonSource(tenant -> sheet)
                .lessonStore(store)
                .build();
    }

    private static DbLesson lesson(String id, String student, String teacherId, String startTime, String subjectId) {
        return DbLesson.builder()
                .id(id)
                .studentName(student)
                .duration(30)
                .teacher(teacherId, null)
                .slot(1, startTime)
                .subject(subjectId, null)
                .dateRange("2024-01-01", "2024-06-01")
                .build();
    }

    @Nested
    @DisplayName("Reconciliation")
    class ReconcileTests {

        @Test
        @DisplayName("Tenant run classifies every valid lesson")
        void testReconcileTenant() {
            ReconciliationResult result = reconciler.reconcile(SCHOOL);

            assertEquals(1, result.count(OutcomeType.MATCHED));
            assertEquals("L1", result.getMatched().get(0).dbLesson().id());
            assertEquals(1, result.count(OutcomeType.MISMATCHED));
            assertEquals(List.of("Duration differs: \"30 min\" in the database vs \"45 min\" in the sheet"),
                    result.getMismatched().get(0).differences());
            assertEquals("Dan", result.getMissingInDb().get(0).studentName());
            assertEquals("L3", result.getMissingInSheet().get(0).id());
        }

        @Test
        @DisplayName("Placeholder and nameless lessons are dropped before matching")
        void testValidityFiltering() {
            ReconciliationResult result = reconciler.reconcile(SCHOOL);

            assertEquals(1, result.getDroppedDbLessons());
            assertEquals(1, result.getDroppedSheetLessons());
            assertEquals(3, result.dbLessonCount());
            assertEquals(3, result.sheetLessonCount());
        }

        @Test
        @DisplayName("Custom placeholder name is honored")
        void testCustomPlaceholder() {
            LessonReconciler custom = LessonReconciler.builder()
                    .options(ReconciliationOptions.builder().placeholderStudentName("Carla").build())
                    .build();

            ReconciliationResult result = custom.reconcile(store.fetchDbLessons(SCHOOL), sheet);

            assertEquals(1, result.getDroppedDbLessons());
            assertTrue(result.getMissingInSheet().stream().anyMatch(l -> l.id().equals("L4")));
        }

        @Test
        @DisplayName("Run completion is audited")
        void testAudit() {
            reconciler.reconcile(SCHOOL);

            List<AuditEntry> entries = reconciler.getAuditService()
                    .getEntriesByAction(AuditAction.RECONCILIATION_COMPLETED);
            assertEquals(1, entries.size());
            assertEquals(SCHOOL, entries.get(0).subjectId());
            assertEquals(1, entries.get(0).details().get("missingInDb"));
            assertNotNull(entries.get(0).correlationId());
        }

        @Test
        @DisplayName("Run metrics are recorded")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            LessonReconciler measured = LessonReconciler.builder()
                    .dbLessonSource(store)
                    .sheetLessonSource(tenant -> sheet)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            measured.reconcile(SCHOOL);

            assertEquals(1, registry.find("lesson.reconciliation.duration").timer().count());
            assertEquals(2, registry.find("lesson.reconciliation.pair.score").summary().count());
            assertEquals(1.0, registry.find("lesson.reconciliation.outcomes")
                    .tag("outcome", "MISSING_IN_SHEET").summary().totalAmount(), 0.001);
        }

        @Test
        @DisplayName("Run is traced")
        void testTracing() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(eq("lesson.reconcile"), anyMap())).thenReturn(span);
            LessonReconciler traced = LessonReconciler.builder()
                    .dbLessonSource(store)
                    .sheetLessonSource(tenant -> sheet)
                    .tracingService(tracing)
                    .build();

            traced.reconcile(SCHOOL);

            verify(tracing).startSpan("lesson.reconcile", Map.of("tenantId", SCHOOL));
            verify(span).setAttribute("matched", 1L);
            verify(span).setAttribute("missing_in_db", 1L);
            verify(span).close();
        }

        @Test
        @DisplayName("Tenant run without sources is a usage error")
        void testMissingSources() {
            LessonReconciler bare = LessonReconciler.builder().build();

            assertThrows(IllegalStateException.class, () -> bare.reconcile(SCHOOL));
        }

        @Test
        @DisplayName("Feed failures reach the caller")
        void testFeedFailure() {
            SheetLessonSource failing = tenant -> {
                throw new LessonSourceException("sheet unreachable");
            };
            LessonReconciler broken = LessonReconciler.builder()
                    .dbLessonSource(store)
                    .sheetLessonSource(failing)
                    .build();

            assertThrows(LessonSourceException.class, () -> broken.reconcile(SCHOOL));
        }
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("Pair scoring uses the configured weights and threshold")
        void testScoring() {
            DbLesson alice = store.findById("L1").orElseThrow();

            assertEquals(10.0, reconciler.scoreRecordPair(alice, sheet.get(0)), 1e-9);
            assertTrue(reconciler.isCandidateMatch(alice, sheet.get(0)));
            assertFalse(reconciler.isCandidateMatch(alice, sheet.get(2)));
            assertEquals(3.0, reconciler.explainScore(alice, sheet.get(0)).studentName(), 1e-9);
        }

        @Test
        @DisplayName("Stricter threshold rejects weaker pairs")
        void testStricterThreshold() {
            LessonReconciler strict = LessonReconciler.builder()
                    .options(ReconciliationOptions.builder().candidateThreshold(9.0).build())
                    .build();
            DbLesson bob = store.findById("L2").orElseThrow();

            assertFalse(strict.isCandidateMatch(bob, sheet.get(1)));
            assertTrue(reconciler.isCandidateMatch(bob, sheet.get(1)));
        }
    }

    @Nested
    @DisplayName("Alignment")
    class AlignmentTests {

        @Test
        @DisplayName("Aligning a mismatch updates the store and moves it to matched")
        void testAlignMismatch() {
            ReconciliationResult result = reconciler.reconcile(SCHOOL);
            LessonMismatch mismatch = result.findMismatch("L2").orElseThrow();

            assertTrue(reconciler.checkAlignmentConflict(mismatch.dbLesson(), mismatch.sheetLesson()).isClear());
            ApplyResult applied = reconciler.alignMismatch(result, mismatch);

            assertTrue(applied.success(), applied.message());
            assertEquals(45, store.findById("L2").orElseThrow().duration());
            assertEquals("2024-01-01", store.findById("L2").orElseThrow().startDate());
            assertTrue(result.getMismatched().isEmpty());
            assertEquals(2, result.count(OutcomeType.MATCHED));
            assertTrue(reconciler.getAlignmentState("L2").isEmpty());

            ReconciliationResult rerun = reconciler.reconcile(SCHOOL);
            assertEquals(2, rerun.count(OutcomeType.MATCHED));
            assertEquals(0, rerun.count(OutcomeType.MISMATCHED));
        }

        @Test
        @DisplayName("Blocked alignment keeps the mismatch and records why")
        void testBlockedAlignment() {
            store.addLesson(lesson("L5", "Eve", "t-1", "11:30", "s-1"));
            ReconciliationResult result = reconciler.reconcile(SCHOOL);
            LessonMismatch mismatch = result.findMismatch("L2").orElseThrow();

            GuardResult guard = reconciler.checkAlignmentConflict(mismatch.dbLesson(), mismatch.sheetLesson());
            assertTrue(guard.blocked());
            assertEquals("Changing duration to 45 minutes would overlap with Eve's lesson.", guard.reason());

            ApplyResult applied = reconciler.alignMismatch(result, mismatch);

            assertEquals(ApplyResult.Status.BLOCKED, applied.status());
            assertEquals(guard.reason(), applied.message());
            assertEquals(30, store.findById("L2").orElseThrow().duration());
            assertEquals(1, result.count(OutcomeType.MISMATCHED));
            AlignmentState state = reconciler.getAlignmentState("L2").orElseThrow();
            assertEquals(AlignmentState.Status.BLOCKED, state.status());
            assertEquals(guard.reason(), state.reason());
        }

        @Test
        @DisplayName("Student already booked in the slot is tracked as blocked, not failed")
        void testStudentSlotBlocked() {
            store.addLesson(lesson("L6", "Bob Jones", "t-2", "11:00", "s-1"));
            ReconciliationResult result = reconciler.reconcile(SCHOOL);
            LessonMismatch mismatch = result.findMismatch("L2").orElseThrow();

            assertTrue(reconciler.checkAlignmentConflict(mismatch.dbLesson(), mismatch.sheetLesson()).isClear());
            ApplyResult applied = reconciler.alignMismatch(result, mismatch);

            assertEquals(ApplyResult.Status.BLOCKED, applied.status());
            assertTrue(applied.message().startsWith("Cannot align lesson: Overlapping lesson found for Bob Jones"));
            assertEquals(30, store.findById("L2").orElseThrow().duration());
            assertEquals(1, result.count(OutcomeType.MISMATCHED));
            AlignmentState state = reconciler.getAlignmentState("L2").orElseThrow();
            assertEquals(AlignmentState.Status.BLOCKED, state.status());
            assertEquals(applied.message(), state.reason());
        }

        @Test
        @DisplayName("Failed write is tracked as failed")
        void testFailedAlignment() {
            ReconciliationResult result = reconciler.reconcile(SCHOOL);
            LessonMismatch mismatch = result.findMismatch("L2").orElseThrow();
            LessonMismatch ghost = new LessonMismatch(
                    mismatch.dbLesson().toBuilder().id("gone").teacher(null, null).slot(null, null).build(),
                    mismatch.sheetLesson(), mismatch.differences());

            ApplyResult applied = reconciler.alignMismatch(result, ghost);

            assertEquals(ApplyResult.Status.FAILED, applied.status());
            assertEquals("Error updating lesson: Lesson not found: gone", applied.message());
            assertEquals(AlignmentState.Status.FAILED, reconciler.getAlignmentState("gone").orElseThrow().status());
            assertEquals(1, result.count(OutcomeType.MISMATCHED));
        }

        @Test
        @DisplayName("Direct apply re-checks the guard")
        void testApplyRechecksGuard() {
            store.addLesson(lesson("L5", "Eve", "t-1", "11:30", "s-1"));
            DbLesson bob = store.findById("L2").orElseThrow();

            ApplyResult applied = reconciler.applyAlignment(bob, sheet.get(1));

            assertFalse(applied.success());
            assertEquals(30, store.findById("L2").orElseThrow().duration());
        }

        @Test
        @DisplayName("Alignment without a store is a usage error")
        void testMissingStore() {
            LessonReconciler bare = LessonReconciler.builder().build();
            DbLesson bob = store.findById("L2").orElseThrow();

            assertThrows(IllegalStateException.class, () -> bare.checkAlignmentConflict(bob, sheet.get(1)));
            assertThrows(IllegalStateException.class, () -> bare.applyAlignment(bob, sheet.get(1)));
        }
    }
}
