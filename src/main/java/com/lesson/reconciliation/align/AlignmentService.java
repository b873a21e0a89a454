package com.lesson.reconciliation.align;

import com.lesson.reconciliation.audit.AuditAction;
import com.lesson.reconciliation.audit.AuditService;
import com.lesson.reconciliation.conflict.ConflictGuard;
import com.lesson.reconciliation.conflict.GuardResult;
import com.lesson.reconciliation.conflict.StudentSlotGuard;
import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.logging.LogContext;
import com.lesson.reconciliation.metrics.MetricsService;
import com.lesson.reconciliation.metrics.NoOpMetricsService;
import com.lesson.reconciliation.rules.LessonNormalizer;
import com.lesson.reconciliation.store.AlignedFields;
import com.lesson.reconciliation.store.LessonStore;
import com.lesson.reconciliation.store.NamedRef;
import com.lesson.reconciliation.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Overwrites a DB lesson with the values of its sheet counterpart.
 *
 * Alignment process:
 * 1. Resolve the sheet's teacher and subject to store ids
 * 2. Re-run the {@link ConflictGuard}, whatever the caller checked before
 * 3. Check the student does not end up with two lessons in the same slot
 * 4. Write student, duration, teacher, subject and start date in one call,
 *    keeping day, start time and end date
 *
 * <p>Every problem comes back as a blocked or failed {@link ApplyResult}; nothing is written unless
 * all checks pass. Concurrent alignments are not serialized, so an overlap created
 * between the re-check and the write is not detected.</p>
 */
public class AlignmentService {
    private static final Logger log = LoggerFactory.getLogger(AlignmentService.class);
    private static final String ACTOR = "alignment";

    private final LessonStore store;
    private final ConflictGuard conflictGuard;
    private final StudentSlotGuard studentSlotGuard;
    private final LessonNormalizer normalizer;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public AlignmentService(LessonStore store) {
        this(store, new ConflictGuard(store), new StudentSlotGuard(store), new LessonNormalizer(),
                new AuditService(), new NoOpMetricsService());
    }

    public AlignmentService(LessonStore store, ConflictGuard conflictGuard, StudentSlotGuard studentSlotGuard,
                            LessonNormalizer normalizer, AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.conflictGuard = conflictGuard;
        this.studentSlotGuard = studentSlotGuard;
        this.normalizer = normalizer;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    /**
     * Aligns {@code db} with {@code sheet}.
     */
    public ApplyResult align(DbLesson db, SheetLesson sheet) {
        try (LogContext logCtx = LogContext.forAlignment(LogContext.generateCorrelationId(), db.id())) {
            log.info("alignment.starting lessonId={} sheetRow={}", db.id(), sheet.row());
            auditService.record(AuditAction.ALIGNMENT_REQUESTED, db.id(), ACTOR, sheetDetails(sheet));

            Optional<NamedRef> teacher;
            Optional<NamedRef> subject;
            try {
                teacher = store.resolveTeacher(sheet.teacher());
                subject = store.resolveSubject(sheet.subject());
            } catch (StoreException e) {
                return failed(db, "Error looking up teacher and subject: " + e.getMessage());
            }
            if (teacher.isEmpty()) {
                return failed(db, "Teacher \"" + sheet.teacher() + "\" not found in database.");
            }
            if (subject.isEmpty()) {
                return failed(db, "Subject \"" + sheet.subject() + "\" not found in database.");
            }

            GuardResult guard = conflictGuard.check(db, sheet);
            if (guard.blocked()) {
                return blocked(db, guard.reason());
            }

            AlignedFields fields = new AlignedFields(
                    sheet.studentName(),
                    sheet.duration(),
                    teacher.get().id(),
                    subject.get().id(),
                    normalizer.normalizeDate(sheet.startDate()),
                    db.dayOfWeek(),
                    db.startTime(),
                    db.endDate());

            GuardResult slot = studentSlotGuard.check(db.id(), fields);
            if (slot.blocked()) {
                return blocked(db, "Cannot align lesson: " + slot.reason()
                        + ". This would create overlapping lessons for the same student.");
            }

            DbLesson updated;
            try {
                updated = store.persistAlignedLesson(db.id(), fields);
            } catch (StoreException e) {
                return failed(db, "Error updating lesson: " + e.getMessage());
            }

            metricsService.incrementAlignmentApplied();
            auditService.record(AuditAction.ALIGNMENT_APPLIED, db.id(), ACTOR, sheetDetails(sheet));
            log.info("alignment.applied lessonId={} teacherId={} subjectId={}",
                    db.id(), fields.teacherId(), fields.subjectId());
            return ApplyResult.success(updated);
        }
    }

    private ApplyResult blocked(DbLesson db, String reason) {
        metricsService.incrementAlignmentRejected(AlignmentState.Status.BLOCKED);
        auditService.record(AuditAction.ALIGNMENT_BLOCKED, db.id(), ACTOR, Map.of("reason", reason));
        log.warn("alignment.blocked lessonId={} reason={}", db.id(), reason);
        return ApplyResult.blocked(reason);
    }

    private ApplyResult failed(DbLesson db, String reason) {
        metricsService.incrementAlignmentRejected(AlignmentState.Status.FAILED);
        auditService.record(AuditAction.ALIGNMENT_FAILED, db.id(), ACTOR, Map.of("reason", reason));
        log.warn("alignment.failed lessonId={} reason={}", db.id(), reason);
        return ApplyResult.failure(reason);
    }

    private static Map<String, Object> sheetDetails(SheetLesson sheet) {
        Map<String, Object> details = new HashMap<>();
        details.put("student", sheet.studentName());
        details.put("teacher", sheet.teacher());
        details.put("subject", sheet.subject());
        details.put("duration", sheet.duration());
        if (sheet.row() != null) {
            details.put("row", sheet.row());
        }
        return details;
    }
}
