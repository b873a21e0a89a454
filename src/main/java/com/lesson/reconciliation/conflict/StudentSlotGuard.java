package com.lesson.reconciliation.conflict;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.rules.LessonNormalizer;
import com.lesson.reconciliation.store.AlignedFields;
import com.lesson.reconciliation.store.LessonStore;
import com.lesson.reconciliation.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Stops an alignment that would give a student two lessons in the same weekly slot
 * over overlapping date ranges. Ranges are {@code [startDate, endDate)} like on
 * {@link DbLesson}, so a lesson ending on the day another starts does not overlap it.
 * Missing or unreadable range bounds count as open.
 */
public class StudentSlotGuard {
    private static final Logger log = LoggerFactory.getLogger(StudentSlotGuard.class);

    private final LessonStore store;
    private final LessonNormalizer normalizer;

    public StudentSlotGuard(LessonStore store) {
        this(store, new LessonNormalizer());
    }

    public StudentSlotGuard(LessonStore store, LessonNormalizer normalizer) {
        this.store = store;
        this.normalizer = normalizer;
    }

    /**
     * Checks the fields an alignment is about to write for {@code lessonId}.
     */
    public GuardResult check(String lessonId, AlignedFields fields) {
        if (fields.dayOfWeek() == null || fields.startTime() == null || fields.studentName() == null) {
            return GuardResult.clear();
        }
        try {
            List<DbLesson> sameSlot = store.findStudentSlotLessons(
                    fields.studentName(), fields.dayOfWeek(), fields.startTime(), lessonId);
            for (DbLesson other : sameSlot) {
                if (rangesOverlap(fields.startDate(), fields.endDate(), other.startDate(), other.endDate())) {
                    log.info("slot.blocked lessonId={} duplicateOf={} student='{}'",
                            lessonId, other.id(), fields.studentName());
                    return GuardResult.blocked("Overlapping lesson found for " + other.studentName()
                            + " on day " + other.dayOfWeek() + " at " + other.startTime()
                            + " (" + describeRange(other) + ")");
                }
            }
            return GuardResult.clear();
        } catch (StoreException e) {
            log.error("slot.check.failed lessonId={} error={}", lessonId, e.getMessage());
            return GuardResult.blocked("Error checking for duplicate student lessons: " + e.getMessage());
        }
    }

    boolean rangesOverlap(String startA, String endA, String startB, String endB) {
        LocalDate aStart = normalizer.parseDate(startA).orElse(LocalDate.MIN);
        LocalDate aEnd = normalizer.parseDate(endA).orElse(LocalDate.MAX);
        LocalDate bStart = normalizer.parseDate(startB).orElse(LocalDate.MIN);
        LocalDate bEnd = normalizer.parseDate(endB).orElse(LocalDate.MAX);
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    private static String describeRange(DbLesson lesson) {
        String start = lesson.startDate() != null ? lesson.startDate() : "open";
        String end = lesson.endDate() != null ? lesson.endDate() : "open";
        return start + " - " + end;
    }
}
