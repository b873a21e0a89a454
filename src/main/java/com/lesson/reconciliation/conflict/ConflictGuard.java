package com.lesson.reconciliation.conflict;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.store.LessonStore;
import com.lesson.reconciliation.store.NamedRef;
import com.lesson.reconciliation.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether aligning a DB lesson to a sheet row would double-book its teacher.
 *
 * Check process:
 * 1. Resolve the sheet's teacher and subject against the store
 * 2. Unassigned or unscheduled lessons cannot collide
 * 3. Moving to another teacher cannot collide with this teacher's calendar
 * 4. An unchanged duration keeps the slot the lesson already occupies
 * 5. Otherwise test the revised slot against the teacher's other lessons that day
 *
 * <p>Only the same teacher's calendar is protected; no other constraint is checked.
 * Store failures block the alignment.</p>
 */
public class ConflictGuard {
    private static final Logger log = LoggerFactory.getLogger(ConflictGuard.class);

    private final LessonStore store;

    public ConflictGuard(LessonStore store) {
        this.store = store;
    }

    /**
     * Checks whether aligning {@code db} to {@code sheet} is safe.
     */
    public GuardResult check(DbLesson db, SheetLesson sheet) {
        try {
            Optional<NamedRef> teacher = store.resolveTeacher(sheet.teacher());
            if (teacher.isEmpty()) {
                return GuardResult.blocked("Teacher \"" + sheet.teacher() + "\" from the sheet was not found in the database.");
            }
            if (store.resolveSubject(sheet.subject()).isEmpty()) {
                return GuardResult.blocked("Subject \"" + sheet.subject() + "\" from the sheet was not found in the database.");
            }

            if (!db.isAssigned() || !db.isScheduled()) {
                return GuardResult.clear();
            }
            if (!db.teacherId().equals(teacher.get().id())) {
                return GuardResult.clear();
            }
            if (db.duration() == sheet.duration()) {
                return GuardResult.clear();
            }

            return checkTeacherDay(db, sheet.duration());
        } catch (StoreException e) {
            log.error("guard.failed lessonId={} error={}", db.id(), e.getMessage());
            return GuardResult.blocked("Error checking for conflicts: " + e.getMessage());
        }
    }

    private GuardResult checkTeacherDay(DbLesson db, int newDuration) {
        Optional<TimeSlot> revised = TimeSlot.of(db.startTime(), newDuration);
        if (revised.isEmpty()) {
            return GuardResult.blocked("Start time \"" + db.startTime() + "\" of the lesson could not be read.");
        }

        List<DbLesson> sameDay = store.findTeacherDayLessons(db.teacherId(), db.dayOfWeek(), db.id());
        for (DbLesson other : sameDay) {
            Optional<TimeSlot> otherSlot = TimeSlot.of(other.startTime(), other.duration());
            if (otherSlot.isEmpty()) {
                continue;
            }
            if (revised.get().overlaps(otherSlot.get())) {
                log.info("guard.blocked lessonId={} collidesWith={} newDuration={}",
                        db.id(), other.id(), newDuration);
                return GuardResult.blocked("Changing duration to " + newDuration
                        + " minutes would overlap with " + other.studentName() + "'s lesson.");
            }
        }
        return GuardResult.clear();
    }
}
