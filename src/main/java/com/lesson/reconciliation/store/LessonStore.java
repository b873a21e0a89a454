package com.lesson.reconciliation.store;

import com.lesson.reconciliation.core.model.DbLesson;

import java.util.List;
import java.util.Optional;

/**
 * Live view of the lesson schedule used by the conflict guard and by alignment.
 * Implementations are scoped to one tenant and signal backend failures with
 * {@link StoreException}.
 */
public interface LessonStore {

    /**
     * Finds a teacher by display name, ignoring case.
     */
    Optional<NamedRef> resolveTeacher(String name);

    /**
     * Finds a subject by display name, ignoring case. An exact name is preferred;
     * otherwise the first subject whose name contains the given text.
     */
    Optional<NamedRef> resolveSubject(String name);

    /**
     * Gets the active lessons of a teacher on a day of the week, except the given lesson.
     */
    List<DbLesson> findTeacherDayLessons(String teacherId, int dayOfWeek, String excludeLessonId);

    /**
     * Gets the active lessons of a student in the given weekly slot, except the given lesson.
     */
    List<DbLesson> findStudentSlotLessons(String studentName, int dayOfWeek, String startTime,
                                          String excludeLessonId);

    /**
     * Overwrites a lesson with the aligned fields in one write.
     *
     * @return the lesson as stored after the write
     */
    DbLesson persistAlignedLesson(String lessonId, AlignedFields fields);
}
