package com.lesson.reconciliation.store;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.source.DbLessonSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link LessonStore} for one tenant.
 * Suitable for testing and single-JVM embedding. Thread-safe via synchronization;
 * iteration follows insertion order.
 */
public class InMemoryLessonStore implements LessonStore, DbLessonSource {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLessonStore.class);

    private final Map<String, NamedRef> teachers = new LinkedHashMap<>();
    private final Map<String, NamedRef> subjects = new LinkedHashMap<>();
    private final Map<String, DbLesson> lessons = new LinkedHashMap<>();

    public synchronized InMemoryLessonStore addTeacher(String id, String name) {
        teachers.put(id, new NamedRef(id, name));
        return this;
    }

    public synchronized InMemoryLessonStore addSubject(String id, String name) {
        subjects.put(id, new NamedRef(id, name));
        return this;
    }

    /**
     * Adds or replaces a lesson. Teacher and subject names are filled in from the
     * registered teachers and subjects when the lesson leaves them empty.
     */
    public synchronized InMemoryLessonStore addLesson(DbLesson lesson) {
        lessons.put(lesson.id(), withResolvedNames(lesson));
        return this;
    }

    public synchronized Optional<DbLesson> findById(String lessonId) {
        return Optional.ofNullable(lessons.get(lessonId));
    }

    @Override
    public synchronized List<DbLesson> fetchDbLessons(String tenantId) {
        return List.copyOf(lessons.values());
    }

    @Override
    public synchronized Optional<NamedRef> resolveTeacher(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return teachers.values().stream()
                .filter(t -> t.name() != null && t.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    @Override
    public synchronized Optional<NamedRef> resolveSubject(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        Optional<NamedRef> exact = subjects.values().stream()
                .filter(s -> s.name() != null && s.name().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return subjects.values().stream()
                .filter(s -> s.name() != null && s.name().toLowerCase(Locale.ROOT).contains(wanted))
                .findFirst();
    }

    @Override
    public synchronized List<DbLesson> findTeacherDayLessons(String teacherId, int dayOfWeek, String excludeLessonId) {
        List<DbLesson> result = new ArrayList<>();
        for (DbLesson lesson : lessons.values()) {
            if (teacherId.equals(lesson.teacherId())
                    && lesson.dayOfWeek() != null && lesson.dayOfWeek() == dayOfWeek
                    && !lesson.id().equals(excludeLessonId)) {
                result.add(lesson);
            }
        }
        return result;
    }

    @Override
    public synchronized List<DbLesson> findStudentSlotLessons(String studentName, int dayOfWeek, String startTime,
                                                              String excludeLessonId) {
        List<DbLesson> result = new ArrayList<>();
        for (DbLesson lesson : lessons.values()) {
            if (studentName.equals(lesson.studentName())
                    && lesson.dayOfWeek() != null && lesson.dayOfWeek() == dayOfWeek
                    && startTime.equals(lesson.startTime())
                    && !lesson.id().equals(excludeLessonId)) {
                result.add(lesson);
            }
        }
        return result;
    }

    @Override
    public synchronized DbLesson persistAlignedLesson(String lessonId, AlignedFields fields) {
        DbLesson existing = lessons.get(lessonId);
        if (existing == null) {
            throw new StoreException("Lesson not found: " + lessonId);
        }
        NamedRef teacher = fields.teacherId() != null ? teachers.get(fields.teacherId()) : null;
        NamedRef subject = subjects.get(fields.subjectId());

        DbLesson updated = existing.toBuilder()
                .studentName(fields.studentName())
                .duration(fields.duration())
                .teacher(fields.teacherId(), teacher != null ? teacher.name() : null)
                .subject(fields.subjectId(), subject != null ? subject.name() : existing.subjectName())
                .slot(fields.dayOfWeek(), fields.startTime())
                .dateRange(fields.startDate(), fields.endDate())
                .build();
        lessons.put(lessonId, updated);
        log.debug("Lesson {} overwritten with aligned fields", lessonId);
        return updated;
    }

    private DbLesson withResolvedNames(DbLesson lesson) {
        DbLesson.Builder builder = lesson.toBuilder();
        if (lesson.teacherId() != null && lesson.teacherName() == null && teachers.containsKey(lesson.teacherId())) {
            builder.teacher(lesson.teacherId(), teachers.get(lesson.teacherId()).name());
        }
        if (lesson.subjectId() != null && lesson.subjectName() == null && subjects.containsKey(lesson.subjectId())) {
            builder.subject(lesson.subjectId(), subjects.get(lesson.subjectId()).name());
        }
        return builder.build();
    }
}
