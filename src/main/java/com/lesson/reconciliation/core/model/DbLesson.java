package com.lesson.reconciliation.core.model;

import java.util.Objects;

/**
 * A lesson as stored in the system of record.
 *
 * <p>{@code teacherId}/{@code teacherName} are null when the lesson is unassigned and
 * {@code dayOfWeek}/{@code startTime} are null when it is unscheduled. Dates are
 * {@code YYYY-MM-DD} strings; {@code startDate} is inclusive and {@code endDate} exclusive.</p>
 *
 * @param id          stable identifier
 * @param studentName student name as entered
 * @param duration    duration in minutes
 * @param teacherId   assigned teacher id, or null
 * @param teacherName assigned teacher display name, or null
 * @param dayOfWeek   day of week (0 = Sunday .. 6 = Saturday), or null
 * @param startTime   start time ({@code HH:mm} or {@code HH:mm:ss}), or null
 * @param subjectId   subject id
 * @param subjectName subject display name
 * @param startDate   first day of the lesson series, or null
 * @param endDate     day after the last lesson of the series, or null
 */
public record DbLesson(
        String id,
        String studentName,
        int duration,
        String teacherId,
        String teacherName,
        Integer dayOfWeek,
        String startTime,
        String subjectId,
        String subjectName,
        String startDate,
        String endDate
) {
    public DbLesson {
        Objects.requireNonNull(id, "id is required");
    }

    /**
     * Returns true if a teacher is assigned.
     */
    public boolean isAssigned() {
        return teacherId != null && !teacherId.isBlank();
    }

    /**
     * Returns true if the lesson has a weekly slot.
     */
    public boolean isScheduled() {
        return dayOfWeek != null && startTime != null && !startTime.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this lesson's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .studentName(studentName)
                .duration(duration)
                .teacher(teacherId, teacherName)
                .slot(dayOfWeek, startTime)
                .subject(subjectId, subjectName)
                .dateRange(startDate, endDate);
    }

    public static class Builder {
        private String id;
        private String studentName;
        private int duration;
        private String teacherId;
        private String teacherName;
        private Integer dayOfWeek;
        private String startTime;
        private String subjectId;
        private String subjectName;
        private String startDate;
        private String endDate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder studentName(String studentName) {
            this.studentName = studentName;
            return this;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder teacher(String teacherId, String teacherName) {
            this.teacherId = teacherId;
            this.teacherName = teacherName;
            return this;
        }

        public Builder slot(Integer dayOfWeek, String startTime) {
            this.dayOfWeek = dayOfWeek;
            this.startTime = startTime;
            return this;
        }

        public Builder subject(String subjectId, String subjectName) {
            this.subjectId = subjectId;
            this.subjectName = subjectName;
            return this;
        }

        public Builder dateRange(String startDate, String endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
            return this;
        }

        public DbLesson build() {
            return new DbLesson(id, studentName, duration, teacherId, teacherName,
                    dayOfWeek, startTime, subjectId, subjectName, startDate, endDate);
        }
    }
}
