package com.lesson.reconciliation.store;

/**
 * Complete field set written by one alignment. Student, duration, teacher, subject and
 * start date come from the sheet; day, start time and end date are kept from the lesson.
 */
public record AlignedFields(
        String studentName,
        int duration,
        String teacherId,
        String subjectId,
        String startDate,
        Integer dayOfWeek,
        String startTime,
        String endDate
) {
}
