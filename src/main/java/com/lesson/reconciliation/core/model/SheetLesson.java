package com.lesson.reconciliation.core.model;

/**
 * One row of the external lesson sheet.
 * All text fields are free text as typed into the sheet; none of them is guaranteed
 * to be unique or well formed.
 *
 * @param studentName student name
 * @param duration    duration in minutes (0 when the cell could not be read)
 * @param teacher     teacher display name
 * @param startDate   start date in whatever format the sheet uses
 * @param subject     subject display name
 * @param row         originating sheet row, or null when unknown
 */
public record SheetLesson(
        String studentName,
        int duration,
        String teacher,
        String startDate,
        String subject,
        Integer row
) {
    public SheetLesson {
        studentName = studentName != null ? studentName : "";
        teacher = teacher != null ? teacher : "";
        startDate = startDate != null ? startDate : "";
        subject = subject != null ? subject : "";
    }

    public static SheetLesson of(String studentName, int duration, String teacher,
                                 String startDate, String subject) {
        return new SheetLesson(studentName, duration, teacher, startDate, subject, null);
    }

    /**
     * Short label for log messages.
     */
    public String describe() {
        return row != null ? studentName + " (row " + row + ")" : studentName;
    }
}
