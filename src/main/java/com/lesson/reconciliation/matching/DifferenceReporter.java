package com.lesson.reconciliation.matching;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.rules.LessonNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists the field-level differences between a DB lesson and a sheet row.
 * Fields are checked in a fixed order: student, duration, subject, teacher, start date.
 */
public class DifferenceReporter {

    public static final String DEFAULT_UNASSIGNED_LABEL = "Unassigned";
    private static final String NOT_SET = "Not set";

    private final LessonNormalizer normalizer;
    private final String unassignedLabel;

    public DifferenceReporter() {
        this(new LessonNormalizer(), DEFAULT_UNASSIGNED_LABEL);
    }

    public DifferenceReporter(LessonNormalizer normalizer, String unassignedLabel) {
        this.normalizer = normalizer;
        this.unassignedLabel = unassignedLabel;
    }

    /**
     * Returns one sentence per differing field; an empty list means the pair agrees.
     */
    public List<String> diff(DbLesson db, SheetLesson sheet) {
        List<String> differences = new ArrayList<>();

        String dbStudent = nullToEmpty(db.studentName());
        if (!dbStudent.equalsIgnoreCase(sheet.studentName())) {
            differences.add(describe("Student name", dbStudent, sheet.studentName()));
        }

        if (db.duration() != sheet.duration()) {
            differences.add(describe("Duration", db.duration() + " min", sheet.duration() + " min"));
        }

        String dbSubject = nullToEmpty(db.subjectName());
        if (!dbSubject.equalsIgnoreCase(sheet.subject())) {
            differences.add(describe("Subject", dbSubject, sheet.subject()));
        }

        // A blank sheet teacher reads as unassigned.
        String dbTeacher = db.teacherName() != null ? db.teacherName() : unassignedLabel;
        String sheetTeacher = sheet.teacher().isBlank() ? unassignedLabel : sheet.teacher();
        if (!dbTeacher.equalsIgnoreCase(sheetTeacher)) {
            differences.add(describe("Teacher", dbTeacher, sheet.teacher()));
        }

        String dbDate = normalizer.normalizeDate(db.startDate());
        String sheetDate = normalizer.normalizeDate(sheet.startDate());
        if (!Objects.equals(dbDate, sheetDate)) {
            String shownDbDate = db.startDate() != null && !db.startDate().isBlank() ? db.startDate() : NOT_SET;
            differences.add(describe("Start date", shownDbDate, sheet.startDate()));
        }

        return differences;
    }

    private static String describe(String field, String dbValue, String sheetValue) {
        return field + " differs: \"" + dbValue + "\" in the database vs \"" + sheetValue + "\" in the sheet";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
