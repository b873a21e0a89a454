package com.lesson.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A DB lesson paired with a sheet row that differs on at least one field.
 *
 * @param dbLesson    the DB side of the pair
 * @param sheetLesson the sheet side of the pair
 * @param differences human-readable differences, in field order
 */
public record LessonMismatch(DbLesson dbLesson, SheetLesson sheetLesson, List<String> differences) {
    public LessonMismatch {
        Objects.requireNonNull(dbLesson, "dbLesson is required");
        Objects.requireNonNull(sheetLesson, "sheetLesson is required");
        differences = differences != null ? List.copyOf(differences) : List.of();
    }
}
