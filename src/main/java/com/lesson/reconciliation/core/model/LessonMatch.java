package com.lesson.reconciliation.core.model;

import java.util.Objects;

/**
 * A DB lesson paired with a sheet row that agrees on every compared field.
 */
public record LessonMatch(DbLesson dbLesson, SheetLesson sheetLesson) {
    public LessonMatch {
        Objects.requireNonNull(dbLesson, "dbLesson is required");
        Objects.requireNonNull(sheetLesson, "sheetLesson is required");
    }
}
