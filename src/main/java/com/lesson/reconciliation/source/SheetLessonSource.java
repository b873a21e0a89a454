package com.lesson.reconciliation.source;

import com.lesson.reconciliation.core.model.SheetLesson;

import java.util.List;

/**
 * Loads the external sheet rows of a tenant.
 */
@FunctionalInterface
public interface SheetLessonSource {

    List<SheetLesson> fetchSheetLessons(String tenantId);
}
