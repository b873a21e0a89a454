package com.lesson.reconciliation.source;

import com.lesson.reconciliation.core.model.DbLesson;

import java.util.List;

/**
 * Loads the authoritative lessons of a tenant.
 * Implementations return only active, non-deleted lessons; any date window is theirs to apply.
 */
@FunctionalInterface
public interface DbLessonSource {

    List<DbLesson> fetchDbLessons(String tenantId);
}
