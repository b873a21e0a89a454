package com.lesson.reconciliation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one reconciliation run: four disjoint buckets holding references to the
 * compared lessons.
 *
 * <p>The engine fills the buckets; afterwards only {@link #markAligned} moves entries,
 * which callers use once an alignment has been persisted. Bucket getters return
 * read-only snapshots.</p>
 */
public class ReconciliationResult {

    private final List<LessonMatch> matched = new ArrayList<>();
    private final List<LessonMismatch> mismatched = new ArrayList<>();
    private final List<SheetLesson> missingInDb = new ArrayList<>();
    private final List<DbLesson> missingInSheet = new ArrayList<>();
    private int droppedDbLessons;
    private int droppedSheetLessons;

    public synchronized void addMatched(LessonMatch match) {
        matched.add(match);
    }

    public synchronized void addMismatched(LessonMismatch mismatch) {
        mismatched.add(mismatch);
    }

    public synchronized void addMissingInDb(SheetLesson sheetLesson) {
        missingInDb.add(sheetLesson);
    }

    public synchronized void addMissingInSheet(DbLesson dbLesson) {
        missingInSheet.add(dbLesson);
    }

    public synchronized List<LessonMatch> getMatched() {
        return Collections.unmodifiableList(new ArrayList<>(matched));
    }

    public synchronized List<LessonMismatch> getMismatched() {
        return Collections.unmodifiableList(new ArrayList<>(mismatched));
    }

    public synchronized List<SheetLesson> getMissingInDb() {
        return Collections.unmodifiableList(new ArrayList<>(missingInDb));
    }

    public synchronized List<DbLesson> getMissingInSheet() {
        return Collections.unmodifiableList(new ArrayList<>(missingInSheet));
    }

    /**
     * Finds the mismatch whose DB side has the given id.
     */
    public synchronized Optional<LessonMismatch> findMismatch(String dbLessonId) {
        return mismatched.stream()
                .filter(m -> m.dbLesson().id().equals(dbLessonId))
                .findFirst();
    }

    /**
     * Moves a mismatch into the matched bucket, replacing its DB side with the aligned lesson.
     *
     * @return false if the mismatch is no longer part of this result
     */
    public synchronized boolean markAligned(LessonMismatch mismatch, DbLesson alignedLesson) {
        for (int i = 0; i < mismatched.size(); i++) {
            if (mismatched.get(i) == mismatch) {
                mismatched.remove(i);
                matched.add(new LessonMatch(alignedLesson, mismatch.sheetLesson()));
                return true;
            }
        }
        return false;
    }

    public synchronized int count(OutcomeType type) {
        return switch (type) {
            case MATCHED -> matched.size();
            case MISMATCHED -> mismatched.size();
            case MISSING_IN_DB -> missingInDb.size();
            case MISSING_IN_SHEET -> missingInSheet.size();
        };
    }

    /**
     * Number of DB lessons accounted for across all buckets.
     */
    public synchronized int dbLessonCount() {
        return matched.size() + mismatched.size() + missingInSheet.size();
    }

    /**
     * Number of sheet lessons accounted for across all buckets.
     */
    public synchronized int sheetLessonCount() {
        return matched.size() + mismatched.size() + missingInDb.size();
    }

    public synchronized boolean isFullyMatched() {
        return mismatched.isEmpty() && missingInDb.isEmpty() && missingInSheet.isEmpty();
    }

    public synchronized int getDroppedDbLessons() {
        return droppedDbLessons;
    }

    public synchronized int getDroppedSheetLessons() {
        return droppedSheetLessons;
    }

    public synchronized void recordDropped(int dbLessons, int sheetLessons) {
        this.droppedDbLessons = dbLessons;
        this.droppedSheetLessons = sheetLessons;
    }

    @Override
    public synchronized String toString() {
        return "ReconciliationResult{matched=" + matched.size() +
                ", mismatched=" + mismatched.size() +
                ", missingInDb=" + missingInDb.size() +
                ", missingInSheet=" + missingInSheet.size() +
                ", dropped=" + (droppedDbLessons + droppedSheetLessons) + '}';
    }
}
