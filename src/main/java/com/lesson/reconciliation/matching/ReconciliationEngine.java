package com.lesson.reconciliation.matching;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.LessonMatch;
import com.lesson.reconciliation.core.model.LessonMismatch;
import com.lesson.reconciliation.core.model.ReconciliationResult;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.similarity.LessonScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs DB lessons with sheet rows, at most one to one, and classifies every lesson
 * into exactly one bucket of a {@link ReconciliationResult}.
 *
 * Matching process:
 * 1. Best attainable candidate score per DB lesson
 * 2. DB lessons ordered by that score, strongest first
 * 3. Each DB lesson claims its highest scoring unclaimed candidate row
 * 4. Unclaimed rows try a partial match against unclaimed DB lessons
 * 5. Whatever is left is missing on the other side
 *
 * <p>Strong pairs claim their rows first so a weaker lesson cannot take a row that a
 * better lesson also wants. Exact score ties keep input order. The run is a pure
 * computation over the given lists.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final LessonScorer scorer;
    private final DifferenceReporter differenceReporter;

    public ReconciliationEngine() {
        this(new LessonScorer(), new DifferenceReporter());
    }

    public ReconciliationEngine(LessonScorer scorer, DifferenceReporter differenceReporter) {
        this.scorer = scorer;
        this.differenceReporter = differenceReporter;
    }

    /**
     * Reconciles the two lists. Both are expected to contain only valid lessons.
     */
    public ReconciliationResult reconcile(List<DbLesson> dbLessons, List<SheetLesson> sheetLessons) {
        ReconciliationResult result = new ReconciliationResult();
        boolean[] dbClaimed = new boolean[dbLessons.size()];
        boolean[] sheetClaimed = new boolean[sheetLessons.size()];

        List<RankedLesson> ranked = new ArrayList<>(dbLessons.size());
        for (int i = 0; i < dbLessons.size(); i++) {
            ranked.add(new RankedLesson(i, bestAttainableScore(dbLessons.get(i), sheetLessons)));
        }
        // List.sort is stable, so equal scores keep input order
        ranked.sort(Comparator.comparingDouble(RankedLesson::bestScore).reversed());

        for (RankedLesson entry : ranked) {
            DbLesson db = dbLessons.get(entry.index());
            int best = findBestCandidate(db, sheetLessons, sheetClaimed);
            if (best < 0) {
                continue;
            }
            SheetLesson sheet = sheetLessons.get(best);
            classifyPair(db, sheet, result);
            dbClaimed[entry.index()] = true;
            sheetClaimed[best] = true;
        }
        log.debug("Candidate pass paired {} DB lessons", result.getMatched().size() + result.getMismatched().size());

        for (int s = 0; s < sheetLessons.size(); s++) {
            if (sheetClaimed[s]) {
                continue;
            }
            SheetLesson sheet = sheetLessons.get(s);
            int partner = findPartialMatch(sheet, dbLessons, dbClaimed);
            if (partner >= 0) {
                DbLesson db = dbLessons.get(partner);
                result.addMismatched(new LessonMismatch(db, sheet, differenceReporter.diff(db, sheet)));
                dbClaimed[partner] = true;
                sheetClaimed[s] = true;
                log.debug("Partial match: lesson {} with {}", db.id(), sheet.describe());
            } else {
                result.addMissingInDb(sheet);
            }
        }

        for (int d = 0; d < dbLessons.size(); d++) {
            if (!dbClaimed[d]) {
                result.addMissingInSheet(dbLessons.get(d));
            }
        }

        return result;
    }

    private double bestAttainableScore(DbLesson db, List<SheetLesson> sheetLessons) {
        double best = 0.0;
        for (SheetLesson sheet : sheetLessons) {
            double score = scorer.score(db, sheet);
            if (score >= scorer.getCandidateThreshold() && score > best) {
                best = score;
            }
        }
        return best;
    }

    private int findBestCandidate(DbLesson db, List<SheetLesson> sheetLessons, boolean[] sheetClaimed) {
        int bestIndex = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        int candidates = 0;
        for (int s = 0; s < sheetLessons.size(); s++) {
            if (sheetClaimed[s]) {
                continue;
            }
            double score = scorer.score(db, sheetLessons.get(s));
            if (score < scorer.getCandidateThreshold()) {
                continue;
            }
            candidates++;
            if (score > bestScore) {
                bestScore = score;
                bestIndex = s;
            }
        }
        if (candidates > 1) {
            log.warn("match.ambiguous lessonId={} student='{}' candidates={} selected={} score={}",
                    db.id(), db.studentName(), candidates, sheetLessons.get(bestIndex).describe(), bestScore);
        }
        return bestIndex;
    }

    private int findPartialMatch(SheetLesson sheet, List<DbLesson> dbLessons, boolean[] dbClaimed) {
        for (int d = 0; d < dbLessons.size(); d++) {
            if (!dbClaimed[d] && scorer.isPartialMatch(dbLessons.get(d), sheet)) {
                return d;
            }
        }
        return -1;
    }

    private void classifyPair(DbLesson db, SheetLesson sheet, ReconciliationResult result) {
        List<String> differences = differenceReporter.diff(db, sheet);
        if (differences.isEmpty()) {
            result.addMatched(new LessonMatch(db, sheet));
        } else {
            result.addMismatched(new LessonMismatch(db, sheet, differences));
        }
    }

    private record RankedLesson(int index, double bestScore) {
    }
}
