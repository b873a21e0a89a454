package com.lesson.reconciliation.similarity;

import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.rules.LessonNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores how likely a DB lesson and a sheet row describe the same real-world lesson.
 * Formula: score = name + duration + subject + teacher + startDate + dateRangeProximity,
 * each term contributing its weight when the signal agrees.
 *
 * <p>Name, duration and subject alone sum to 7 with the default weights, so the default
 * candidate threshold of 8 also demands some temporal plausibility.</p>
 */
public class LessonScorer {
    private static final Logger log = LoggerFactory.getLogger(LessonScorer.class);

    public static final double DEFAULT_CANDIDATE_THRESHOLD = 8.0;

    // Proximity curve on the default 2.0 scale; rescaled for other date-range weights.
    private static final double CURVE_MAX = 2.0;
    private static final double CURVE_WEEK = 1.5;
    private static final double CURVE_MONTH = 1.0;
    private static final double CURVE_QUARTER = 0.5;

    private final LessonNormalizer normalizer;
    private final ScoringWeights weights;
    private final double candidateThreshold;

    public LessonScorer() {
        this(new LessonNormalizer(), ScoringWeights.defaultWeights(), DEFAULT_CANDIDATE_THRESHOLD);
    }

    public LessonScorer(LessonNormalizer normalizer, ScoringWeights weights, double candidateThreshold) {
        this.normalizer = normalizer;
        this.weights = weights;
        this.candidateThreshold = candidateThreshold;
    }

    /**
     * Computes the weighted score of a pair.
     */
    public double score(DbLesson db, SheetLesson sheet) {
        return scoreWithBreakdown(db, sheet).total();
    }

    /**
     * Computes the contribution of every signal.
     */
    public ScoreBreakdown scoreWithBreakdown(DbLesson db, SheetLesson sheet) {
        double name = namesMatch(db, sheet) ? weights.studentNameWeight() : 0.0;
        double duration = durationsMatch(db, sheet) ? weights.durationWeight() : 0.0;
        double subject = subjectsMatch(db, sheet) ? weights.subjectWeight() : 0.0;
        double teacher = teachersMatch(db, sheet) ? weights.teacherWeight() : 0.0;
        double startDate = startDatesMatch(db, sheet) ? weights.startDateWeight() : 0.0;
        double proximity = dateRangeProximity(db, sheet);

        ScoreBreakdown breakdown = new ScoreBreakdown(name, duration, subject, teacher, startDate, proximity);
        if (log.isTraceEnabled()) {
            log.trace("Score for lesson {} vs {}: {}", db.id(), sheet.describe(), breakdown);
        }
        return breakdown;
    }

    /**
     * Returns true if the pair scores at least the candidate threshold.
     */
    public boolean isCandidateMatch(DbLesson db, SheetLesson sheet) {
        return score(db, sheet) >= candidateThreshold;
    }

    /**
     * Looser test used for sheet rows nothing claimed: same student and the same
     * duration or subject.
     */
    public boolean isPartialMatch(DbLesson db, SheetLesson sheet) {
        if (isBlank(db.studentName()) || isBlank(sheet.studentName())) {
            return false;
        }
        return namesMatch(db, sheet) && (durationsMatch(db, sheet) || subjectsMatch(db, sheet));
    }

    /**
     * Scores how close the sheet start date lies to the DB lesson's
     * {@code [startDate, endDate)} range. Inside the range gives the full date-range
     * weight; outside it decays with the day distance to the nearest bound and reaches
     * zero after 90 days. Missing or unreadable dates give zero.
     */
    public double dateRangeProximity(DbLesson db, SheetLesson sheet) {
        Optional<LocalDate> start = normalizer.parseDate(db.startDate());
        Optional<LocalDate> end = normalizer.parseDate(db.endDate());
        Optional<LocalDate> sheetDate = normalizer.parseDate(sheet.startDate());
        if (start.isEmpty() || end.isEmpty() || sheetDate.isEmpty()) {
            return 0.0;
        }

        LocalDate date = sheetDate.get();
        if (!date.isBefore(start.get()) && date.isBefore(end.get())) {
            return weights.dateRangeWeight();
        }

        long days = date.isBefore(start.get())
                ? ChronoUnit.DAYS.between(date, start.get())
                : ChronoUnit.DAYS.between(end.get(), date);
        return proximityCurve(days) * (weights.dateRangeWeight() / CURVE_MAX);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public double getCandidateThreshold() {
        return candidateThreshold;
    }

    boolean namesMatch(DbLesson db, SheetLesson sheet) {
        return normalizer.normalizeName(db.studentName()).equals(normalizer.normalizeName(sheet.studentName()));
    }

    boolean durationsMatch(DbLesson db, SheetLesson sheet) {
        return db.duration() == sheet.duration();
    }

    boolean subjectsMatch(DbLesson db, SheetLesson sheet) {
        return !isBlank(db.subjectName()) && !isBlank(sheet.subject())
                && db.subjectName().equalsIgnoreCase(sheet.subject());
    }

    boolean teachersMatch(DbLesson db, SheetLesson sheet) {
        String dbTeacher = db.teacherName() != null ? db.teacherName() : "";
        return dbTeacher.toLowerCase(Locale.ROOT).equals(sheet.teacher().toLowerCase(Locale.ROOT));
    }

    boolean startDatesMatch(DbLesson db, SheetLesson sheet) {
        String dbDate = normalizer.normalizeDate(db.startDate());
        String sheetDate = normalizer.normalizeDate(sheet.startDate());
        return dbDate == null ? sheetDate == null : dbDate.equals(sheetDate);
    }

    private static double proximityCurve(long days) {
        if (days <= 7) {
            return CURVE_WEEK - (days / 7.0) * (CURVE_WEEK - CURVE_MONTH);
        } else if (days <= 30) {
            return CURVE_MONTH - ((days - 7) / 23.0) * (CURVE_MONTH - CURVE_QUARTER);
        } else if (days <= 90) {
            return CURVE_QUARTER - ((days - 30) / 60.0) * CURVE_QUARTER;
        }
        return 0.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Contribution of each signal to a pair's score.
     */
    public record ScoreBreakdown(
            double studentName,
            double duration,
            double subject,
            double teacher,
            double startDate,
            double dateRangeProximity
    ) {
        public double total() {
            return studentName + duration + subject + teacher + startDate + dateRangeProximity;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                    "ScoreBreakdown{name=%.2f, duration=%.2f, subject=%.2f, teacher=%.2f, startDate=%.2f, dateRange=%.2f, total=%.2f}",
                    studentName, duration, subject, teacher, startDate, dateRangeProximity, total());
        }
    }
}
