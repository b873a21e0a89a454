package com.lesson.reconciliation.similarity;

/**
 * Weights of the signals combined by {@link LessonScorer}.
 * Each weight is the contribution of its signal when it agrees; the date-range weight
 * is the maximum proximity contribution.
 */
public record ScoringWeights(
        double studentNameWeight,
        double durationWeight,
        double subjectWeight,
        double teacherWeight,
        double startDateWeight,
        double dateRangeWeight
) {
    public ScoringWeights {
        if (studentNameWeight < 0 || durationWeight < 0 || subjectWeight < 0
                || teacherWeight < 0 || startDateWeight < 0 || dateRangeWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
    }

    /**
     * Default weights: name 3, duration 2, subject 2, teacher 0.5, start date 0.5,
     * date-range proximity up to 2.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(3.0, 2.0, 2.0, 0.5, 0.5, 2.0);
    }

    /**
     * Highest score a pair can reach.
     */
    public double maxScore() {
        return studentNameWeight + durationWeight + subjectWeight
                + teacherWeight + startDateWeight + dateRangeWeight;
    }
}
