package com.lesson.reconciliation.api;

import com.lesson.reconciliation.matching.DifferenceReporter;
import com.lesson.reconciliation.similarity.LessonScorer;
import com.lesson.reconciliation.similarity.ScoringWeights;

/**
 * Options for reconciliation runs.
 * Configures signal weights, the candidate threshold and the labels used for
 * missing values.
 */
public class ReconciliationOptions {

    private static final String DEFAULT_PLACEHOLDER_STUDENT_NAME = "Unnamed Student";

    private final ScoringWeights scoringWeights;
    private final double candidateThreshold;
    private final String unassignedTeacherLabel;
    private final String placeholderStudentName;

    private ReconciliationOptions(Builder builder) {
        this.scoringWeights = builder.scoringWeights;
        this.candidateThreshold = builder.candidateThreshold;
        this.unassignedTeacherLabel = builder.unassignedTeacherLabel;
        this.placeholderStudentName = builder.placeholderStudentName;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public double getCandidateThreshold() {
        return candidateThreshold;
    }

    public String getUnassignedTeacherLabel() {
        return unassignedTeacherLabel;
    }

    /**
     * Name the schedule stores for lessons without a student; such lessons are not reconciled.
     */
    public String getPlaceholderStudentName() {
        return placeholderStudentName;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private double candidateThreshold = LessonScorer.DEFAULT_CANDIDATE_THRESHOLD;
        private String unassignedTeacherLabel = DifferenceReporter.DEFAULT_UNASSIGNED_LABEL;
        private String placeholderStudentName = DEFAULT_PLACEHOLDER_STUDENT_NAME;

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights is required");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder candidateThreshold(double candidateThreshold) {
            if (candidateThreshold < 0 || Double.isNaN(candidateThreshold)) {
                throw new IllegalArgumentException("candidateThreshold must be non-negative, got " + candidateThreshold);
            }
            this.candidateThreshold = candidateThreshold;
            return this;
        }

        public Builder unassignedTeacherLabel(String unassignedTeacherLabel) {
            if (unassignedTeacherLabel == null || unassignedTeacherLabel.isBlank()) {
                throw new IllegalArgumentException("unassignedTeacherLabel must not be blank");
            }
            this.unassignedTeacherLabel = unassignedTeacherLabel;
            return this;
        }

        public Builder placeholderStudentName(String placeholderStudentName) {
            this.placeholderStudentName = placeholderStudentName;
            return this;
        }

        public ReconciliationOptions build() {
            if (candidateThreshold > scoringWeights.maxScore()) {
                throw new IllegalArgumentException("candidateThreshold " + candidateThreshold
                        + " exceeds the highest attainable score " + scoringWeights.maxScore());
            }
            return new ReconciliationOptions(this);
        }
    }
}
