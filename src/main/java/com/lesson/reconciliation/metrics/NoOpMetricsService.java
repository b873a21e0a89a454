package com.lesson.reconciliation.metrics;

import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.OutcomeType;

import java.time.Duration;

/**
 * {@link MetricsService} that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconciliationDuration(Duration duration) {
    }

    @Override
    public void recordOutcomeCount(OutcomeType type, int count) {
    }

    @Override
    public void recordPairScore(double score) {
    }

    @Override
    public void incrementAlignmentApplied() {
    }

    @Override
    public void incrementAlignmentRejected(AlignmentState.Status status) {
    }
}
