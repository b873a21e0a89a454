package com.lesson.reconciliation.metrics;

import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.OutcomeType;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without
 * any metrics dependency on the classpath.
 */
public interface MetricsService {

    /**
     * Records the wall-clock time of one reconciliation run.
     */
    void recordReconciliationDuration(Duration duration);

    /**
     * Records how many lessons a run put in one outcome bucket.
     */
    void recordOutcomeCount(OutcomeType type, int count);

    /**
     * Records the score of a matched or mismatched pair.
     */
    void recordPairScore(double score);

    /**
     * Counts an alignment that was written to the store.
     */
    void incrementAlignmentApplied();

    /**
     * Counts an alignment that did not go through; {@code status} is BLOCKED or FAILED.
     */
    void incrementAlignmentRejected(AlignmentState.Status status);
}
