package com.lesson.reconciliation.metrics;

import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.OutcomeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lesson.reconciliation.duration}: Timer</li>
 *   <li>{@code lesson.reconciliation.outcomes}: DistributionSummary (tag: outcome)</li>
 *   <li>{@code lesson.reconciliation.pair.score}: DistributionSummary</li>
 *   <li>{@code lesson.alignment}: Counter (tag: status = APPLIED, BLOCKED or FAILED)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Timer reconciliationTimer;
    private final DistributionSummary pairScoreSummary;
    private final Map<OutcomeType, DistributionSummary> outcomeSummaries = new ConcurrentHashMap<>();
    private final Map<String, Counter> alignmentCounters = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.reconciliationTimer = Timer.builder("lesson.reconciliation.duration")
                .description("Duration of reconciliation runs")
                .register(registry);
        this.pairScoreSummary = DistributionSummary.builder("lesson.reconciliation.pair.score")
                .description("Scores of the pairs chosen by the candidate pass")
                .register(registry);
    }

    @Override
    public void recordReconciliationDuration(Duration duration) {
        reconciliationTimer.record(duration);
    }

    @Override
    public void recordOutcomeCount(OutcomeType type, int count) {
        DistributionSummary summary = outcomeSummaries.computeIfAbsent(type, t ->
                DistributionSummary.builder("lesson.reconciliation.outcomes")
                        .description("Lessons per outcome bucket per run")
                        .tag("outcome", t.name())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordPairScore(double score) {
        pairScoreSummary.record(score);
    }

    @Override
    public void incrementAlignmentApplied() {
        alignmentCounter("APPLIED").increment();
    }

    @Override
    public void incrementAlignmentRejected(AlignmentState.Status status) {
        alignmentCounter(status.name()).increment();
    }

    private Counter alignmentCounter(String status) {
        return alignmentCounters.computeIfAbsent(status, s ->
                Counter.builder("lesson.alignment")
                        .description("Alignment attempts by status")
                        .tag("status", s)
                        .register(registry));
    }
}
