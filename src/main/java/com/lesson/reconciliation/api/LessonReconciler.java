package com.lesson.reconciliation.api;

import com.lesson.reconciliation.align.AlignmentService;
import com.lesson.reconciliation.align.AlignmentTracker;
import com.lesson.reconciliation.align.ApplyResult;
import com.lesson.reconciliation.audit.AuditAction;
import com.lesson.reconciliation.audit.AuditService;
import com.lesson.reconciliation.conflict.ConflictGuard;
import com.lesson.reconciliation.conflict.GuardResult;
import com.lesson.reconciliation.conflict.StudentSlotGuard;
import com.lesson.reconciliation.core.model.AlignmentState;
import com.lesson.reconciliation.core.model.DbLesson;
import com.lesson.reconciliation.core.model.LessonMatch;
import com.lesson.reconciliation.core.model.LessonMismatch;
import com.lesson.reconciliation.core.model.OutcomeType;
import com.lesson.reconciliation.core.model.ReconciliationResult;
import com.lesson.reconciliation.core.model.SheetLesson;
import com.lesson.reconciliation.logging.LogContext;
import com.lesson.reconciliation.matching.DifferenceReporter;
import com.lesson.reconciliation.matching.ReconciliationEngine;
import com.lesson.reconciliation.metrics.MetricsService;
import com.lesson.reconciliation.metrics.NoOpMetricsService;
import com.lesson.reconciliation.rules.LessonNormalizer;
import com.lesson.reconciliation.similarity.LessonScorer;
import com.lesson.reconciliation.source.DbLessonSource;
import com.lesson.reconciliation.source.SheetLessonSource;
import com.lesson.reconciliation.store.LessonStore;
import com.lesson.reconciliation.tracing.NoOpTracingService;
import com.lesson.reconciliation.tracing.Span;
import com.lesson.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for lesson reconciliation.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * LessonReconciler reconciler = LessonReconciler.builder()
 *     .dbLessonSource(dbSource)
 *     .sheetLessonSource(new JsonSheetLessonSource(feed))
 *     .lessonStore(store)
 *     .build();
 *
 * ReconciliationResult result = reconciler.reconcile(schoolId);
 * for (LessonMismatch mismatch : result.getMismatched()) {
 *     GuardResult guard = reconciler.checkAlignmentConflict(mismatch.dbLesson(), mismatch.sheetLesson());
 *     if (guard.isClear()) {
 *         reconciler.alignMismatch(result, mismatch);
 *     }
 * }
 * </pre>
 *
 * <p>Reconciliation itself never fails because of record content; the worst case is a
 * lesson landing in a missing bucket. Alignment reports every problem through its
 * {@link ApplyResult}.</p>
 */
public class LessonReconciler {
    private static final Logger log = LoggerFactory.getLogger(LessonReconciler.class);

    private final DbLessonSource dbLessonSource;
    private final SheetLessonSource sheetLessonSource;
    private final LessonStore lessonStore;
    private final ReconciliationOptions options;
    private final LessonScorer scorer;
    private final ReconciliationEngine engine;
    private final ConflictGuard conflictGuard;
    private final AlignmentService alignmentService;
    private final AlignmentTracker alignmentTracker;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AuditService auditService;

    private LessonReconciler(Builder builder) {
        this.dbLessonSource = builder.dbLessonSource;
        this.sheetLessonSource = builder.sheetLessonSource;
        this.lessonStore = builder.lessonStore;
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.auditService = builder.auditService != null
                ? builder.auditService : new AuditService();

        LessonNormalizer normalizer = new LessonNormalizer();
        this.scorer = new LessonScorer(normalizer, options.getScoringWeights(), options.getCandidateThreshold());
        this.engine = new ReconciliationEngine(scorer,
                new DifferenceReporter(normalizer, options.getUnassignedTeacherLabel()));
        this.alignmentTracker = new AlignmentTracker();

        if (lessonStore != null) {
            this.conflictGuard = new ConflictGuard(lessonStore);
            this.alignmentService = new AlignmentService(lessonStore, conflictGuard,
                    new StudentSlotGuard(lessonStore, normalizer), normalizer, auditService, metricsService);
        } else {
            this.conflictGuard = null;
            this.alignmentService = null;
        }
    }

    // ========== Scoring API ==========

    /**
     * Scores how likely the two lessons describe the same real-world lesson.
     */
    public double scoreRecordPair(DbLesson db, SheetLesson sheet) {
        return scorer.score(db, sheet);
    }

    public LessonScorer.ScoreBreakdown explainScore(DbLesson db, SheetLesson sheet) {
        return scorer.scoreWithBreakdown(db, sheet);
    }

    public boolean isCandidateMatch(DbLesson db, SheetLesson sheet) {
        return scorer.isCandidateMatch(db, sheet);
    }

    // ========== Reconciliation API ==========

    /**
     * Loads both sides for a tenant and reconciles them.
     *
     * @throws IllegalStateException if either source is not configured
     */
    public ReconciliationResult reconcile(String tenantId) {
        if (dbLessonSource == null || sheetLessonSource == null) {
            throw new IllegalStateException("Both a DbLessonSource and a SheetLessonSource are required to reconcile by tenant");
        }
        try (LogContext logCtx = LogContext.forReconciliation(LogContext.generateCorrelationId(), tenantId)) {
            List<DbLesson> dbLessons = dbLessonSource.fetchDbLessons(tenantId);
            List<SheetLesson> sheetLessons = sheetLessonSource.fetchSheetLessons(tenantId);
            log.info("reconciliation.loaded tenantId={} dbLessons={} sheetLessons={}",
                    tenantId, dbLessons.size(), sheetLessons.size());
            return run(tenantId, dbLessons, sheetLessons);
        }
    }

    /**
     * Reconciles already loaded lessons. Lessons without a usable student name are
     * dropped first and appear in no bucket.
     */
    public ReconciliationResult reconcile(List<DbLesson> dbLessons, List<SheetLesson> sheetLessons) {
        return run(null, dbLessons, sheetLessons);
    }

    private ReconciliationResult run(String tenantId, List<DbLesson> dbLessons, List<SheetLesson> sheetLessons) {
        long startNanos = System.nanoTime();
        Map<String, String> attributes = tenantId != null ? Map.of("tenantId", tenantId) : Map.of();
        try (Span span = tracingService.startSpan("lesson.reconcile", attributes)) {
            List<DbLesson> validDb = dbLessons.stream().filter(this::isValid).toList();
            List<SheetLesson> validSheet = sheetLessons.stream().filter(this::isValid).toList();
            if (validDb.size() < dbLessons.size() || validSheet.size() < sheetLessons.size()) {
                log.info("reconciliation.filtered validDb={}/{} validSheet={}/{}",
                        validDb.size(), dbLessons.size(), validSheet.size(), sheetLessons.size());
            }
            if (validDb.isEmpty()) {
                log.warn("reconciliation.no-db-lessons tenantId={}", tenantId);
            }
            if (validSheet.isEmpty()) {
                log.warn("reconciliation.no-sheet-lessons tenantId={}", tenantId);
            }

            ReconciliationResult result = engine.reconcile(validDb, validSheet);
            result.recordDropped(dbLessons.size() - validDb.size(), sheetLessons.size() - validSheet.size());

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            recordMetrics(result, elapsed);
            for (OutcomeType type : OutcomeType.values()) {
                span.setAttribute(type.name().toLowerCase(Locale.ROOT), result.count(type));
            }
            auditService.record(AuditAction.RECONCILIATION_COMPLETED, tenantId, "reconciler", Map.of(
                    "matched", result.count(OutcomeType.MATCHED),
                    "mismatched", result.count(OutcomeType.MISMATCHED),
                    "missingInDb", result.count(OutcomeType.MISSING_IN_DB),
                    "missingInSheet", result.count(OutcomeType.MISSING_IN_SHEET)));
            log.info("reconciliation.completed tenantId={} result={} durationMs={}",
                    tenantId, result, elapsed.toMillis());
            return result;
        }
    }

    private void recordMetrics(ReconciliationResult result, Duration elapsed) {
        metricsService.recordReconciliationDuration(elapsed);
        for (OutcomeType type : OutcomeType.values()) {
            metricsService.recordOutcomeCount(type, result.count(type));
        }
        for (LessonMatch match : result.getMatched()) {
            metricsService.recordPairScore(scorer.score(match.dbLesson(), match.sheetLesson()));
        }
        for (LessonMismatch mismatch : result.getMismatched()) {
            metricsService.recordPairScore(scorer.score(mismatch.dbLesson(), mismatch.sheetLesson()));
        }
    }

    private boolean isValid(DbLesson lesson) {
        return lesson != null
                && lesson.studentName() != null
                && !lesson.studentName().isBlank()
                && !lesson.studentName().equals(options.getPlaceholderStudentName());
    }

    private boolean isValid(SheetLesson lesson) {
        return lesson != null && !lesson.studentName().isBlank();
    }

    // ========== Alignment API ==========

    /**
     * Checks whether aligning the DB lesson to the sheet row would double-book its teacher.
     */
    public GuardResult checkAlignmentConflict(DbLesson db, SheetLesson sheet) {
        requireStore();
        return conflictGuard.check(db, sheet);
    }

    /**
     * Overwrites the DB lesson with the sheet row's values. The conflict guard is
     * re-run before writing. Moving the pair between buckets is up to the caller;
     * see {@link #alignMismatch}.
     */
    public ApplyResult applyAlignment(DbLesson db, SheetLesson sheet) {
        requireStore();
        try (Span span = tracingService.startSpan("lesson.align", Map.of("lessonId", db.id()))) {
            ApplyResult result = alignmentService.align(db, sheet);
            if (result.isFailure()) {
                span.markError(result.message());
            }
            return result;
        }
    }

    /**
     * Guards and applies the alignment of one mismatch, tracking its state, and on
     * success moves it from mismatched to matched in {@code result}.
     */
    public ApplyResult alignMismatch(ReconciliationResult result, LessonMismatch mismatch) {
        requireStore();
        String lessonId = mismatch.dbLesson().id();
        if (!alignmentTracker.begin(lessonId)) {
            return ApplyResult.failure("An alignment of this lesson is already in progress.");
        }
        try {
            GuardResult guard = conflictGuard.check(mismatch.dbLesson(), mismatch.sheetLesson());
            if (guard.blocked()) {
                alignmentTracker.blocked(lessonId, guard.reason());
                return ApplyResult.blocked(guard.reason());
            }

            ApplyResult applied = applyAlignment(mismatch.dbLesson(), mismatch.sheetLesson());
            if (applied.success()) {
                result.markAligned(mismatch, applied.updatedLesson());
                alignmentTracker.succeeded(lessonId);
            } else if (applied.isBlocked()) {
                alignmentTracker.blocked(lessonId, applied.message());
            } else {
                alignmentTracker.failed(lessonId, applied.message());
            }
            return applied;
        } catch (RuntimeException e) {
            alignmentTracker.failed(lessonId, e.getMessage());
            throw e;
        }
    }

    /**
     * Gets the state of the last unfinished or unsuccessful alignment of a lesson.
     */
    public Optional<AlignmentState> getAlignmentState(String lessonId) {
        return alignmentTracker.get(lessonId);
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    private void requireStore() {
        if (lessonStore == null) {
            throw new IllegalStateException("A LessonStore is required for alignment");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DbLessonSource dbLessonSource;
        private SheetLessonSource sheetLessonSource;
        private LessonStore lessonStore;
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;

        public Builder dbLessonSource(DbLessonSource dbLessonSource) {
            this.dbLessonSource = dbLessonSource;
            return this;
        }

        public Builder sheetLessonSource(SheetLessonSource sheetLessonSource) {
            this.sheetLessonSource = sheetLessonSource;
            return this;
        }

        public Builder lessonStore(LessonStore lessonStore) {
            this.lessonStore = lessonStore;
            return this;
        }

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public LessonReconciler build() {
            if (options == null) {
                throw new IllegalStateException("options must not be null");
            }
            return new LessonReconciler(this);
        }
    }
}
