package com.liveprecision.healing;

import com.liveprecision.common.BoundedHistory;
import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs detect → mitigate → process → correct → learn for one error. Stages run strictly in that order; a stage
 * that throws yields a failed outcome for that stage and the remaining stages still run. {@link #heal} never
 * throws.
 */
@Slf4j
public class HealingOrchestrator {

    static final String DISABLED_REASON = "Healing suite is disabled";
    private static final int STATUS_HISTORY = 10;

    private final ErrorPatternRegistry registry;
    private final ErrorMitigator mitigator;
    private final ErrorProcessor processor;
    private final ErrorCorrector corrector;
    private final DiagnosticSink sink;
    private final Clock clock;
    private final BoundedHistory<HealingHistoryEntry> history;

    private volatile boolean active;
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalHealingMs = new AtomicLong();
    private final AtomicLong selfLearningImprovements = new AtomicLong();

    public HealingOrchestrator(ErrorPatternRegistry registry, ErrorMitigator mitigator, ErrorProcessor processor,
                               ErrorCorrector corrector, DiagnosticSink sink, Clock clock, int historySize,
                               boolean active) {
        this.registry = registry;
        this.mitigator = mitigator;
        this.processor = processor;
        this.corrector = corrector;
        this.sink = sink;
        this.clock = clock;
        this.history = new BoundedHistory<>(historySize);
        this.active = active;
    }

    public HealingResult heal(Throwable error, Map<String, Object> context) {
        String healingId = UUID.randomUUID().toString();
        Instant timestamp = clock.instant();
        Map<String, Object> ctx = context == null ? Map.of() : context;
        if (!active) {
            return HealingResult.notAttempted(healingId, timestamp, error, DISABLED_REASON);
        }

        long started = System.nanoTime();
        List<StageReport> reports = new ArrayList<>();

        DetectionOutcome detection = runStage(healingId, HealingStage.DETECTING, reports,
                () -> registry.detect(error, ctx), DetectionOutcome::success,
                reason -> DetectionOutcome.failed(error, reason));
        List<ErrorPattern> patterns = detection.patterns();

        MitigationOutcome mitigation = runStage(healingId, HealingStage.MITIGATING, reports,
                () -> mitigator.mitigate(patterns, ctx), MitigationOutcome::success,
                reason -> MitigationOutcome.failed(List.of(), reason));

        ProcessingOutcome processing = runStage(healingId, HealingStage.PROCESSING, reports,
                () -> processor.process(error, ctx, patterns), ProcessingOutcome::success,
                ProcessingOutcome::failed);

        CorrectionOutcome correction = runStage(healingId, HealingStage.CORRECTING, reports,
                () -> corrector.correct(patterns, ctx), CorrectionOutcome::success,
                CorrectionOutcome::failed);

        LearningOutcome learning = runStage(healingId, HealingStage.LEARNING, reports,
                () -> learn(patterns, mitigation, correction), LearningOutcome::success,
                LearningOutcome::failed);

        boolean success = correction.success() || mitigation.success();
        FinalRecommendation recommendation = finalRecommendation(mitigation, correction, processing);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        HealingResult result = new HealingResult(healingId, timestamp, success, detection.primaryCategory(),
                detection, mitigation, processing, correction, learning, recommendation, elapsedMs, reports, null);
        record(result, error);
        emit(healingId, HealingStage.DONE, result);
        log.info("Healing {} for {} finished: success={} action={} ({} ms)", healingId,
                error.getClass().getSimpleName(), success, recommendation.action(), elapsedMs);
        return result;
    }

    public HealingStatistics statistics() {
        long count = total.get();
        double average = count == 0 ? 0.0 : (double) totalHealingMs.get() / count;
        return new HealingStatistics(count, successful.get(), failed.get(), average, selfLearningImprovements.get());
    }

    public HealingStatus status() {
        HealingStatistics stats = statistics();
        List<ErrorPattern> patterns = registry.patterns();
        Set<ErrorCategory> categories = EnumSet.noneOf(ErrorCategory.class);
        patterns.forEach(p -> categories.add(p.getCategory()));
        return new HealingStatus(active, stats, history.latest(STATUS_HISTORY), patterns.size(),
                Set.copyOf(categories), stats.successRate());
    }

    public List<HealingHistoryEntry> history() {
        return history.snapshot();
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
        log.info("Healing suite {}", active ? "activated" : "deactivated");
    }

    /** Clears the mitigator's network retry counter once {@code endpoint} has recovered. */
    public void resetRetries(String endpoint) {
        mitigator.resetRetries(endpoint);
    }

    public ErrorPatternRegistry getRegistry() {
        return registry;
    }

    private LearningOutcome learn(List<ErrorPattern> patterns, MitigationOutcome mitigation,
                                  CorrectionOutcome correction) {
        int updated = 0;
        Map<String, Double> rates = new LinkedHashMap<>();
        for (ErrorPattern p : patterns) {
            if (correction.success()) {
                registry.recordOutcome(p.getId(), true);
                updated++;
            } else if (!mitigation.success()) {
                registry.recordOutcome(p.getId(), false);
                updated++;
            }
            rates.put(p.getId(), p.getSuccessRate());
        }
        int strategiesLearned = (int) mitigation.attempts().stream().filter(StrategyAttempt::success).count();
        selfLearningImprovements.addAndGet(strategiesLearned);
        return new LearningOutcome(true, updated, strategiesLearned, rates, null);
    }

    private static FinalRecommendation finalRecommendation(MitigationOutcome mitigation, CorrectionOutcome correction,
                                                           ProcessingOutcome processing) {
        if (correction.success()) {
            return new FinalRecommendation(FinalRecommendation.AUTO_FIX_APPLIED, 0.9,
                    correction.payload() == null ? "Error was automatically corrected" : correction.payload().explanation());
        }
        if (mitigation.success()) {
            return new FinalRecommendation(FinalRecommendation.MITIGATION_APPLIED, 0.7,
                    "Mitigated with " + mitigation.strategyApplied());
        }
        return processing.recommendations().stream()
                .max(Comparator.comparingDouble(Recommendation::successRate))
                .map(r -> new FinalRecommendation(FinalRecommendation.MANUAL_INTERVENTION_REQUIRED, r.successRate(),
                        r.action()))
                .orElseGet(() -> new FinalRecommendation(FinalRecommendation.ESCALATE, 0.1,
                        "Unable to heal error automatically, escalation required"));
    }

    private <T> T runStage(String healingId, HealingStage stage, List<StageReport> reports, Supplier<T> body,
                           Predicate<T> succeeded, Function<String, T> onFailure) {
        long started = System.nanoTime();
        T outcome;
        String error = null;
        try {
            outcome = body.get();
        } catch (RuntimeException e) {
            log.error("Healing {} stage {} failed", healingId, stage, e);
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            outcome = onFailure.apply(error);
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        reports.add(new StageReport(stage, error == null && succeeded.test(outcome), elapsedMs, error));
        emit(healingId, stage, outcome);
        return outcome;
    }

    private void emit(String healingId, HealingStage stage, Object outcome) {
        try {
            sink.accept(healingId, stage, outcome);
        } catch (RuntimeException e) {
            log.warn("Diagnostic sink rejected {} stage {}: {}", healingId, stage, e.getMessage());
        }
    }

    private void record(HealingResult result, Throwable error) {
        total.incrementAndGet();
        if (result.success()) {
            successful.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
        totalHealingMs.addAndGet(result.healingTimeMs());
        history.add(new HealingHistoryEntry(result.healingId(), result.timestamp(), error.getClass().getSimpleName(),
                result.primaryCategory(), result.success(), result.recommendation().action(), result.healingTimeMs()));
    }
}
