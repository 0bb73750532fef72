package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Complete record of one healing attempt. Every stage outcome is present, including failed ones.
 */
public record HealingResult(
        String healingId,
        Instant timestamp,
        boolean success,
        ErrorCategory primaryCategory,
        DetectionOutcome detection,
        MitigationOutcome mitigation,
        ProcessingOutcome processing,
        CorrectionOutcome correction,
        LearningOutcome learning,
        FinalRecommendation recommendation,
        long healingTimeMs,
        List<StageReport> stages,
        String reason
) {

    public HealingResult {
        stages = List.copyOf(stages);
    }

    /**
     * Result for an error that never went through the healing stages, e.g. while the suite is disabled.
     */
    public static HealingResult notAttempted(String healingId, Instant timestamp, Throwable error, String reason) {
        return new HealingResult(healingId, timestamp, false, ErrorCategory.SYSTEM,
                DetectionOutcome.failed(error, reason), MitigationOutcome.failed(List.of(), reason),
                ProcessingOutcome.failed(reason), CorrectionOutcome.failed(reason), LearningOutcome.failed(reason),
                new FinalRecommendation(FinalRecommendation.ESCALATE, 0.1, reason), 0L, List.of(), reason);
    }

    public boolean correctionApplied() {
        return correction != null && correction.success();
    }

    public Optional<CorrectionPayload> payload() {
        return correctionApplied() ? Optional.ofNullable(correction.payload()) : Optional.empty();
    }
}
