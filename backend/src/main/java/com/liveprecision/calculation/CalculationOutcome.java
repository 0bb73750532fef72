package com.liveprecision.calculation;

import com.liveprecision.healing.HealingResult;

/**
 * Either {@code success} with {@code result} and {@code metadata}, or a failure with {@code error} and the
 * {@code healingResult}. A cancelled call carries a healing result that was never attempted.
 * <p>
 * When healing produced a correction and the retried calculation succeeded, the outcome still reports the
 * original failure and carries the retried value in {@code healedResult} with {@code healingApplied} set.
 */
public record CalculationOutcome(
        boolean success,
        String calculationId,
        String result,
        CalculationMetadata metadata,
        CalculationError error,
        HealingResult healingResult,
        boolean healingApplied,
        String healedResult
) {

    public static CalculationOutcome success(String calculationId, String result, CalculationMetadata metadata) {
        return new CalculationOutcome(true, calculationId, result, metadata, null, null, false, null);
    }

    public static CalculationOutcome failure(String calculationId, CalculationError error, HealingResult healing,
                                             String healedResult, CalculationMetadata healedMetadata) {
        return new CalculationOutcome(false, calculationId, null, healedMetadata, error, healing,
                healedResult != null, healedResult);
    }
}
