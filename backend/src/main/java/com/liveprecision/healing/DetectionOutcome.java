package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;

import java.util.Comparator;
import java.util.List;

/**
 * Patterns matched for one error. {@code newPatternLearned} is set when nothing matched and a pattern was
 * synthesized.
 */
public record DetectionOutcome(
        boolean success,
        String errorType,
        String message,
        List<ErrorPattern> patterns,
        boolean newPatternLearned,
        String failureReason
) {

    public DetectionOutcome {
        patterns = List.copyOf(patterns);
    }

    public static DetectionOutcome of(Throwable error, List<ErrorPattern> patterns, boolean newPatternLearned) {
        return new DetectionOutcome(true, error.getClass().getSimpleName(), error.getMessage(), patterns,
                newPatternLearned, null);
    }

    public static DetectionOutcome failed(Throwable error, String reason) {
        return new DetectionOutcome(false, error.getClass().getSimpleName(), error.getMessage(), List.of(), false, reason);
    }

    /** Category of the most severe matched pattern, SYSTEM when nothing matched. */
    public ErrorCategory primaryCategory() {
        return patterns.stream()
                .max(Comparator.comparing(ErrorPattern::getSeverity))
                .map(ErrorPattern::getCategory)
                .orElse(ErrorCategory.SYSTEM);
    }

    public Severity highestSeverity() {
        return patterns.stream()
                .map(ErrorPattern::getSeverity)
                .max(Comparator.naturalOrder())
                .orElse(Severity.LOW);
    }

    public List<String> patternIds() {
        return patterns.stream().map(ErrorPattern::getId).toList();
    }
}
