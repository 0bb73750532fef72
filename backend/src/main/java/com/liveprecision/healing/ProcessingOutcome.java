package com.liveprecision.healing;

import java.util.List;

public record ProcessingOutcome(
        boolean success,
        ImpactAssessment impact,
        List<Recommendation> recommendations,
        DiagnosticBundle diagnostics,
        List<String> steps,
        long processingTimeMs,
        String failureReason
) {

    public ProcessingOutcome {
        recommendations = List.copyOf(recommendations);
        steps = List.copyOf(steps);
    }

    public static ProcessingOutcome failed(String reason) {
        return new ProcessingOutcome(false, null, List.of(), null, List.of(), 0L, reason);
    }
}
