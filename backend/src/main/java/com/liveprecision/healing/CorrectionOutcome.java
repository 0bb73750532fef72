package com.liveprecision.healing;

import java.util.List;

/**
 * Result of the correction stage. {@code attempted} lists every pattern id tried, in order.
 */
public record CorrectionOutcome(
        boolean success,
        String appliedPatternId,
        CorrectionPayload payload,
        List<String> attempted,
        List<String> successful,
        List<String> failed,
        String failureReason
) {

    public CorrectionOutcome {
        attempted = List.copyOf(attempted);
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
    }

    public static CorrectionOutcome failed(String reason) {
        return new CorrectionOutcome(false, null, null, List.of(), List.of(), List.of(), reason);
    }
}
