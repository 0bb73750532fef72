package com.liveprecision.healing;

import java.util.List;
import java.util.Map;

/**
 * Result of the mitigation stage. {@code strategyApplied} is the first strategy that reported success.
 * Suggestions are reported only; nothing here has been applied to the failed call.
 */
public record MitigationOutcome(
        boolean success,
        String strategyApplied,
        boolean fallbackUsed,
        Map<String, Object> details,
        List<StrategyAttempt> attempts,
        String failureReason
) {

    public MitigationOutcome {
        details = details == null ? Map.of() : Map.copyOf(details);
        attempts = List.copyOf(attempts);
    }

    public static MitigationOutcome succeeded(StrategyAttempt winner, List<StrategyAttempt> attempts) {
        return new MitigationOutcome(true, winner.strategy(), winner.fallbackUsed(), winner.details(), attempts, null);
    }

    public static MitigationOutcome failed(List<StrategyAttempt> attempts, String reason) {
        return new MitigationOutcome(false, null, false, Map.of(), attempts, reason);
    }
}
