package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;

import java.util.Map;

/**
 * One mitigation strategy tried for one pattern.
 */
public record StrategyAttempt(
        String patternId,
        ErrorCategory category,
        String strategy,
        boolean success,
        boolean fallbackUsed,
        Map<String, Object> details
) {

    public StrategyAttempt {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
