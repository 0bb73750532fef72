package com.liveprecision.healing;

import com.liveprecision.domain.Severity;

/**
 * Suggested action for one matched pattern, or the synthesized {@code system_level} entry.
 */
public record Recommendation(
        String patternId,
        Severity priority,
        String action,
        boolean autoApplicable,
        String effort,
        double successRate
) {

    public static final String SYSTEM_LEVEL = "system_level";
}
