package com.liveprecision.healing;

import java.util.Map;

/**
 * Success rates after learning, keyed by pattern id.
 */
public record LearningOutcome(boolean success, int patternsUpdated, int strategiesLearned,
                              Map<String, Double> successRates, String failureReason) {

    public LearningOutcome {
        successRates = Map.copyOf(successRates);
    }

    public static LearningOutcome failed(String reason) {
        return new LearningOutcome(false, 0, 0, Map.of(), reason);
    }
}
