package com.liveprecision.healing;

public record HealingStatistics(
        long totalHealings,
        long successfulHealings,
        long failedHealings,
        double averageHealingTimeMs,
        long selfLearningImprovements
) {

    public double successRate() {
        return totalHealings == 0 ? 0.0 : (double) successfulHealings / totalHealings;
    }
}
