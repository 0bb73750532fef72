package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;

import java.util.List;
import java.util.Set;

public record HealingStatus(
        boolean active,
        HealingStatistics statistics,
        List<HealingHistoryEntry> recentHistory,
        int patternsLearned,
        Set<ErrorCategory> categoriesTracked,
        double successRate
) {
}
