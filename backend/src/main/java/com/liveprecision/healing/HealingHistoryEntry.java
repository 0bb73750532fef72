package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;

import java.time.Instant;

public record HealingHistoryEntry(
        String healingId,
        Instant timestamp,
        String errorType,
        ErrorCategory category,
        boolean success,
        String recommendation,
        long healingTimeMs
) {
}
