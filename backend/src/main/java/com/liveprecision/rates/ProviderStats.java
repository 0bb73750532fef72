package com.liveprecision.rates;

import java.time.Instant;

/**
 * Point-in-time counters of one provider. {@code averageResponseMs} covers successful requests only.
 */
public record ProviderStats(
        String provider,
        long requestCount,
        long errorCount,
        double averageResponseMs,
        Instant lastUpdate
) {
}
