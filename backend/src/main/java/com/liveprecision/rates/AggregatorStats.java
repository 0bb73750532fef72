package com.liveprecision.rates;

import java.util.List;
import java.util.Map;

public record AggregatorStats(
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        long cachedPairs,
        Map<String, Long> providerFailures,
        List<ProviderStats> providers
) {
}
