package com.liveprecision.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Provenance of an exchange rate. {@code details} carries provider-specific extras (e.g. the USD legs of a
 * cross rate) and is never null.
 */
@Builder(toBuilder = true)
public record RateMetadata(
        String source,
        Instant timestamp,
        long responseTimeMs,
        boolean fromCache,
        long cacheAgeSeconds,
        boolean inverted,
        boolean derived,
        boolean mockData,
        Map<String, String> details
) {

    public RateMetadata {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
