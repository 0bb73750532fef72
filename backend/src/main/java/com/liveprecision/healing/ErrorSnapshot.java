package com.liveprecision.healing;

import java.time.Instant;
import java.util.Map;

/**
 * Raw error as seen by detection, kept in the registry's recent-errors window.
 */
public record ErrorSnapshot(Instant timestamp, String errorType, String message, Map<String, Object> context) {

    public ErrorSnapshot {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
