package com.liveprecision.healing;

import java.util.List;
import java.util.Map;

/**
 * Structured diagnostics intended for external logging.
 */
public record DiagnosticBundle(
        String fingerprint,
        String errorType,
        String message,
        List<String> stackFrames,
        Map<String, String> context,
        ResourceSnapshot resources,
        List<String> hints,
        List<String> keywords
) {

    public DiagnosticBundle {
        stackFrames = List.copyOf(stackFrames);
        context = Map.copyOf(context);
        hints = List.copyOf(hints);
        keywords = List.copyOf(keywords);
    }
}
