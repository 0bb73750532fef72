package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;

import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Impact assessment, ranked recommendations and a diagnostic bundle for an error. Runs regardless of
 * mitigation outcome and does not fail on well-formed input.
 */
public class ErrorProcessor {

    static final int SYSTEM_LEVEL_THRESHOLD = 10;
    private static final int HIGH_THRESHOLD = 5;
    private static final int FINGERPRINT_MESSAGE_LENGTH = 100;

    private final int stackDepth;

    public ErrorProcessor(int stackDepth) {
        this.stackDepth = stackDepth;
    }

    public ProcessingOutcome process(Throwable error, Map<String, Object> context, List<ErrorPattern> patterns) {
        long started = System.nanoTime();
        List<String> steps = new ArrayList<>();

        ImpactAssessment impact = assessImpact(patterns);
        steps.add("impact_assessed");
        List<Recommendation> recommendations = recommend(patterns, impact);
        steps.add("recommendations_generated");
        DiagnosticBundle diagnostics = diagnose(error, context, patterns);
        steps.add("diagnostics_collected");

        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        return new ProcessingOutcome(true, impact, recommendations, diagnostics, steps, elapsedMs, null);
    }

    static int weight(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 10;
            case HIGH -> 5;
            case MEDIUM -> 2;
            case LOW -> 1;
        };
    }

    static Severity priorityFor(int score) {
        if (score >= SYSTEM_LEVEL_THRESHOLD) {
            return Severity.CRITICAL;
        }
        return score >= HIGH_THRESHOLD ? Severity.HIGH : Severity.MEDIUM;
    }

    ImpactAssessment assessImpact(List<ErrorPattern> patterns) {
        int score = 0;
        String userImpact = "low";
        Set<String> components = new LinkedHashSet<>();
        for (ErrorPattern p : patterns) {
            score += weight(p.getSeverity());
            if (p.getSeverity() == Severity.CRITICAL) {
                userImpact = "high";
            } else if (p.getSeverity() == Severity.HIGH && userImpact.equals("low")) {
                userImpact = "medium";
            }
            String component = component(p.getCategory());
            if (component != null) {
                components.add(component);
            }
        }
        String downtime = score < HIGH_THRESHOLD ? "none" : score < SYSTEM_LEVEL_THRESHOLD ? "minimal" : "significant";
        return new ImpactAssessment(score, priorityFor(score), userImpact, List.copyOf(components), downtime);
    }

    List<Recommendation> recommend(List<ErrorPattern> patterns, ImpactAssessment impact) {
        List<Recommendation> out = new ArrayList<>();
        for (ErrorPattern p : patterns) {
            out.add(new Recommendation(p.getId(), impact.priority(), p.getFixStrategy(), p.isAutoFixAvailable(),
                    p.isAutoFixAvailable() ? "low" : "medium", p.getSuccessRate()));
        }
        if (impact.score() >= SYSTEM_LEVEL_THRESHOLD) {
            out.add(new Recommendation(Recommendation.SYSTEM_LEVEL, Severity.CRITICAL,
                    "Add circuit breakers and fallback paths around the failing components", false, "high", 0.9));
        }
        return out;
    }

    DiagnosticBundle diagnose(Throwable error, Map<String, Object> context, List<ErrorPattern> patterns) {
        String errorType = error.getClass().getSimpleName();
        String message = error.getMessage() == null ? "" : error.getMessage();

        List<String> frames = Arrays.stream(error.getStackTrace())
                .limit(stackDepth)
                .map(StackTraceElement::toString)
                .toList();

        Map<String, String> contextVariables = new TreeMap<>();
        context.forEach((k, v) -> {
            if (v != null) {
                contextVariables.put(k, String.valueOf(v));
            }
        });

        Set<String> hints = new LinkedHashSet<>();
        for (ErrorPattern p : patterns) {
            switch (p.getCategory()) {
                case CALCULATION, VALIDATION, PRECISION -> hints.add("Check input validation for calculation parameters");
                case NETWORK -> hints.add("Verify network connectivity to external services");
                case DATABASE -> hints.add("Validate database connection pool status");
                case CACHE -> hints.add("Check cache availability and eviction settings");
                case CURRENCY -> hints.add("Confirm the currency codes are listed as supported");
                case SYSTEM -> hints.add("Inspect the stack frames for the failing component");
            }
        }
        hints.add("Review recent system resource usage patterns");

        Set<String> keywords = new LinkedHashSet<>();
        patterns.forEach(p -> keywords.add(p.getErrorType()));
        keywords.add(errorType);

        return new DiagnosticBundle(fingerprint(errorType, message), errorType, message, frames, contextVariables,
                resources(), List.copyOf(hints), List.copyOf(keywords));
    }

    static String fingerprint(String errorType, String message) {
        String key = errorType + ":" + message.substring(0, Math.min(FINGERPRINT_MESSAGE_LENGTH, message.length()));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static ResourceSnapshot resources() {
        Runtime rt = Runtime.getRuntime();
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return new ResourceSnapshot(rt.totalMemory() - rt.freeMemory(), rt.maxMemory(), rt.availableProcessors(), load);
    }

    private static String component(ErrorCategory category) {
        return switch (category) {
            case CALCULATION, PRECISION -> "calculation_engine";
            case DATABASE -> "persistence_layer";
            case NETWORK, CURRENCY -> "external_apis";
            case CACHE -> "rate_cache";
            default -> null;
        };
    }
}
