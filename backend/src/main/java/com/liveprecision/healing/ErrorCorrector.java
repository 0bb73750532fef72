package com.liveprecision.healing;

import com.liveprecision.domain.ErrorPattern;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Automatic fixes keyed by pattern id. Only auto-fix patterns with a registered correction are tried; the first
 * correction producing a payload wins. A correction that throws is recorded as failed and the next one runs.
 */
@Slf4j
public class ErrorCorrector {

    static final int CACHE_TIMEOUT_SECONDS = 3600;
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.+\\-eE]");
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("[+-]?\\d+(?:\\.\\d+)?");

    /** Returns null when the correction does not apply to the given context. */
    @FunctionalInterface
    interface Correction {
        CorrectionPayload apply(Map<String, Object> context);
    }

    private final Map<String, Correction> corrections = new LinkedHashMap<>();
    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulCorrections = new AtomicLong();
    private final AtomicLong failedCorrections = new AtomicLong();

    public ErrorCorrector(String epsilon, int reducedPrecision) {
        if (!isValidDecimal(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a decimal literal, got " + epsilon);
        }
        corrections.put(DefaultErrorPatterns.DIV_BY_ZERO, ctx -> replaceZeroDivisor(ctx, epsilon));
        corrections.put(DefaultErrorPatterns.INVALID_DECIMAL, ErrorCorrector::sanitizeOperands);
        corrections.put(DefaultErrorPatterns.OVERFLOW, ctx -> reducePrecision(ctx, reducedPrecision));
        corrections.put(DefaultErrorPatterns.NETWORK_TIMEOUT, ctx -> CorrectionPayload.builder()
                .useCache(true)
                .cacheTimeoutSeconds(CACHE_TIMEOUT_SECONDS)
                .explanation("Serve cached rates for up to " + CACHE_TIMEOUT_SECONDS + "s")
                .build());
        corrections.put(DefaultErrorPatterns.CACHE_UNAVAILABLE, ctx -> CorrectionPayload.builder()
                .useMemoryCache(true)
                .explanation("Switch to the in-memory cache")
                .build());
    }

    public CorrectionOutcome correct(List<ErrorPattern> patterns, Map<String, Object> context) {
        List<String> attempted = new ArrayList<>();
        List<String> successful = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ErrorPattern pattern : patterns) {
            Correction correction = corrections.get(pattern.getId());
            if (!pattern.isAutoFixAvailable() || correction == null) {
                continue;
            }
            attempted.add(pattern.getId());
            totalAttempts.incrementAndGet();
            CorrectionPayload payload;
            try {
                payload = correction.apply(context);
            } catch (RuntimeException e) {
                log.warn("Correction {} threw: {}", pattern.getId(), e.getMessage());
                failed.add(pattern.getId() + ": " + e.getMessage());
                failedCorrections.incrementAndGet();
                continue;
            }
            if (payload == null) {
                failed.add(pattern.getId());
                failedCorrections.incrementAndGet();
                continue;
            }
            successful.add(pattern.getId());
            successfulCorrections.incrementAndGet();
            log.debug("Correction {} applied: {}", pattern.getId(), payload.explanation());
            return new CorrectionOutcome(true, pattern.getId(), payload, attempted, successful, failed, null);
        }
        return new CorrectionOutcome(false, null, null, attempted, successful, failed,
                attempted.isEmpty() ? "No automatic correction available" : "All corrections failed");
    }

    public Map<String, Long> getStatistics() {
        return Map.of(
                "totalAttempts", totalAttempts.get(),
                "successfulCorrections", successfulCorrections.get(),
                "failedCorrections", failedCorrections.get());
    }

    private static CorrectionPayload replaceZeroDivisor(Map<String, Object> context, String epsilon) {
        Object operand2 = context.get(HealingContext.OPERAND2);
        if (operand2 == null || !isValidDecimal(operand2.toString())
                || new BigDecimal(operand2.toString().strip()).signum() != 0) {
            return null;
        }
        return CorrectionPayload.builder()
                .operand2(epsilon)
                .explanation("Replaced zero divisor with epsilon " + epsilon)
                .build();
    }

    private static CorrectionPayload sanitizeOperands(Map<String, Object> context) {
        CorrectionPayload.CorrectionPayloadBuilder builder = CorrectionPayload.builder();
        List<String> changed = new ArrayList<>();
        for (String key : List.of(HealingContext.OPERAND1, HealingContext.OPERAND2)) {
            Object raw = context.get(key);
            if (raw == null || isValidDecimal(raw.toString())) {
                continue;
            }
            Optional<String> clean = sanitize(raw.toString());
            if (clean.isEmpty()) {
                return null;
            }
            if (key.equals(HealingContext.OPERAND1)) {
                builder.operand1(clean.get());
            } else {
                builder.operand2(clean.get());
            }
            changed.add(key + " '" + raw + "' -> '" + clean.get() + "'");
        }
        if (changed.isEmpty()) {
            return null;
        }
        return builder.explanation("Sanitized " + String.join(", ", changed)).build();
    }

    private static CorrectionPayload reducePrecision(Map<String, Object> context, int reducedPrecision) {
        Object current = context.get(HealingContext.PRECISION);
        if (current != null && Integer.parseInt(current.toString()) <= reducedPrecision) {
            return null;
        }
        return CorrectionPayload.builder()
                .precisionOverride(reducedPrecision)
                .explanation("Reduced precision to " + reducedPrecision + " digits")
                .build();
    }

    /**
     * Normalises separators (a comma is a thousands separator when a dot is present, otherwise the decimal
     * point), strips everything that cannot be part of a decimal literal, and falls back to the first numeric
     * token when the stripped text is still invalid.
     */
    static Optional<String> sanitize(String raw) {
        String s = raw.strip();
        if (s.contains(",") && s.contains(".")) {
            s = s.replace(",", "");
        } else if (s.contains(",")) {
            s = s.replace(',', '.');
        }
        String stripped = NON_NUMERIC.matcher(s).replaceAll("");
        if (isValidDecimal(stripped)) {
            return Optional.of(stripped);
        }
        Matcher token = NUMERIC_TOKEN.matcher(s);
        return token.find() ? Optional.of(token.group()) : Optional.empty();
    }

    static boolean isValidDecimal(String s) {
        if (s == null || s.isBlank()) {
            return false;
        }
        try {
            new BigDecimal(s.strip());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
