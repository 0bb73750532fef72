package com.liveprecision.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Known failure signature. Identity and matching rule are fixed at creation; occurrence statistics and
 * success rate are mutable and updated under this instance's lock.
 * <p>
 * The pattern is matched case-insensitively against {@code "<ExceptionSimpleName>: <message>"}.
 */
public final class ErrorPattern {

    public static final double INITIAL_SUCCESS_RATE = 0.5;
    public static final double MIN_SUCCESS_RATE = 0.1;
    public static final double MAX_SUCCESS_RATE = 1.0;

    private final String id;
    private final String regex;
    private final Pattern compiled;
    private final String errorType;
    private final ErrorCategory category;
    private final Severity severity;
    private final boolean autoFixAvailable;
    private final String fixStrategy;

    private int occurrenceCount;
    private Instant lastSeen;
    private double successRate = INITIAL_SUCCESS_RATE;

    public ErrorPattern(String id, String regex, String errorType, ErrorCategory category, Severity severity,
                        boolean autoFixAvailable, String fixStrategy) {
        this.id = Objects.requireNonNull(id, "id");
        this.regex = Objects.requireNonNull(regex, "regex");
        this.compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.errorType = errorType;
        this.category = Objects.requireNonNull(category, "category");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.autoFixAvailable = autoFixAvailable;
        this.fixStrategy = fixStrategy;
    }

    /** Text an exception is matched against. */
    public static String matchText(Throwable error) {
        return error.getClass().getSimpleName() + ": " + Objects.toString(error.getMessage(), "");
    }

    public boolean matches(String text) {
        return text != null && compiled.matcher(text).find();
    }

    public boolean matches(Throwable error) {
        return matches(matchText(error));
    }

    public synchronized void recordOccurrence(Instant at) {
        occurrenceCount++;
        lastSeen = at;
    }

    /**
     * Multiplies the success rate by {@code factor}, clamped to [0.1, 1.0].
     */
    public synchronized void adjustSuccessRate(double factor) {
        successRate = Math.max(MIN_SUCCESS_RATE, Math.min(MAX_SUCCESS_RATE, successRate * factor));
    }

    public String getId() {
        return id;
    }

    public String getRegex() {
        return regex;
    }

    public String getErrorType() {
        return errorType;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isAutoFixAvailable() {
        return autoFixAvailable;
    }

    public String getFixStrategy() {
        return fixStrategy;
    }

    public synchronized int getOccurrenceCount() {
        return occurrenceCount;
    }

    public synchronized Instant getLastSeen() {
        return lastSeen;
    }

    public synchronized double getSuccessRate() {
        return successRate;
    }

    @Override
    public String toString() {
        return "ErrorPattern{" + id + ", " + category.code() + "/" + severity.code() + "}";
    }
}
