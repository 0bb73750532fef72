package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;

import java.util.List;

/**
 * Patterns every registry starts with.
 */
public final class DefaultErrorPatterns {

    public static final String DIV_BY_ZERO = "div_by_zero";
    public static final String INVALID_DECIMAL = "invalid_decimal";
    public static final String OVERFLOW = "overflow";
    public static final String NETWORK_TIMEOUT = "network_timeout";
    public static final String CACHE_UNAVAILABLE = "cache_unavailable";
    public static final String NEGATIVE_RADICAND = "negative_radicand";
    public static final String MISSING_OPERAND = "missing_operand";
    public static final String UNSUPPORTED_CURRENCY = "unsupported_currency";

    private DefaultErrorPatterns() {}

    public static List<ErrorPattern> create() {
        return List.of(
                new ErrorPattern(DIV_BY_ZERO, "division by zero|divide by zero", "DivisionByZero",
                        ErrorCategory.CALCULATION, Severity.HIGH, true,
                        "Substitute a tiny epsilon for the zero divisor"),
                new ErrorPattern(INVALID_DECIMAL, "invalid literal|invalid decimal|number ?format", "InvalidDecimal",
                        ErrorCategory.VALIDATION, Severity.MEDIUM, true,
                        "Sanitize the numeric input and validate again"),
                new ErrorPattern(OVERFLOW, "overflow|too large|exceeds maximum", "Overflow",
                        ErrorCategory.PRECISION, Severity.HIGH, true,
                        "Reduce the requested precision"),
                new ErrorPattern(NETWORK_TIMEOUT, "timeout|timed out|connection|network|unreachable", "NetworkTimeout",
                        ErrorCategory.NETWORK, Severity.MEDIUM, true,
                        "Retry with exponential backoff, then serve cached data"),
                new ErrorPattern(CACHE_UNAVAILABLE, "redis|connection pool|cache", "CacheUnavailable",
                        ErrorCategory.CACHE, Severity.MEDIUM, true,
                        "Fall back to the in-memory cache"),
                new ErrorPattern(NEGATIVE_RADICAND, "square root of negative", "NegativeRadicand",
                        ErrorCategory.CALCULATION, Severity.MEDIUM, false,
                        "Verify the sign of the input"),
                new ErrorPattern(MISSING_OPERAND, "requires two operands|missing operand", "MissingOperand",
                        ErrorCategory.VALIDATION, Severity.MEDIUM, false,
                        "Supply the second operand"),
                new ErrorPattern(UNSUPPORTED_CURRENCY, "unsupported currency", "UnsupportedCurrency",
                        ErrorCategory.CURRENCY, Severity.MEDIUM, false,
                        "Use a supported currency code")
        );
    }
}
