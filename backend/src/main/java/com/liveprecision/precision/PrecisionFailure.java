package com.liveprecision.precision;

/**
 * Typed reasons a calculation can fail.
 */
public enum PrecisionFailure {
    INVALID_NUMERIC_LITERAL,
    MISSING_OPERAND,
    DIVISION_BY_ZERO,
    NEGATIVE_RADICAND,
    UNSUPPORTED_OPERATION,
    OVERFLOW,
    INVALID_OPERATION
}
