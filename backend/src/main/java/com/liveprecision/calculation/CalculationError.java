package com.liveprecision.calculation;

/**
 * @param code     failure code, e.g. {@code DIVISION_BY_ZERO} or {@code ALL_PROVIDERS_EXHAUSTED}
 * @param category lower-case error category, e.g. {@code calculation}
 * @param type     exception simple name
 */
public record CalculationError(String code, String category, String type, String message) {
}
