package com.liveprecision.calculation;

public record CalculationStats(long calculations, long errors, long healedRetries, long cancelled) {
}
