package com.liveprecision.calculation;

import java.time.Instant;

/**
 * How a result was produced. Rate fields are null when no conversion took place.
 */
public record CalculationMetadata(
        String operation,
        int precision,
        String currencyFrom,
        String currencyTo,
        String preConversionResult,
        String exchangeRate,
        String rateSource,
        boolean rateFromCache,
        Instant timestamp,
        long calculationTimeMs
) {
}
