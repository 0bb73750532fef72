package com.liveprecision.calculation;

import java.time.Duration;
import java.util.Locale;

/**
 * One calculation. Operands are decimal literals; {@code operand2} is null for unary operations. Currencies
 * default to USD; {@code precisionOverride} and {@code deadline} are optional.
 */
public record CalculationRequest(
        String operation,
        String operand1,
        String operand2,
        String currencyFrom,
        String currencyTo,
        Integer precisionOverride,
        Duration deadline
) {

    public static final String DEFAULT_CURRENCY = "USD";

    public CalculationRequest {
        currencyFrom = currencyFrom == null || currencyFrom.isBlank() ? DEFAULT_CURRENCY : currencyFrom.strip().toUpperCase(Locale.ROOT);
        currencyTo = currencyTo == null || currencyTo.isBlank() ? DEFAULT_CURRENCY : currencyTo.strip().toUpperCase(Locale.ROOT);
    }

    public static CalculationRequest of(String operation, String operand1, String operand2, String from, String to) {
        return new CalculationRequest(operation, operand1, operand2, from, to, null, null);
    }

    public boolean requiresConversion() {
        return !currencyFrom.equals(currencyTo);
    }

    public CalculationRequest withDeadline(Duration newDeadline) {
        return new CalculationRequest(operation, operand1, operand2, currencyFrom, currencyTo, precisionOverride, newDeadline);
    }

    public CalculationRequest withPrecision(Integer precision) {
        return new CalculationRequest(operation, operand1, operand2, currencyFrom, currencyTo, precision, deadline);
    }
}
