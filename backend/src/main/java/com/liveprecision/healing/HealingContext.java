package com.liveprecision.healing;

/**
 * Well-known keys of the context map passed alongside an error.
 */
public final class HealingContext {

    public static final String OPERATION = "operation";
    public static final String OPERAND1 = "operand1";
    public static final String OPERAND2 = "operand2";
    public static final String PRECISION = "precision";
    public static final String CURRENCY_FROM = "currencyFrom";
    public static final String CURRENCY_TO = "currencyTo";
    /** Remote endpoint a network failure refers to; retry counters are kept per endpoint. */
    public static final String ENDPOINT = "endpoint";
    public static final String CALCULATION_ID = "calculationId";

    private HealingContext() {}
}
