package com.liveprecision.rates;

/**
 * Typed reasons a rate lookup can fail.
 */
public enum RateFailure {
    /** A single provider could not answer (HTTP error, timeout, malformed payload). */
    PROVIDER_ERROR,
    /** A provider does not quote this pair. */
    PAIR_NOT_SUPPORTED,
    /** Every configured provider failed for the pair. */
    ALL_PROVIDERS_EXHAUSTED,
    /** Unknown or inactive currency code. */
    UNSUPPORTED_CURRENCY,
    /** The caller's deadline expired before a rate arrived. */
    CANCELLED
}
