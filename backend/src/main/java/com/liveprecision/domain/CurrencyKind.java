package com.liveprecision.domain;

/**
 * Classification of a supported currency. Decides which rate providers may serve it.
 */
public enum CurrencyKind {
    FIAT,
    CRYPTO,
    COMMODITY
}
