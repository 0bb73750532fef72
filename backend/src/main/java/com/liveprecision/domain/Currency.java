package com.liveprecision.domain;

import java.util.Locale;

/**
 * Currency descriptor. {@code decimalPlaces} is the display rounding applied to converted amounts.
 * Inactive currencies stay listed but are rejected for conversion.
 */
public record Currency(
        String code,
        String name,
        String symbol,
        CurrencyKind kind,
        int decimalPlaces,
        boolean active,
        String country
) {

    public Currency {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("currency code must not be blank");
        }
        if (code.length() < 3 || code.length() > 6) {
            throw new IllegalArgumentException("currency code must be 3 to 6 characters: " + code);
        }
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must be >= 0");
        }
        code = code.toUpperCase(Locale.ROOT);
    }

    public boolean isFiat() {
        return kind == CurrencyKind.FIAT;
    }

    public boolean isCrypto() {
        return kind == CurrencyKind.CRYPTO;
    }
}
