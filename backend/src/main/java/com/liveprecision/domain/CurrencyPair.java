package com.liveprecision.domain;

import java.util.Locale;

/**
 * Ordered pair of currency codes, always upper-case. {@code USD/EUR} quotes how many EUR one USD buys.
 */
public record CurrencyPair(String from, String to) {

    public CurrencyPair {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new IllegalArgumentException("currency codes must not be blank");
        }
        from = from.strip().toUpperCase(Locale.ROOT);
        to = to.strip().toUpperCase(Locale.ROOT);
    }

    public static CurrencyPair of(String from, String to) {
        return new CurrencyPair(from, to);
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(to, from);
    }

    public boolean isIdentity() {
        return from.equals(to);
    }

    @Override
    public String toString() {
        return from + "/" + to;
    }
}
