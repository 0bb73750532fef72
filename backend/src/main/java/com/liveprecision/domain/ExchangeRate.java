package com.liveprecision.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A quoted rate for a pair plus where it came from. The rate is always strictly positive.
 */
public record ExchangeRate(CurrencyPair pair, BigDecimal rate, RateMetadata metadata) {

    public ExchangeRate {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(metadata, "metadata");
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("rate for " + pair + " must be positive, got " + rate);
        }
    }

    /** Rate 1 for {@code X -> X}; no provider is consulted. */
    public static ExchangeRate identity(CurrencyPair pair, Instant now) {
        return new ExchangeRate(pair, BigDecimal.ONE, RateMetadata.builder()
                .source("internal")
                .timestamp(now)
                .build());
    }

    public ExchangeRate fromCache(long ageSeconds) {
        return withMetadata(metadata.toBuilder().fromCache(true).cacheAgeSeconds(ageSeconds).build());
    }

    public ExchangeRate withMetadata(RateMetadata newMetadata) {
        return new ExchangeRate(pair, rate, newMetadata);
    }

    public String source() {
        return metadata.source();
    }
}
