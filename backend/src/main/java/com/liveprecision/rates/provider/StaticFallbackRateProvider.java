package com.liveprecision.rates.provider;

import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.HighPrecisionValue;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic last-resort provider backed by a fixed table. Resolves a pair directly, by inverting a
 * tabled pair, or as a cross rate through USD; anything else fails with PAIR_NOT_SUPPORTED.
 * Rates are marked {@code mockData} since they are illustrative, not market data.
 */
public class StaticFallbackRateProvider extends AbstractRateProvider {

    public static final String NAME = "fallback";
    private static final String USD = "USD";
    private static final MathContext MC = HighPrecisionValue.DEFAULT_CONTEXT;

    private final Map<CurrencyPair, BigDecimal> table;

    public StaticFallbackRateProvider(Map<CurrencyPair, BigDecimal> table, Clock clock) {
        super(NAME, clock);
        this.table = Map.copyOf(table);
    }

    @Override
    protected Mono<ExchangeRate> doFetch(CurrencyPair pair) {
        return Mono.fromCallable(() -> resolve(pair));
    }

    private ExchangeRate resolve(CurrencyPair pair) {
        BigDecimal direct = table.get(pair);
        if (direct != null) {
            return new ExchangeRate(pair, direct, metadata().mockData(true).build());
        }
        BigDecimal reverse = table.get(pair.inverse());
        if (reverse != null) {
            return new ExchangeRate(pair, BigDecimal.ONE.divide(reverse, MC),
                    metadata().mockData(true).inverted(true).build());
        }
        BigDecimal fromUsd = usdValue(pair.from());
        BigDecimal toUsd = usdValue(pair.to());
        if (fromUsd == null || toUsd == null) {
            throw unsupported(pair);
        }
        return new ExchangeRate(pair, fromUsd.divide(toUsd, MC), metadata()
                .mockData(true)
                .derived(true)
                .details(Map.of("via", USD, "fromUsd", fromUsd.toPlainString(), "toUsd", toUsd.toPlainString()))
                .build());
    }

    /** Value of one unit of {@code code} in USD, or null when the table cannot derive it. */
    private BigDecimal usdValue(String code) {
        if (USD.equals(code)) {
            return BigDecimal.ONE;
        }
        BigDecimal v = table.get(CurrencyPair.of(code, USD));
        if (v != null) {
            return v;
        }
        BigDecimal inverse = table.get(CurrencyPair.of(USD, code));
        return inverse == null ? null : BigDecimal.ONE.divide(inverse, MC);
    }

    /** Illustrative USD quotes used when no table is configured. */
    public static Map<CurrencyPair, BigDecimal> defaultTable() {
        Map<CurrencyPair, BigDecimal> t = new LinkedHashMap<>();
        put(t, "EUR", "1.0850");
        put(t, "GBP", "1.2650");
        put(t, "JPY", "0.0091");
        put(t, "CHF", "1.0950");
        put(t, "CAD", "0.7850");
        put(t, "AUD", "0.6750");
        put(t, "BTC", "45000.00");
        put(t, "ETH", "3000.00");
        put(t, "ADA", "0.45");
        put(t, "DOT", "6.50");
        put(t, "SOL", "95.00");
        put(t, "MATIC", "0.85");
        put(t, "AVAX", "18.50");
        put(t, "LINK", "14.50");
        put(t, "UNI", "6.25");
        put(t, "LTC", "95.00");
        put(t, "XAU", "2350.00");
        put(t, "XAG", "29.50");
        return t;
    }

    private static void put(Map<CurrencyPair, BigDecimal> t, String code, String usd) {
        t.put(CurrencyPair.of(code, USD), new BigDecimal(usd));
    }
}
