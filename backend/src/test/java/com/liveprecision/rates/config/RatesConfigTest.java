package com.liveprecision.rates.config;

import com.liveprecision.domain.CurrencyPair;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RatesConfigTest {

    @Test
    void fallbackTable_mergesOverridesOverDefaults() {
        Map<CurrencyPair, BigDecimal> table = RatesConfig.fallbackTable(Map.of("usd/eur", "0.85", "EUR/USD", " 1.10 "));

        assertThat(table.get(CurrencyPair.of("USD", "EUR"))).isEqualByComparingTo("0.85");
        assertThat(table.get(CurrencyPair.of("EUR", "USD"))).isEqualByComparingTo("1.10");
        assertThat(table.get(CurrencyPair.of("BTC", "USD"))).isEqualByComparingTo("45000");
    }

    @Test
    void fallbackTable_rejectsMalformedKey() {
        assertThatThrownBy(() -> RatesConfig.fallbackTable(Map.of("USDEUR", "0.85")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FROM/TO");
    }

    @Test
    void rateLimiter_usesConfiguredThroughput() {
        RatesProperties.ProviderProperties props = new RatesProperties.ProviderProperties();
        props.setRequestsPerSecond(0);
        props.setLimiterTimeout(Duration.ofMillis(250));

        RateLimiter limiter = RatesConfig.rateLimiter("p", props);

        assertThat(limiter.getName()).isEqualTo("p");
        assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(1);
        assertThat(limiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(250));
    }
}
