package com.liveprecision.rates.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Ticker;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.rates.CurrencyRegistry;
import com.liveprecision.rates.RateAggregator;
import com.liveprecision.rates.RateProvider;
import com.liveprecision.rates.provider.CoinGeckoRateProvider;
import com.liveprecision.rates.provider.ExchangeRatesApiProvider;
import com.liveprecision.rates.provider.StaticFallbackRateProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Provider chain and aggregator. Order: exchangerate-api, CoinGecko, static fallback (always last).
 */
@Configuration
@EnableConfigurationProperties(RatesProperties.class)
@Slf4j
public class RatesConfig {

    @Bean
    public RateAggregator rateAggregator(RatesProperties properties, WebClient.Builder webClientBuilder,
                                         CurrencyRegistry currencyRegistry,
                                         Cache<CurrencyPair, RateAggregator.CachedRate> rateCache,
                                         Ticker ticker, Clock clock) {
        List<RateProvider> providers = new ArrayList<>();
        RatesProperties.ProviderProperties era = properties.getExchangeRatesApi();
        if (era.isEnabled()) {
            providers.add(new ExchangeRatesApiProvider(webClientBuilder, era.getBaseUrl(), currencyRegistry,
                    rateLimiter(ExchangeRatesApiProvider.NAME, era), properties.getRequestTimeout(), clock));
        }
        RatesProperties.ProviderProperties cg = properties.getCoingecko();
        if (cg.isEnabled()) {
            providers.add(new CoinGeckoRateProvider(webClientBuilder, cg.getBaseUrl(), upperKeys(properties.getCoingeckoIds()),
                    rateLimiter(CoinGeckoRateProvider.NAME, cg), properties.getRequestTimeout(), clock));
        }
        providers.add(new StaticFallbackRateProvider(fallbackTable(properties.getFallbackRates()), clock));
        log.info("Rate providers: {}", providers.stream().map(RateProvider::name).toList());
        return new RateAggregator(providers, currencyRegistry, rateCache, ticker, clock, properties.getCacheTtl());
    }

    static RateLimiter rateLimiter(String name, RatesProperties.ProviderProperties provider) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, provider.getRequestsPerSecond()))
                .timeoutDuration(provider.getLimiterTimeout())
                .build();
        return RateLimiter.of(name, config);
    }

    /**
     * Built-in table with configured "FROM/TO" entries merged over it.
     */
    static Map<CurrencyPair, BigDecimal> fallbackTable(Map<String, String> overrides) {
        Map<CurrencyPair, BigDecimal> table = StaticFallbackRateProvider.defaultTable();
        overrides.forEach((key, value) -> {
            String[] codes = key.split("/");
            if (codes.length != 2) {
                throw new IllegalArgumentException("Fallback rate key must be FROM/TO, got " + key);
            }
            table.put(CurrencyPair.of(codes[0], codes[1]), new BigDecimal(value.strip()));
        });
        return table;
    }

    private static Map<String, String> upperKeys(Map<String, String> ids) {
        return ids.entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().toUpperCase(Locale.ROOT), Map.Entry::getValue));
    }
}
