package com.liveprecision.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.rates.RateAggregator;
import com.liveprecision.rates.config.RatesProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine in-process caches. The ticker is a bean so tests can drive expiry.
 */
@Configuration
@EnableConfigurationProperties(RatesProperties.class)
public class CaffeineConfig {

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Cache<CurrencyPair, RateAggregator.CachedRate> rateCache(RatesProperties ratesProperties, Ticker cacheTicker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ratesProperties.getCacheTtl())
                .maximumSize(ratesProperties.getCacheMaxSize())
                .ticker(cacheTicker)
                .recordStats()
                .build();
    }
}
