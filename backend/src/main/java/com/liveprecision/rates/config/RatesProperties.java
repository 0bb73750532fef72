package com.liveprecision.rates.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate aggregation configuration. Documented in application.yml under liveprecision.rates.
 */
@ConfigurationProperties(prefix = "liveprecision.rates")
@Validated
@Getter
@Setter
public class RatesProperties {

    /**
     * Maximum age of a cached rate before providers are consulted again.
     */
    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);

    /**
     * Upper bound on cached pairs.
     */
    @Min(1)
    private long cacheMaxSize = 10_000;

    /**
     * Per-request timeout for HTTP providers.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(10);

    @Valid
    private ProviderProperties exchangeRatesApi = new ProviderProperties("https://api.exchangerate-api.com/v4", 5);

    @Valid
    private ProviderProperties coingecko = new ProviderProperties("https://api.coingecko.com/api/v3", 1);

    /**
     * Currency code to CoinGecko coin id. Only codes listed here are served by the CoinGecko provider.
     */
    private Map<String, String> coingeckoIds = defaultCoingeckoIds();

    /**
     * Overrides for the static fallback table, keyed "FROM/TO" (e.g. "[EUR/USD]": "1.0850" in YAML).
     * Entries are merged over the built-in table.
     */
    private Map<String, String> fallbackRates = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class ProviderProperties {
        /** Base URL without trailing slash. */
        @NotBlank
        private String baseUrl;
        /** When false the provider is left out of the chain. */
        private boolean enabled = true;
        /** resilience4j permits per second. */
        @Min(1)
        private int requestsPerSecond;
        /** How long a call may wait for a permit before failing. */
        private Duration limiterTimeout = Duration.ofSeconds(2);

        public ProviderProperties() {
        }

        ProviderProperties(String baseUrl, int requestsPerSecond) {
            this.baseUrl = baseUrl;
            this.requestsPerSecond = requestsPerSecond;
        }
    }

    private static Map<String, String> defaultCoingeckoIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put("BTC", "bitcoin");
        ids.put("ETH", "ethereum");
        ids.put("ADA", "cardano");
        ids.put("DOT", "polkadot");
        ids.put("SOL", "solana");
        ids.put("MATIC", "matic-network");
        ids.put("AVAX", "avalanche-2");
        ids.put("LINK", "chainlink");
        ids.put("UNI", "uniswap");
        ids.put("LTC", "litecoin");
        return ids;
    }
}
