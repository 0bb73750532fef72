package com.liveprecision.rates.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.HighPrecisionValue;
import com.liveprecision.rates.RateException;
import com.liveprecision.rates.RateFailure;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Crypto rates via CoinGecko {@code /simple/price}. Crypto to X is quoted directly; X to crypto is served by
 * inverting the crypto to X quote.
 */
@Slf4j
public class CoinGeckoRateProvider extends AbstractRateProvider {

    public static final String NAME = "coingecko";

    private final WebClient webClient;
    private final Map<String, String> coinIds;
    private final RateLimiter rateLimiter;
    private final Duration requestTimeout;

    /**
     * @param coinIds currency code (upper-case) to CoinGecko coin id, e.g. BTC to bitcoin
     */
    public CoinGeckoRateProvider(WebClient.Builder webClientBuilder, String baseUrl, Map<String, String> coinIds,
                                 RateLimiter rateLimiter, Duration requestTimeout, Clock clock) {
        super(NAME, clock);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.coinIds = Map.copyOf(coinIds);
        this.rateLimiter = rateLimiter;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected Mono<ExchangeRate> doFetch(CurrencyPair pair) {
        if (coinIds.containsKey(pair.from())) {
            return quote(pair);
        }
        if (coinIds.containsKey(pair.to())) {
            CurrencyPair direct = pair.inverse();
            return quote(direct).map(rate -> new ExchangeRate(pair,
                    BigDecimal.ONE.divide(rate.rate(), HighPrecisionValue.DEFAULT_CONTEXT),
                    rate.metadata().toBuilder().inverted(true).build()));
        }
        return Mono.error(unsupported(pair));
    }

    private Mono<ExchangeRate> quote(CurrencyPair pair) {
        String coinId = coinIds.get(pair.from());
        String vsCurrency = pair.to().toLowerCase(Locale.ROOT);
        Mono<String> call = webClient.get()
                .uri(uri -> uri.path("/simple/price")
                        .queryParam("ids", coinId)
                        .queryParam("vs_currencies", vsCurrency)
                        .queryParam("precision", "18")
                        .build())
                .retrieve()
                .bodyToMono(String.class);
        return throttled(rateLimiter, call)
                .timeout(requestTimeout)
                .doOnError(WebClientResponseException.class,
                        e -> log.warn("CoinGecko price failed for {}: {}", coinId, e.getMessage()))
                .map(body -> parsePrice(body, coinId, vsCurrency)
                        .orElseThrow(() -> new RateException(RateFailure.PROVIDER_ERROR,
                                NAME + " response has no " + vsCurrency + " price for " + coinId)))
                .map(rate -> new ExchangeRate(pair, rate, metadata().details(Map.of("coinId", coinId)).build()));
    }

    static Optional<BigDecimal> parsePrice(String json, String coinId, String vsCurrency) {
        try {
            JsonNode price = JSON.readTree(json).path(coinId).path(vsCurrency);
            if (!price.isNumber() || price.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(price.decimalValue());
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko payload for {}: {}", coinId, e.getMessage());
            return Optional.empty();
        }
    }
}
