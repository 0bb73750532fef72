package com.liveprecision.rates.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.rates.CurrencyRegistry;
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
import java.util.Optional;

/**
 * Fiat rates via exchangerate-api {@code GET /latest/{FROM}}, reading {@code rates.{TO}}.
 */
@Slf4j
public class ExchangeRatesApiProvider extends AbstractRateProvider {

    public static final String NAME = "exchangerate-api";

    private final WebClient webClient;
    private final CurrencyRegistry currencyRegistry;
    private final RateLimiter rateLimiter;
    private final Duration requestTimeout;

    public ExchangeRatesApiProvider(WebClient.Builder webClientBuilder, String baseUrl, CurrencyRegistry currencyRegistry,
                                    RateLimiter rateLimiter, Duration requestTimeout, Clock clock) {
        super(NAME, clock);
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.currencyRegistry = currencyRegistry;
        this.rateLimiter = rateLimiter;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected Mono<ExchangeRate> doFetch(CurrencyPair pair) {
        if (!currencyRegistry.isFiat(pair.from()) || !currencyRegistry.isFiat(pair.to())) {
            return Mono.error(unsupported(pair));
        }
        Mono<String> call = webClient.get()
                .uri("/latest/{base}", pair.from())
                .retrieve()
                .bodyToMono(String.class);
        return throttled(rateLimiter, call)
                .timeout(requestTimeout)
                .doOnError(WebClientResponseException.class,
                        e -> log.warn("exchangerate-api failed for {}: {}", pair, e.getMessage()))
                .map(body -> parseRate(body, pair.to())
                        .orElseThrow(() -> new RateException(RateFailure.PROVIDER_ERROR,
                                NAME + " response has no rate for " + pair)))
                .map(rate -> new ExchangeRate(pair, rate, metadata().build()));
    }

    static Optional<BigDecimal> parseRate(String json, String to) {
        try {
            JsonNode value = JSON.readTree(json).path("rates").path(to);
            if (!value.isNumber() || value.decimalValue().signum() <= 0) {
                return Optional.empty();
            }
            return Optional.of(value.decimalValue());
        } catch (Exception e) {
            log.debug("Unparseable exchangerate-api payload: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
