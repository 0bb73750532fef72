package com.liveprecision.rates;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Ticker;
import com.liveprecision.domain.Currency;
import com.liveprecision.domain.CurrencyKind;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.HighPrecisionValue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Provider chain with a TTL cache: cache → provider 1 → provider 2 → ... → ALL_PROVIDERS_EXHAUSTED.
 * Providers are tried strictly in order and the first success wins. Concurrent misses on the same pair may
 * each reach the providers; the last write to the cache wins.
 */
@Slf4j
public class RateAggregator {

    /** Cached quote with the ticker reading taken when it was stored. */
    public record CachedRate(ExchangeRate rate, long storedAtNanos) {
    }

    private final List<RateProvider> providers;
    private final CurrencyRegistry currencyRegistry;
    private final Cache<CurrencyPair, CachedRate> cache;
    private final Ticker ticker;
    private final Clock clock;
    private final Duration ttl;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final Map<String, AtomicLong> providerFailures = new ConcurrentHashMap<>();

    public RateAggregator(List<RateProvider> providers, CurrencyRegistry currencyRegistry,
                          Cache<CurrencyPair, CachedRate> cache, Ticker ticker, Clock clock, Duration ttl) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("at least one rate provider is required");
        }
        this.providers = List.copyOf(providers);
        this.currencyRegistry = currencyRegistry;
        this.cache = cache;
        this.ticker = ticker;
        this.clock = clock;
        this.ttl = ttl;
    }

    public Mono<ExchangeRate> getRate(String from, String to) {
        return getRate(from, to, false);
    }

    /**
     * Resolves the rate for {@code from/to}. Codes are normalised to upper case; {@code X/X} is rate 1
     * from source {@code internal}. With {@code forceRefresh} the cache is bypassed but still updated.
     */
    public Mono<ExchangeRate> getRate(String from, String to, boolean forceRefresh) {
        return Mono.defer(() -> {
            CurrencyPair pair;
            try {
                pair = CurrencyPair.of(from, to);
            } catch (IllegalArgumentException e) {
                return Mono.error(new RateException(RateFailure.UNSUPPORTED_CURRENCY,
                        "Unsupported currency pair: " + from + "/" + to, e));
            }
            if (pair.isIdentity()) {
                return Mono.just(ExchangeRate.identity(pair, clock.instant()));
            }
            if (!currencyRegistry.isSupported(pair.from()) || !currencyRegistry.isSupported(pair.to())) {
                return Mono.error(new RateException(RateFailure.UNSUPPORTED_CURRENCY,
                        "Unsupported currency pair: " + pair));
            }
            if (!forceRefresh) {
                ExchangeRate cached = cachedRate(pair);
                if (cached != null) {
                    cacheHits.incrementAndGet();
                    return Mono.just(cached);
                }
            }
            cacheMisses.incrementAndGet();
            return fetchFromProviders(pair);
        });
    }

    /**
     * {@code amount × rate}, rounded HALF_EVEN to the target currency's decimal places. Identity pairs are
     * rounded the same way.
     */
    public Mono<Conversion> convert(HighPrecisionValue amount, String from, String to) {
        return getRate(from, to).map(rate -> {
            HighPrecisionValue product = amount.multiply(HighPrecisionValue.of(rate.rate()),
                    HighPrecisionValue.DEFAULT_CONTEXT);
            int decimals = currencyRegistry.find(rate.pair().to()).map(Currency::decimalPlaces).orElse(2);
            return new Conversion(amount, product.roundToDecimalPlaces(decimals), rate);
        });
    }

    /**
     * Rates from each base to every active currency. Pairs that fail are left out.
     */
    public Mono<Map<String, Map<String, ExchangeRate>>> getRateMatrix(List<String> bases) {
        List<String> targets = currencyRegistry.active().stream().map(Currency::code).toList();
        return Flux.fromIterable(bases)
                .concatMap(base -> Flux.fromIterable(targets)
                        .concatMap(target -> getRate(base, target)
                                .onErrorResume(e -> {
                                    log.debug("Rate matrix skips {}/{}: {}", base, target, e.getMessage());
                                    return Mono.empty();
                                }))
                        .collectMap(rate -> rate.pair().to(), rate -> rate, LinkedHashMap::new)
                        .map(row -> Map.entry(base.toUpperCase(Locale.ROOT), row)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    public AggregatorStats getStats() {
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long total = hits + misses;
        Map<String, Long> failures = new LinkedHashMap<>();
        providers.forEach(p -> failures.put(p.name(),
                providerFailures.getOrDefault(p.name(), new AtomicLong()).get()));
        List<ProviderStats> perProvider = new ArrayList<>();
        providers.forEach(p -> perProvider.add(p.stats()));
        return new AggregatorStats(hits, misses, total == 0 ? 0.0 : (double) hits / total,
                cache.estimatedSize(), failures, perProvider);
    }

    public void clearCache() {
        cache.invalidateAll();
        log.info("Rate cache cleared");
    }

    public List<Currency> getSupportedCurrencies() {
        return currencyRegistry.active();
    }

    public List<String> getFiatCodes() {
        return currencyRegistry.codes(CurrencyKind.FIAT);
    }

    public List<String> getCryptoCodes() {
        return currencyRegistry.codes(CurrencyKind.CRYPTO);
    }

    public boolean isSupported(String code) {
        return currencyRegistry.isSupported(code);
    }

    public List<RateProvider> getProviders() {
        return providers;
    }

    private ExchangeRate cachedRate(CurrencyPair pair) {
        CachedRate entry = cache.getIfPresent(pair);
        if (entry == null) {
            return null;
        }
        long ageNanos = ticker.read() - entry.storedAtNanos();
        if (ageNanos >= ttl.toNanos()) {
            return null;
        }
        return entry.rate().fromCache(Duration.ofNanos(ageNanos).toSeconds());
    }

    private Mono<ExchangeRate> fetchFromProviders(CurrencyPair pair) {
        return Flux.fromIterable(providers)
                .concatMap(provider -> provider.fetch(pair)
                        .onErrorResume(e -> {
                            providerFailures.computeIfAbsent(provider.name(), k -> new AtomicLong()).incrementAndGet();
                            log.warn("Provider {} failed for {}: {}", provider.name(), pair, e.getMessage());
                            return Mono.empty();
                        }))
                .next()
                .doOnNext(rate -> {
                    cache.put(pair, new CachedRate(rate, ticker.read()));
                    log.debug("Rate {} = {} from {}", pair, rate.rate(), rate.source());
                })
                .switchIfEmpty(Mono.error(() -> new RateException(RateFailure.ALL_PROVIDERS_EXHAUSTED,
                        "All rate providers exhausted for " + pair + ": network fetch failed on every provider")));
    }
}
