package com.liveprecision.rates.provider;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.RateMetadata;
import com.liveprecision.rates.ProviderStats;
import com.liveprecision.rates.RateException;
import com.liveprecision.rates.RateFailure;
import com.liveprecision.rates.RateProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared bookkeeping for providers: identity shortcut, request/error counters, response timing and
 * mapping of transport failures to {@link RateException}.
 */
public abstract class AbstractRateProvider implements RateProvider {

    /** Floats are read as BigDecimal so quoted rates keep every digit the API sent. */
    protected static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final String name;
    protected final Clock clock;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong totalResponseMs = new AtomicLong();
    private volatile Instant lastUpdate;

    protected AbstractRateProvider(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final Mono<ExchangeRate> fetch(CurrencyPair pair) {
        if (pair.isIdentity()) {
            return Mono.just(ExchangeRate.identity(pair, clock.instant()));
        }
        return Mono.defer(() -> {
            long started = System.nanoTime();
            requests.incrementAndGet();
            return doFetch(pair)
                    .switchIfEmpty(Mono.error(() -> new RateException(RateFailure.PROVIDER_ERROR,
                            name + " returned no rate for " + pair)))
                    .map(rate -> {
                        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
                        successes.incrementAndGet();
                        totalResponseMs.addAndGet(elapsedMs);
                        lastUpdate = clock.instant();
                        return rate.withMetadata(rate.metadata().toBuilder().responseTimeMs(elapsedMs).build());
                    })
                    .onErrorMap(e -> !(e instanceof RateException), e -> providerError(pair, e))
                    .doOnError(e -> errors.incrementAndGet());
        });
    }

    @Override
    public ProviderStats stats() {
        long ok = successes.get();
        double average = ok == 0 ? 0.0 : (double) totalResponseMs.get() / ok;
        return new ProviderStats(name, requests.get(), errors.get(), average, lastUpdate);
    }

    /**
     * Fetches a non-identity pair. Emits exactly one rate or an error.
     */
    protected abstract Mono<ExchangeRate> doFetch(CurrencyPair pair);

    protected RateMetadata.RateMetadataBuilder metadata() {
        return RateMetadata.builder().source(name).timestamp(clock.instant());
    }

    protected RateException unsupported(CurrencyPair pair) {
        return new RateException(RateFailure.PAIR_NOT_SUPPORTED, name + " does not quote " + pair);
    }

    /**
     * Waits for a resilience4j permit without blocking a thread, then subscribes to {@code call}.
     */
    protected static <T> Mono<T> throttled(RateLimiter limiter, Mono<T> call) {
        return Mono.defer(() -> {
            long waitNanos = limiter.reservePermission();
            if (waitNanos < 0) {
                return Mono.error(RequestNotPermitted.createRequestNotPermitted(limiter));
            }
            if (waitNanos == 0) {
                return call;
            }
            return Mono.delay(Duration.ofNanos(waitNanos)).then(call);
        });
    }

    private RateException providerError(CurrencyPair pair, Throwable e) {
        if (e instanceof TimeoutException) {
            return new RateException(RateFailure.PROVIDER_ERROR,
                    "Network timeout fetching " + pair + " from " + name, e);
        }
        return new RateException(RateFailure.PROVIDER_ERROR,
                name + " failed for " + pair + ": " + e.getMessage(), e);
    }
}
