package com.liveprecision.rates;

import com.liveprecision.domain.CurrencyPair;
import com.liveprecision.domain.ExchangeRate;
import reactor.core.publisher.Mono;

/**
 * Single upstream source of exchange rates. Implementations are non-blocking; failures are signalled as
 * {@link RateException} with {@link RateFailure#PROVIDER_ERROR} or {@link RateFailure#PAIR_NOT_SUPPORTED}.
 * An identity pair yields rate 1 without any network call.
 */
public interface RateProvider {

    String name();

    Mono<ExchangeRate> fetch(CurrencyPair pair);

    ProviderStats stats();
}
