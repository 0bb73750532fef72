package com.liveprecision.calculation;

import com.liveprecision.domain.Currency;
import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.HighPrecisionValue;
import com.liveprecision.healing.CorrectionPayload;
import com.liveprecision.healing.HealingContext;
import com.liveprecision.healing.HealingOrchestrator;
import com.liveprecision.healing.HealingResult;
import com.liveprecision.precision.PrecisionEngine;
import com.liveprecision.precision.PrecisionException;
import com.liveprecision.rates.Conversion;
import com.liveprecision.rates.RateAggregator;
import com.liveprecision.rates.RateException;
import com.liveprecision.rates.RateFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for calculations: engine → optional currency conversion → healing on failure.
 * Failures never escape as exceptions; they come back as a failed {@link CalculationOutcome}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalculationService {

    static final String CANCELLED_REASON = "Healing not attempted: calculation was cancelled";

    private final PrecisionEngine precisionEngine;
    private final RateAggregator rateAggregator;
    private final HealingOrchestrator healingOrchestrator;
    private final Clock clock;

    private final AtomicLong calculations = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong healedRetries = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();

    /** Result of one engine run plus conversion. */
    private record Computed(HighPrecisionValue preConversion, HighPrecisionValue result, ExchangeRate rate,
                            int precision, long elapsedMs) {
    }

    /**
     * Blocking convenience for callers outside a reactive pipeline.
     */
    public CalculationOutcome calculate(String operation, String operand1, String operand2, String from, String to) {
        return calculate(CalculationRequest.of(operation, operand1, operand2, from, to)).block();
    }

    public Mono<CalculationOutcome> calculate(CalculationRequest request) {
        return Mono.defer(() -> {
            String calculationId = UUID.randomUUID().toString();
            calculations.incrementAndGet();
            Mono<CalculationOutcome> pipeline = compute(request, request.operand1(), request.operand2(),
                    request.precisionOverride())
                    .map(computed -> {
                        if (request.requiresConversion()) {
                            healingOrchestrator.resetRetries(endpoint(request));
                        }
                        return CalculationOutcome.success(calculationId, computed.result().toString(),
                                metadata(request, computed));
                    })
                    .onErrorResume(e -> !(e instanceof TimeoutException), e -> healAndRetry(calculationId, request, e));
            if (request.deadline() != null) {
                pipeline = pipeline
                        .timeout(request.deadline())
                        .onErrorResume(TimeoutException.class, e -> Mono.just(cancelledOutcome(calculationId, request)));
            }
            return pipeline;
        });
    }

    public Mono<ExchangeRate> getRate(String from, String to, boolean forceRefresh) {
        return rateAggregator.getRate(from, to, forceRefresh);
    }

    public Mono<Conversion> convert(String amount, String from, String to) {
        return Mono.fromCallable(() -> HighPrecisionValue.parse(amount))
                .flatMap(value -> rateAggregator.convert(value, from, to));
    }

    public List<Currency> getSupportedCurrencies() {
        return rateAggregator.getSupportedCurrencies();
    }

    public CalculationStats getStats() {
        return new CalculationStats(calculations.get(), errors.get(), healedRetries.get(), cancelled.get());
    }

    private Mono<Computed> compute(CalculationRequest request, String operand1, String operand2, Integer precision) {
        long started = System.nanoTime();
        int digits = precision == null ? precisionEngine.getDefaultPrecision() : precision;
        return Mono.fromCallable(() -> precisionEngine.calculate(request.operation(), operand1, operand2, precision))
                .flatMap(value -> {
                    if (!request.requiresConversion()) {
                        return Mono.just(new Computed(value, value, null, digits, elapsedMs(started)));
                    }
                    return rateAggregator.convert(value, request.currencyFrom(), request.currencyTo())
                            .map(c -> new Computed(value, c.converted(), c.rate(), digits, elapsedMs(started)));
                });
    }

    private Mono<CalculationOutcome> healAndRetry(String calculationId, CalculationRequest request, Throwable error) {
        errors.incrementAndGet();
        CalculationError calculationError = toError(error);
        log.debug("Calculation {} failed with {}: {}", calculationId, calculationError.code(), error.getMessage());
        Map<String, Object> context = context(calculationId, request, error);
        return Mono.fromCallable(() -> healingOrchestrator.heal(error, context))
                .flatMap(healing -> {
                    Optional<CorrectionPayload> payload = healing.payload().filter(CorrectionPayload::isRetryable);
                    if (payload.isEmpty()) {
                        return Mono.just(CalculationOutcome.failure(calculationId, calculationError, healing, null, null));
                    }
                    return retry(calculationId, request, calculationError, healing, payload.get());
                });
    }

    /**
     * Re-runs the original operation once with the corrected inputs.
     */
    private Mono<CalculationOutcome> retry(String calculationId, CalculationRequest request, CalculationError error,
                                           HealingResult healing, CorrectionPayload payload) {
        String operand1 = payload.operand1() != null ? payload.operand1() : request.operand1();
        String operand2 = payload.operand2() != null ? payload.operand2() : request.operand2();
        Integer precision = payload.precisionOverride() != null ? payload.precisionOverride() : request.precisionOverride();
        return compute(request, operand1, operand2, precision)
                .map(computed -> {
                    healedRetries.incrementAndGet();
                    log.info("Calculation {} healed: {} -> {}", calculationId, error.code(), computed.result());
                    return CalculationOutcome.failure(calculationId, error, healing, computed.result().toString(),
                            metadata(request, computed));
                })
                .onErrorResume(e -> !(e instanceof TimeoutException), e -> {
                    log.warn("Calculation {} retry after healing failed: {}", calculationId, e.getMessage());
                    return Mono.just(CalculationOutcome.failure(calculationId, error, healing, null, null));
                });
    }

    private CalculationOutcome cancelledOutcome(String calculationId, CalculationRequest request) {
        cancelled.incrementAndGet();
        RateException cancellation = new RateException(RateFailure.CANCELLED,
                "Calculation cancelled: deadline of " + request.deadline() + " exceeded");
        log.warn("Calculation {} cancelled after {}", calculationId, request.deadline());
        HealingResult notHealed = HealingResult.notAttempted(UUID.randomUUID().toString(), clock.instant(),
                cancellation, CANCELLED_REASON);
        return CalculationOutcome.failure(calculationId, toError(cancellation), notHealed, null, null);
    }

    private CalculationMetadata metadata(CalculationRequest request, Computed computed) {
        ExchangeRate rate = computed.rate();
        return new CalculationMetadata(
                request.operation(),
                computed.precision(),
                request.currencyFrom(),
                request.currencyTo(),
                computed.preConversion().toString(),
                rate == null ? null : rate.rate().toPlainString(),
                rate == null ? null : rate.source(),
                rate != null && rate.metadata().fromCache(),
                clock.instant(),
                computed.elapsedMs());
    }

    private static Map<String, Object> context(String calculationId, CalculationRequest request, Throwable error) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(HealingContext.CALCULATION_ID, calculationId);
        context.put(HealingContext.OPERATION, request.operation());
        putIfNotNull(context, HealingContext.OPERAND1, request.operand1());
        putIfNotNull(context, HealingContext.OPERAND2, request.operand2());
        putIfNotNull(context, HealingContext.PRECISION, request.precisionOverride());
        context.put(HealingContext.CURRENCY_FROM, request.currencyFrom());
        context.put(HealingContext.CURRENCY_TO, request.currencyTo());
        if (error instanceof RateException) {
            context.put(HealingContext.ENDPOINT, endpoint(request));
        }
        return context;
    }

    private static String endpoint(CalculationRequest request) {
        return "rates:" + request.currencyFrom() + "/" + request.currencyTo();
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    static CalculationError toError(Throwable error) {
        String type = error.getClass().getSimpleName();
        if (error instanceof PrecisionException pe) {
            return new CalculationError(pe.getFailure().name(), categoryOf(pe).code(), type, pe.getMessage());
        }
        if (error instanceof RateException re) {
            return new CalculationError(re.getFailure().name(), categoryOf(re).code(), type, re.getMessage());
        }
        return new CalculationError("INTERNAL_ERROR", ErrorCategory.SYSTEM.code(), type, String.valueOf(error.getMessage()));
    }

    private static ErrorCategory categoryOf(PrecisionException e) {
        return switch (e.getFailure()) {
            case INVALID_NUMERIC_LITERAL, MISSING_OPERAND -> ErrorCategory.VALIDATION;
            case OVERFLOW -> ErrorCategory.PRECISION;
            case DIVISION_BY_ZERO, NEGATIVE_RADICAND, UNSUPPORTED_OPERATION, INVALID_OPERATION -> ErrorCategory.CALCULATION;
        };
    }

    private static ErrorCategory categoryOf(RateException e) {
        return switch (e.getFailure()) {
            case PROVIDER_ERROR, ALL_PROVIDERS_EXHAUSTED -> ErrorCategory.NETWORK;
            case PAIR_NOT_SUPPORTED, UNSUPPORTED_CURRENCY -> ErrorCategory.CURRENCY;
            case CANCELLED -> ErrorCategory.SYSTEM;
        };
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
