package com.liveprecision.healing;

import com.liveprecision.common.RetryPolicy;
import com.liveprecision.domain.ErrorPattern;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks an immediate mitigation per matched pattern, by category. The first strategy that succeeds ends the
 * loop. Backoff delays are computed and reported; the caller decides whether to wait.
 */
@Slf4j
public class ErrorMitigator {

    public static final String EXPONENTIAL_BACKOFF_RETRY = "exponential_backoff_retry";
    public static final String FALLBACK_MECHANISM = "fallback_mechanism";
    public static final String MEMORY_FALLBACK = "memory_fallback";
    public static final String CONNECTION_POOL_REFRESH = "connection_pool_refresh";
    public static final String EPSILON_REPLACEMENT = "epsilon_replacement";
    public static final String PRECISION_ADJUSTMENT = "precision_adjustment";
    public static final String ADAPTIVE_PRECISION = "adaptive_precision";
    public static final String INPUT_SANITIZATION = "input_sanitization";
    public static final String CURRENCY_SUBSTITUTION = "currency_substitution";

    private static final String UNKNOWN_ENDPOINT = "unknown";

    private final RetryPolicy retryPolicy;
    private final Map<String, AtomicInteger> retryCounters = new ConcurrentHashMap<>();

    public ErrorMitigator(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public MitigationOutcome mitigate(List<ErrorPattern> patterns, Map<String, Object> context) {
        List<StrategyAttempt> attempts = new ArrayList<>();
        for (ErrorPattern pattern : patterns) {
            StrategyAttempt attempt = attempt(pattern, context);
            attempts.add(attempt);
            if (attempt.success()) {
                log.debug("Mitigation {} succeeded for {}", attempt.strategy(), pattern.getId());
                return MitigationOutcome.succeeded(attempt, attempts);
            }
        }
        return MitigationOutcome.failed(attempts, patterns.isEmpty()
                ? "No patterns to mitigate"
                : "No mitigation strategy succeeded");
    }

    /** Clears the network retry counter of {@code endpoint}. */
    public void resetRetries(String endpoint) {
        retryCounters.remove(endpoint);
    }

    public int retryCount(String endpoint) {
        AtomicInteger counter = retryCounters.get(endpoint);
        return counter == null ? 0 : counter.get();
    }

    private StrategyAttempt attempt(ErrorPattern pattern, Map<String, Object> context) {
        return switch (pattern.getCategory()) {
            case NETWORK -> network(pattern, context);
            case CACHE -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), MEMORY_FALLBACK, true, true,
                    Map.of("note", "Serving from in-process memory cache"));
            case DATABASE -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), CONNECTION_POOL_REFRESH,
                    true, false, Map.of("note", "Connection pool refresh requested"));
            case CALCULATION -> calculation(pattern);
            case PRECISION -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), ADAPTIVE_PRECISION, true,
                    false, Map.of("suggestion", "Retry with reduced precision"));
            case VALIDATION -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), INPUT_SANITIZATION, true,
                    false, Map.of("suggestion", "Strip non-numeric characters and normalise separators"));
            case CURRENCY -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), CURRENCY_SUBSTITUTION, false,
                    false, Map.of("suggestion", "Choose a supported currency; substitution needs user input"));
            case SYSTEM -> new StrategyAttempt(pattern.getId(), pattern.getCategory(), "none", false, false,
                    Map.of("reason", "No automatic mitigation for system errors"));
        };
    }

    private StrategyAttempt network(ErrorPattern pattern, Map<String, Object> context) {
        String endpoint = String.valueOf(context.getOrDefault(HealingContext.ENDPOINT, UNKNOWN_ENDPOINT));
        int attempt = retryCounters.computeIfAbsent(endpoint, k -> new AtomicInteger()).incrementAndGet();
        if (!retryPolicy.isExhausted(attempt - 1)) {
            double delaySeconds = retryPolicy.delayMs(attempt) / 1000.0;
            return new StrategyAttempt(pattern.getId(), pattern.getCategory(), EXPONENTIAL_BACKOFF_RETRY, true, false,
                    Map.of("endpoint", endpoint, "attempt", attempt, "delaySeconds", delaySeconds));
        }
        log.info("Retry budget for endpoint {} exhausted after {} attempts, using fallback", endpoint, attempt - 1);
        return new StrategyAttempt(pattern.getId(), pattern.getCategory(), FALLBACK_MECHANISM, true, true,
                Map.of("endpoint", endpoint, "attempt", attempt));
    }

    private static StrategyAttempt calculation(ErrorPattern pattern) {
        String regex = pattern.getRegex().toLowerCase(Locale.ROOT);
        if (regex.contains("zero")) {
            return new StrategyAttempt(pattern.getId(), pattern.getCategory(), EPSILON_REPLACEMENT, true, false,
                    Map.of("suggestion", "Replace the zero divisor with a tiny epsilon"));
        }
        if (regex.contains("overflow")) {
            return new StrategyAttempt(pattern.getId(), pattern.getCategory(), PRECISION_ADJUSTMENT, true, false,
                    Map.of("suggestion", "Lower the working precision"));
        }
        return new StrategyAttempt(pattern.getId(), pattern.getCategory(), "none", false, false,
                Map.of("reason", "No mitigation for calculation pattern " + pattern.getId()));
    }
}
