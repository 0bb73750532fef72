package com.liveprecision.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter. Delay for attempt {@code n} is {@code baseDelay * 2^n}.
 * The healing mitigator uses it with a 1s base and no jitter, so attempts 1..3 wait 2s, 4s and 8s.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the given attempt. Attempt 0 yields the base delay.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    /**
     * True once {@code attemptsMade} retries have used up the budget.
     */
    public boolean isExhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /**
     * Network mitigation default: 1s base, no jitter, 3 attempts before switching to fallback.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.0, 3);
    }
}
