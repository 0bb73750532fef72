package com.liveprecision.rates;

import lombok.Getter;

/**
 * Thrown (or signalled through a {@code Mono}) when a rate cannot be obtained.
 */
@Getter
public class RateException extends RuntimeException {

    private final RateFailure failure;

    public RateException(RateFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public RateException(RateFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
