package com.liveprecision.precision;

import lombok.Getter;

/**
 * Thrown by {@link PrecisionEngine} when a calculation cannot produce a value.
 * Extends {@link ArithmeticException} so the healing pipeline classifies it as an arithmetic failure.
 */
@Getter
public class PrecisionException extends ArithmeticException {

    private final PrecisionFailure failure;

    public PrecisionException(PrecisionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PrecisionException(PrecisionFailure failure, String message, Throwable cause) {
        super(message);
        this.failure = failure;
        initCause(cause);
    }
}
