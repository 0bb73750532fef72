package com.liveprecision.domain;

/**
 * Broad failure family. Drives which mitigation strategy the healing pipeline tries first.
 */
public enum ErrorCategory {
    CALCULATION,
    VALIDATION,
    NETWORK,
    SYSTEM,
    DATABASE,
    CACHE,
    CURRENCY,
    PRECISION;

    public String code() {
        return name().toLowerCase();
    }
}
