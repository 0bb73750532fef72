package com.liveprecision.domain;

/**
 * Ordered from least to most severe; {@link #compareTo} reflects that order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public String code() {
        return name().toLowerCase();
    }
}
