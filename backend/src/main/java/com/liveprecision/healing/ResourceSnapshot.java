package com.liveprecision.healing;

/**
 * JVM resource usage at diagnosis time. {@code systemLoadAverage} is negative where the OS does not report it.
 */
public record ResourceSnapshot(long heapUsedBytes, long heapMaxBytes, int availableProcessors, double systemLoadAverage) {
}
