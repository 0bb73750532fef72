package com.liveprecision.healing;

/**
 * Receives each stage's outcome as it completes. Implementations must not throw.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void accept(String healingId, HealingStage stage, Object outcome);
}
