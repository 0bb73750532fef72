package com.liveprecision.healing;

/**
 * Pipeline stages in execution order.
 */
public enum HealingStage {
    DETECTING,
    MITIGATING,
    PROCESSING,
    CORRECTING,
    LEARNING,
    DONE
}
