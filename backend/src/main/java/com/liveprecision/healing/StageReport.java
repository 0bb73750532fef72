package com.liveprecision.healing;

/**
 * Timing and status of one executed stage. {@code error} is set when the stage threw.
 */
public record StageReport(HealingStage stage, boolean success, long durationMs, String error) {
}
