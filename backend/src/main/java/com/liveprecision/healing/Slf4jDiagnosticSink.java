package com.liveprecision.healing;

import lombok.extern.slf4j.Slf4j;

/**
 * Forwards stage outcomes to SLF4J at DEBUG.
 */
@Slf4j
public class Slf4jDiagnosticSink implements DiagnosticSink {

    @Override
    public void accept(String healingId, HealingStage stage, Object outcome) {
        if (log.isDebugEnabled()) {
            log.debug("healing {} stage {}: {}", healingId, stage, outcome);
        }
    }
}
