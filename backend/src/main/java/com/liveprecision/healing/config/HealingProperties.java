package com.liveprecision.healing.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Healing pipeline configuration. Documented in application.yml under liveprecision.healing.
 */
@ConfigurationProperties(prefix = "liveprecision.healing")
@Validated
@Getter
@Setter
public class HealingProperties {

    /** Initial state of the pipeline; can be toggled at runtime. */
    private boolean enabled = true;

    /** Healing results kept in history, oldest evicted first. */
    @Min(1)
    private int historySize = 1000;

    /** Raw errors kept by the pattern registry. */
    @Min(1)
    private int recentErrorsSize = 1000;

    /** Backoff retries per endpoint before the mitigator reports fallback. */
    @Min(0)
    private int maxNetworkRetries = 3;

    /** Base of the reported backoff delay; attempt n waits base * 2^n. */
    @NotNull
    private Duration backoffBaseDelay = Duration.ofSeconds(1);

    /** Replacement for a zero divisor. */
    @NotBlank
    private String epsilon = "1e-60";

    /** Precision proposed when an overflow is corrected. */
    @Min(1)
    private int reducedPrecision = 40;

    /** Stack frames kept in a diagnostic bundle. */
    @Min(1)
    private int stackDepth = 10;
}
