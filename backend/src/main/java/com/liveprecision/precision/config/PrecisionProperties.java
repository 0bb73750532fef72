package com.liveprecision.precision.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine configuration under liveprecision.precision.
 */
@ConfigurationProperties(prefix = "liveprecision.precision")
@Validated
@Getter
@Setter
public class PrecisionProperties {

    /**
     * Significant digits used when a request carries no precision override.
     */
    @Min(1)
    @Max(1000)
    private int digits = 60;

    /**
     * Upper bound accepted for a per-request precision override.
     */
    @Min(1)
    @Max(10000)
    private int maxDigits = 1000;
}
