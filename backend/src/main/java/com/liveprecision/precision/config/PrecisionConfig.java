package com.liveprecision.precision.config;

import com.liveprecision.precision.PrecisionEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PrecisionProperties.class)
public class PrecisionConfig {

    @Bean
    public PrecisionEngine precisionEngine(PrecisionProperties properties) {
        return new PrecisionEngine(properties.getDigits(), properties.getMaxDigits());
    }
}
