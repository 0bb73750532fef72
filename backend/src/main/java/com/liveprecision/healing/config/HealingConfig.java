package com.liveprecision.healing.config;

import com.liveprecision.common.RetryPolicy;
import com.liveprecision.healing.DefaultErrorPatterns;
import com.liveprecision.healing.DiagnosticSink;
import com.liveprecision.healing.ErrorCorrector;
import com.liveprecision.healing.ErrorMitigator;
import com.liveprecision.healing.ErrorPatternRegistry;
import com.liveprecision.healing.ErrorProcessor;
import com.liveprecision.healing.HealingOrchestrator;
import com.liveprecision.healing.InMemoryErrorPatternRegistry;
import com.liveprecision.healing.Slf4jDiagnosticSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Healing pipeline wiring: seeded registry, stage components and orchestrator.
 */
@Configuration
@EnableConfigurationProperties(HealingProperties.class)
public class HealingConfig {

    @Bean
    public ErrorPatternRegistry errorPatternRegistry(HealingProperties properties, Clock clock) {
        InMemoryErrorPatternRegistry registry = new InMemoryErrorPatternRegistry(clock, properties.getRecentErrorsSize());
        registry.seed(DefaultErrorPatterns.create());
        return registry;
    }

    @Bean
    public ErrorMitigator errorMitigator(HealingProperties properties) {
        RetryPolicy policy = new RetryPolicy(properties.getBackoffBaseDelay().toMillis(), 0.0,
                properties.getMaxNetworkRetries());
        return new ErrorMitigator(policy);
    }

    @Bean
    public ErrorProcessor errorProcessor(HealingProperties properties) {
        return new ErrorProcessor(properties.getStackDepth());
    }

    @Bean
    public ErrorCorrector errorCorrector(HealingProperties properties) {
        return new ErrorCorrector(properties.getEpsilon(), properties.getReducedPrecision());
    }

    @Bean
    @ConditionalOnMissingBean
    public DiagnosticSink diagnosticSink() {
        return new Slf4jDiagnosticSink();
    }

    @Bean
    public HealingOrchestrator healingOrchestrator(ErrorPatternRegistry registry, ErrorMitigator mitigator,
                                                   ErrorProcessor processor, ErrorCorrector corrector,
                                                   DiagnosticSink diagnosticSink, Clock clock,
                                                   HealingProperties properties) {
        return new HealingOrchestrator(registry, mitigator, processor, corrector, diagnosticSink, clock,
                properties.getHistorySize(), properties.isEnabled());
    }
}
