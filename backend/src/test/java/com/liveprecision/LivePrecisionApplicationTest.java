package com.liveprecision;

import com.liveprecision.calculation.CalculationOutcome;
import com.liveprecision.calculation.CalculationService;
import com.liveprecision.healing.HealingOrchestrator;
import com.liveprecision.precision.PrecisionEngine;
import com.liveprecision.rates.RateAggregator;
import com.liveprecision.rates.RateProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class LivePrecisionApplicationTest {

    @Autowired
    private CalculationService calculationService;

    @Autowired
    private RateAggregator rateAggregator;

    @Autowired
    private PrecisionEngine precisionEngine;

    @Autowired
    private HealingOrchestrator healingOrchestrator;

    @Test
    void contextWiresConfiguredComponents() {
        assertThat(precisionEngine.getDefaultPrecision()).isEqualTo(60);
        assertThat(precisionEngine.getMaxPrecision()).isEqualTo(1000);
        assertThat(rateAggregator.getProviders()).extracting(RateProvider::name).containsExactly("fallback");
        assertThat(healingOrchestrator.isActive()).isTrue();
        assertThat(healingOrchestrator.getRegistry().patterns()).hasSize(8);
    }

    @Test
    void endToEndConversionUsesConfiguredFallbackRate() {
        CalculationOutcome outcome = calculationService.calculate("add", "123.45", "67.8", "USD", "EUR");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.result()).isEqualTo("162.56");
        assertThat(outcome.metadata().rateSource()).isEqualTo("fallback");
    }

    @Test
    void endToEndHealing() {
        CalculationOutcome outcome = calculationService.calculate("divide", "10", "0", "USD", "USD");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.healingApplied()).isTrue();
        assertThat(outcome.healedResult()).isNotNull();
    }
}
