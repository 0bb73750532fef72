package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorProcessorTest {

    private static final Map<String, ErrorPattern> DEFAULTS = DefaultErrorPatterns.create().stream()
            .collect(Collectors.toMap(ErrorPattern::getId, Function.identity()));

    private final ErrorProcessor processor = new ErrorProcessor(3);

    private static ErrorPattern high(String id) {
        return new ErrorPattern(id, id, "T", ErrorCategory.DATABASE, Severity.HIGH, false, "fix " + id);
    }

    @Test
    void process_runsAllSteps() {
        ProcessingOutcome outcome = processor.process(new ArithmeticException("Division by zero"),
                Map.of(HealingContext.OPERAND2, "0"), List.of(DEFAULTS.get(DefaultErrorPatterns.DIV_BY_ZERO)));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.steps())
                .containsExactly("impact_assessed", "recommendations_generated", "diagnostics_collected");
    }

    @Test
    void impact_scoresBySeverity() {
        ImpactAssessment impact = processor.assessImpact(List.of(
                DEFAULTS.get(DefaultErrorPatterns.DIV_BY_ZERO), DEFAULTS.get(DefaultErrorPatterns.INVALID_DECIMAL)));

        assertThat(impact.score()).isEqualTo(7);
        assertThat(impact.priority()).isEqualTo(Severity.HIGH);
        assertThat(impact.userImpact()).isEqualTo("medium");
        assertThat(impact.affectedComponents()).containsExactly("calculation_engine");
        assertThat(impact.estimatedDowntime()).isEqualTo("minimal");
    }

    @Test
    void impact_withoutPatterns() {
        ImpactAssessment impact = processor.assessImpact(List.of());
        assertThat(impact.score()).isZero();
        assertThat(impact.priority()).isEqualTo(Severity.MEDIUM);
        assertThat(impact.userImpact()).isEqualTo("low");
        assertThat(impact.estimatedDowntime()).isEqualTo("none");
    }

    @Test
    void recommend_addsSystemLevelEntryForSevereImpact() {
        List<ErrorPattern> patterns = List.of(high("a"), high("b"));
        ImpactAssessment impact = processor.assessImpact(patterns);
        List<Recommendation> recommendations = processor.recommend(patterns, impact);

        assertThat(impact.priority()).isEqualTo(Severity.CRITICAL);
        assertThat(impact.affectedComponents()).containsExactly("persistence_layer");
        assertThat(recommendations).extracting(Recommendation::patternId)
                .containsExactly("a", "b", Recommendation.SYSTEM_LEVEL);
        Recommendation first = recommendations.get(0);
        assertThat(first.priority()).isEqualTo(Severity.CRITICAL);
        assertThat(first.effort()).isEqualTo("medium");
        assertThat(first.successRate()).isEqualTo(0.5);
    }

    @Test
    void recommend_lowEffortForAutoFixablePatterns() {
        ErrorPattern divByZero = DEFAULTS.get(DefaultErrorPatterns.DIV_BY_ZERO);
        List<Recommendation> recommendations = processor.recommend(List.of(divByZero),
                processor.assessImpact(List.of(divByZero)));

        assertThat(recommendations).singleElement()
                .satisfies(r -> {
                    assertThat(r.autoApplicable()).isTrue();
                    assertThat(r.effort()).isEqualTo("low");
                    assertThat(r.priority()).isEqualTo(Severity.HIGH);
                });
    }

    @Test
    void diagnose_collectsContextFramesAndHints() {
        ArithmeticException error = new ArithmeticException("Division by zero");
        Map<String, Object> context = new java.util.HashMap<>();
        context.put(HealingContext.OPERAND2, 0);
        context.put(HealingContext.OPERATION, "divide");
        context.put("ignored", null);

        DiagnosticBundle bundle = processor.diagnose(error, context,
                List.of(DEFAULTS.get(DefaultErrorPatterns.DIV_BY_ZERO)));

        assertThat(bundle.errorType()).isEqualTo("ArithmeticException");
        assertThat(bundle.stackFrames()).hasSizeLessThanOrEqualTo(3).isNotEmpty();
        assertThat(bundle.context()).containsOnly(
                Map.entry(HealingContext.OPERAND2, "0"), Map.entry(HealingContext.OPERATION, "divide"));
        assertThat(bundle.hints()).containsExactly("Check input validation for calculation parameters",
                "Review recent system resource usage patterns");
        assertThat(bundle.keywords()).containsExactly("DivisionByZero", "ArithmeticException");
        assertThat(bundle.resources().availableProcessors()).isPositive();
    }

    @Test
    void fingerprint_isStableAndShort() {
        String a = ErrorProcessor.fingerprint("ArithmeticException", "Division by zero");
        assertThat(a).hasSize(16).matches("[0-9a-f]+");
        assertThat(ErrorProcessor.fingerprint("ArithmeticException", "Division by zero")).isEqualTo(a);
        assertThat(ErrorProcessor.fingerprint("ArithmeticException", "Division by one")).isNotEqualTo(a);
        String longA = "x".repeat(100);
        assertThat(ErrorProcessor.fingerprint("T", longA + "tail1")).isEqualTo(ErrorProcessor.fingerprint("T", longA + "tail2"));
    }
}
