package com.liveprecision.healing;

import com.liveprecision.domain.ErrorCategory;
import com.liveprecision.domain.ErrorPattern;
import com.liveprecision.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryErrorPatternRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryErrorPatternRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryErrorPatternRegistry(CLOCK, 3);
        registry.seed(DefaultErrorPatterns.create());
    }

    @Test
    void detect_matchesSeededPattern() {
        DetectionOutcome outcome = registry.detect(new ArithmeticException("Division by zero"), Map.of());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.patternIds()).containsExactly(DefaultErrorPatterns.DIV_BY_ZERO);
        assertThat(outcome.newPatternLearned()).isFalse();
        assertThat(outcome.primaryCategory()).isEqualTo(ErrorCategory.CALCULATION);
        ErrorPattern pattern = registry.find(DefaultErrorPatterns.DIV_BY_ZERO).orElseThrow();
        assertThat(pattern.getOccurrenceCount()).isEqualTo(1);
        assertThat(pattern.getLastSeen()).isEqualTo(CLOCK.instant());
    }

    @Test
    void detect_matchesOnExceptionTypeToo() {
        DetectionOutcome outcome = registry.detect(new NumberFormatException("For input string: \"x\""), Map.of());
        assertThat(outcome.patternIds()).contains(DefaultErrorPatterns.INVALID_DECIMAL);
    }

    @Test
    @DisplayName("unmatched error synthesizes a pattern that matches it next time")
    void detect_learnsUnknownError() {
        IllegalStateException error = new IllegalStateException("widget exploded");

        DetectionOutcome first = registry.detect(error, Map.of());
        DetectionOutcome second = registry.detect(error, Map.of());

        assertThat(first.newPatternLearned()).isTrue();
        assertThat(first.patternIds()).containsExactly("auto_IllegalStateException_9");
        ErrorPattern learned = first.patterns().get(0);
        assertThat(learned.getCategory()).isEqualTo(ErrorCategory.SYSTEM);
        assertThat(learned.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(learned.isAutoFixAvailable()).isFalse();

        assertThat(second.newPatternLearned()).isFalse();
        assertThat(second.patternIds()).containsExactly("auto_IllegalStateException_9");
        assertThat(registry.patterns()).hasSize(9);
        assertThat(learned.getOccurrenceCount()).isEqualTo(2);
    }

    @Test
    void detect_synthesizedCategoryFollowsErrorKind() {
        ErrorPattern arithmetic = registry.detect(new ArithmeticException("weird result"), Map.of()).patterns().get(0);
        assertThat(arithmetic.getCategory()).isEqualTo(ErrorCategory.CALCULATION);
        assertThat(arithmetic.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(arithmetic.isAutoFixAvailable()).isTrue();

        ErrorPattern database = registry.detect(new IllegalStateException("database is read-only"), Map.of())
                .patterns().get(0);
        assertThat(database.getCategory()).isEqualTo(ErrorCategory.DATABASE);

        ErrorPattern noMessage = registry.detect(new UnsupportedOperationException(), Map.of()).patterns().get(0);
        assertThat(noMessage.getRegex()).contains("UnsupportedOperationException");
    }

    @Test
    void learn_isIdempotentById() {
        ErrorPattern duplicate = new ErrorPattern(DefaultErrorPatterns.DIV_BY_ZERO, "whatever", "X",
                ErrorCategory.SYSTEM, Severity.LOW, false, "none");
        ErrorPattern kept = registry.learn(duplicate);

        assertThat(kept).isNotSameAs(duplicate);
        assertThat(kept.getCategory()).isEqualTo(ErrorCategory.CALCULATION);
        assertThat(registry.patterns()).hasSize(8);
    }

    @Test
    void recordOutcome_adjustsSuccessRate() {
        registry.recordOutcome(DefaultErrorPatterns.OVERFLOW, true);
        registry.recordOutcome(DefaultErrorPatterns.NETWORK_TIMEOUT, false);
        registry.recordOutcome("no_such_pattern", true);

        assertThat(registry.find(DefaultErrorPatterns.OVERFLOW).orElseThrow().getSuccessRate())
                .isCloseTo(0.55, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(registry.find(DefaultErrorPatterns.NETWORK_TIMEOUT).orElseThrow().getSuccessRate())
                .isCloseTo(0.45, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void recentErrorsAreBoundedAndCountsKept() {
        for (int i = 0; i < 5; i++) {
            registry.detect(new ArithmeticException("Division by zero " + i), Map.of("i", i));
        }
        registry.detect(new IllegalStateException("connection reset"), Map.of());

        assertThat(registry.recentErrors()).hasSize(3);
        assertThat(registry.recentErrors().get(2).errorType()).isEqualTo("IllegalStateException");
        assertThat(registry.errorCountsByType())
                .containsEntry("ArithmeticException", 5L)
                .containsEntry("IllegalStateException", 1L);
    }

    @Test
    @DisplayName("concurrent detections of the same unknown error learn one pattern")
    void detect_concurrentLearningIsSingle() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<DetectionOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> registry.detect(new IllegalStateException("flux capacitor drained"), Map.of()));
            }
            long learned = 0;
            for (Future<DetectionOutcome> f : pool.invokeAll(tasks)) {
                if (f.get().newPatternLearned()) {
                    learned++;
                }
            }
            assertThat(learned).isEqualTo(1);
            assertThat(registry.patterns()).filteredOn(p -> p.getId().startsWith("auto_")).hasSize(1);
            assertThat(registry.patterns().get(8).getOccurrenceCount()).isEqualTo(64);
        } finally {
            pool.shutdownNow();
        }
    }
}
