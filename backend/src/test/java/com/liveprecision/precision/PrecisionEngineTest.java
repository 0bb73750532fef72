package com.liveprecision.precision;

import com.liveprecision.domain.HighPrecisionValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.MathContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrecisionEngineTest {

    private final PrecisionEngine engine = new PrecisionEngine();

    private static PrecisionFailure failureOf(Runnable call) {
        try {
            call.run();
        } catch (PrecisionException e) {
            return e.getFailure();
        }
        throw new AssertionError("expected PrecisionException");
    }

    @ParameterizedTest(name = "{0} {1} {2} = {3}")
    @CsvSource({
            "add, 1.5, 2.5, 4.0",
            "+, 0.1, 0.2, 0.3",
            "subtract, 10, 0.25, 9.75",
            "*, 1.5, -2, -3.0",
            "DIVIDE, 10, 4, 2.5",
            "power, 2, 10, 1024",
            "^, 3, 3, 27",
            "'**', 10, -2, 0.01",
    })
    void binaryOperationsAndAliases(String op, String a, String b, String expected) {
        assertThat(engine.calculate(op, a, b).toString()).isEqualTo(expected);
    }

    @Test
    void unaryOperationsIgnoreSecondOperand() {
        assertThat(engine.calculate("sqrt", "16", null).toBigDecimal()).isEqualByComparingTo("4");
        assertThat(engine.calculate("square_root", "16", "999").toBigDecimal()).isEqualByComparingTo("4");
        assertThat(engine.calculate("abs", "-5", null).toString()).isEqualTo("5");
        assertThat(engine.calculate("negative", "5", "").toString()).isEqualTo("-5");
    }

    @Test
    @DisplayName("results carry at most the configured significant digits")
    void resultsAreQuantized() {
        HighPrecisionValue third = engine.calculate("divide", "1", "3");
        assertThat(third.toBigDecimal().precision()).isEqualTo(60);

        HighPrecisionValue product = engine.calculate("multiply", "1." + "1".repeat(40), "1." + "1".repeat(40));
        assertThat(product.toBigDecimal().precision()).isLessThanOrEqualTo(60);

        PrecisionEngine narrow = new PrecisionEngine(5, 100);
        assertThat(narrow.calculate("divide", "2", "3").toString()).isEqualTo("0.66667");
    }

    @Test
    void precisionOverrideAppliesToSingleCall() {
        assertThat(engine.calculate("divide", "1", "3", 10).toString()).isEqualTo("0.3333333333");
        assertThat(engine.calculate("divide", "1", "3").toBigDecimal().precision()).isEqualTo(60);
        assertThat(failureOf(() -> engine.calculate("divide", "1", "3", 0)))
                .isEqualTo(PrecisionFailure.INVALID_OPERATION);
        assertThat(failureOf(() -> engine.calculate("divide", "1", "3", 1001)))
                .isEqualTo(PrecisionFailure.INVALID_OPERATION);
    }

    @Test
    void sameInputsGiveSameOutput() {
        HighPrecisionValue first = engine.calculate("power", "1.0001", "12345.5");
        HighPrecisionValue second = engine.calculate("power", "1.0001", "12345.5");
        assertThat(first.toString()).isEqualTo(second.toString());
    }

    @Test
    void tinyDivisorDoesNotFail() {
        assertThat(engine.calculate("divide", "10", "1e-60").toBigDecimal()).isEqualByComparingTo("1E+61");
    }

    @Test
    void divisionByZero() {
        assertThatThrownBy(() -> engine.calculate("divide", "10", "0"))
                .isInstanceOf(PrecisionException.class)
                .hasMessage("Division by zero: divisor is exactly 0");
        assertThat(failureOf(() -> engine.calculate("/", "10", "0.000"))).isEqualTo(PrecisionFailure.DIVISION_BY_ZERO);
        assertThat(failureOf(() -> engine.calculate("power", "0", "-1"))).isEqualTo(PrecisionFailure.DIVISION_BY_ZERO);
    }

    @Test
    void invalidLiteralNamesTheOperand() {
        assertThatThrownBy(() -> engine.calculate("add", "abc", "1"))
                .isInstanceOf(PrecisionException.class)
                .hasMessage("Invalid literal for operand1: 'abc'");
        assertThatThrownBy(() -> engine.calculate("add", "1", "12a.5"))
                .hasMessage("Invalid literal for operand2: '12a.5'");
    }

    @Test
    void operand1IsValidatedBeforeArity() {
        assertThat(failureOf(() -> engine.calculate("add", "abc", null)))
                .isEqualTo(PrecisionFailure.INVALID_NUMERIC_LITERAL);
        assertThat(failureOf(() -> engine.calculate("add", "1", null)))
                .isEqualTo(PrecisionFailure.MISSING_OPERAND);
    }

    @Test
    void unsupportedOperation() {
        assertThatThrownBy(() -> engine.calculate("modulo", "5", "2"))
                .isInstanceOf(PrecisionException.class)
                .hasMessage("Unsupported operation: 'modulo'");
        assertThat(failureOf(() -> engine.calculate(null, "5", "2"))).isEqualTo(PrecisionFailure.UNSUPPORTED_OPERATION);
    }

    @Test
    void negativeRadicand() {
        assertThatThrownBy(() -> engine.calculate("sqrt", "-4", null))
                .isInstanceOf(PrecisionException.class)
                .hasMessage("Cannot take square root of negative number -4");
    }

    @Test
    void powerEdgeCases() {
        assertThat(engine.calculate("power", "-2", "3").toString()).isEqualTo("-8");
        assertThat(failureOf(() -> engine.calculate("power", "-8", "0.5"))).isEqualTo(PrecisionFailure.INVALID_OPERATION);
        assertThat(failureOf(() -> engine.calculate("power", "10", "1000000000"))).isEqualTo(PrecisionFailure.OVERFLOW);
    }

    @Test
    void nonIntegerPowerWithLargeResult() {
        assertThat(engine.calculate("power", "1e500000", "1.5").toBigDecimal())
                .isEqualByComparingTo("1E+750000");
    }

    @Test
    void nonIntegerPowerWithTinyResult() {
        MathContext mc = new MathContext(80);
        BigDecimal expected = BigDecimal.ONE.divide(
                BigDecimal.valueOf(2).pow(2_000_000, mc).multiply(BigDecimal.valueOf(2).sqrt(mc), mc), mc);

        BigDecimal actual = engine.calculate("power", "0.5", "2000000.5").toBigDecimal();

        assertThat(actual.divide(expected, mc).subtract(BigDecimal.ONE).abs())
                .isLessThan(new BigDecimal("1e-40"));
    }

    @Test
    void nonIntegerPowerBeyondDecimalRange() {
        assertThatThrownBy(() -> engine.calculate("power", "10", "1500000000.5"))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("Overflow");
        assertThatThrownBy(() -> engine.calculate("power", "0.1", "2000000000.5"))
                .isInstanceOf(PrecisionException.class)
                .hasMessageContaining("Underflow");
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new PrecisionEngine(0, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PrecisionEngine(200, 100)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void operationLookup() {
        assertThat(Operation.fromName(" Square_Root ")).contains(Operation.SQRT);
        assertThat(Operation.fromName("mod")).isEmpty();
        assertThat(Operation.POWER.getAliases()).containsExactly("power", "**", "^");
        assertThat(Operation.NEGATE.isBinary()).isFalse();
    }
}
