package com.liveprecision.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HighPrecisionValueTest {

    private static final MathContext MC = HighPrecisionValue.DEFAULT_CONTEXT;

    private static HighPrecisionValue v(String s) {
        return HighPrecisionValue.parse(s);
    }

    @Test
    @DisplayName("divide rounds to 60 significant digits")
    void divideRoundsToContext() {
        HighPrecisionValue third = v("1").divide(v("3"), MC);
        assertThat(third.toBigDecimal().precision()).isEqualTo(60);
        assertThat(third.toString()).isEqualTo("0." + "3".repeat(60));

        HighPrecisionValue twoThirds = v("2").divide(v("3"), MC);
        assertThat(twoThirds.toString()).endsWith("67");
    }

    @Test
    void divideByZeroThrows() {
        assertThatThrownBy(() -> v("1").divide(HighPrecisionValue.ZERO, MC))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("Division by zero");
    }

    @Test
    void tinyDivisorGivesHugeQuotient() {
        assertThat(v("10").divide(v("1e-60"), MC).toBigDecimal()).isEqualByComparingTo("1E+61");
    }

    @Test
    void integerPowers() {
        assertThat(v("2").pow(v("10"), MC).toBigDecimal()).isEqualByComparingTo("1024");
        assertThat(v("2").pow(v("-1"), MC).toBigDecimal()).isEqualByComparingTo("0.5");
        assertThat(v("-2").pow(v("3"), MC).toBigDecimal()).isEqualByComparingTo("-8");
        assertThat(v("7").pow(v("0"), MC)).isEqualTo(HighPrecisionValue.ONE);
        assertThat(v("0").pow(v("0"), MC)).isEqualTo(HighPrecisionValue.ONE);
    }

    @Test
    @DisplayName("non-integer power matches sqrt to within rounding")
    void fractionalPower() {
        BigDecimal viaPow = v("2").pow(v("0.5"), MC).toBigDecimal();
        BigDecimal viaSqrt = v("2").sqrt(MC).toBigDecimal();
        assertThat(viaPow.subtract(viaSqrt).abs()).isLessThan(new BigDecimal("1e-55"));
        assertThat(viaSqrt.toString()).startsWith("1.41421356237309504880168872420969807856967187537694807317");
    }

    @Test
    void fractionalPowerOfSmallAndLargeBases() {
        BigDecimal small = v("1e-30").pow(v("0.5"), MC).toBigDecimal();
        assertThat(small.subtract(new BigDecimal("1e-15")).abs()).isLessThan(new BigDecimal("1e-65"));

        BigDecimal large = v("1e40").pow(v("0.25"), MC).toBigDecimal();
        assertThat(large.subtract(new BigDecimal("1e10")).abs()).isLessThan(new BigDecimal("1e-45"));
    }

    @Test
    void negativeBaseWithFractionalExponentThrows() {
        assertThatThrownBy(() -> v("-8").pow(v("0.5"), MC))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("negative base");
    }

    @Test
    void zeroToNegativePowerThrows() {
        assertThatThrownBy(() -> v("0").pow(v("-2"), MC))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("Division by zero");
    }

    @Test
    void hugeExponentOverflows() {
        assertThatThrownBy(() -> v("10").pow(v("1000000000"), MC))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("Overflow");
    }

    @Test
    void sqrtOfNegativeThrows() {
        assertThatThrownBy(() -> v("-4").sqrt(MC)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void absNegateAndRounding() {
        assertThat(v("-5.5").abs().toString()).isEqualTo("5.5");
        assertThat(v("5.5").negate().toString()).isEqualTo("-5.5");
        assertThat(v("2.345").roundToDecimalPlaces(2).toString()).isEqualTo("2.34");
        assertThat(v("2.355").roundToDecimalPlaces(2).toString()).isEqualTo("2.36");
        assertThat(v("123456").round(HighPrecisionValue.context(3)).toString()).isEqualTo("1.23E+5");
    }

    @Test
    @DisplayName("equality ignores scale")
    void equalityIgnoresScale() {
        assertThat(v("4.0")).isEqualTo(v("4"));
        assertThat(v("4.0").hashCode()).isEqualTo(v("4").hashCode());
        assertThat(v("4.0").toString()).isEqualTo("4.0");
        assertThat(v("4.00").isInteger()).isTrue();
        assertThat(v("4.01").isInteger()).isFalse();
    }

    @Test
    void parseRejectsGarbage() {
        assertThatThrownBy(() -> HighPrecisionValue.parse("abc")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> HighPrecisionValue.parse(" ")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> HighPrecisionValue.parse(null)).isInstanceOf(NumberFormatException.class);
        assertThat(HighPrecisionValue.parse(" 1.5 ").toString()).isEqualTo("1.5");
    }
}
