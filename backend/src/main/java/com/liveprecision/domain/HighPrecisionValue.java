package com.liveprecision.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable arbitrary-precision decimal. Every operation returns a new value; operations that can lose
 * exactness (divide, sqrt, non-integer power) are rounded HALF_EVEN to the supplied {@link MathContext}.
 * Equality ignores scale, so {@code 4.0} equals {@code 4}.
 */
public final class HighPrecisionValue implements Comparable<HighPrecisionValue> {

    public static final int DEFAULT_PRECISION = 60;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final MathContext DEFAULT_CONTEXT = new MathContext(DEFAULT_PRECISION, ROUNDING);

    public static final HighPrecisionValue ZERO = new HighPrecisionValue(BigDecimal.ZERO);
    public static final HighPrecisionValue ONE = new HighPrecisionValue(BigDecimal.ONE);

    /** Largest exponent handed to {@link BigDecimal#pow(int, MathContext)}. */
    private static final BigDecimal MAX_INTEGER_EXPONENT = BigDecimal.valueOf(999_999_999L);

    private final BigDecimal value;

    private HighPrecisionValue(BigDecimal value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static HighPrecisionValue of(BigDecimal value) {
        return new HighPrecisionValue(value);
    }

    /**
     * Parses a decimal literal such as {@code "123.45"}, {@code "-0.5"} or {@code "1e-60"}.
     *
     * @throws NumberFormatException when the literal is null, blank or not a finite decimal
     */
    public static HighPrecisionValue parse(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new NumberFormatException("empty literal");
        }
        return new HighPrecisionValue(new BigDecimal(literal.strip()));
    }

    public static MathContext context(int precision) {
        return new MathContext(precision, ROUNDING);
    }

    public HighPrecisionValue add(HighPrecisionValue other, MathContext mc) {
        return new HighPrecisionValue(value.add(other.value, mc));
    }

    public HighPrecisionValue subtract(HighPrecisionValue other, MathContext mc) {
        return new HighPrecisionValue(value.subtract(other.value, mc));
    }

    public HighPrecisionValue multiply(HighPrecisionValue other, MathContext mc) {
        return new HighPrecisionValue(value.multiply(other.value, mc));
    }

    /**
     * @throws ArithmeticException when {@code divisor} is exactly zero
     */
    public HighPrecisionValue divide(HighPrecisionValue divisor, MathContext mc) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        return new HighPrecisionValue(value.divide(divisor.value, mc));
    }

    /**
     * Raises this value to {@code exponent}. Integral exponents use exact repeated squaring under {@code mc};
     * other exponents go through {@code exp(y * ln(x))} with guard digits.
     *
     * @throws ArithmeticException for zero raised to a negative power, a negative base with a non-integer
     *                             exponent, or a result outside the representable range
     */
    public HighPrecisionValue pow(HighPrecisionValue exponent, MathContext mc) {
        if (isZero()) {
            if (exponent.signum() < 0) {
                throw new ArithmeticException("Division by zero: zero raised to a negative power");
            }
            return exponent.isZero() ? ONE : ZERO;
        }
        if (exponent.isInteger() && fitsIntegerPower(exponent.value, mc)) {
            return new HighPrecisionValue(value.pow(exponent.value.intValueExact(), mc));
        }
        if (value.signum() < 0) {
            if (exponent.isInteger()) {
                HighPrecisionValue magnitude = abs().pow(exponent, mc);
                boolean odd = exponent.value.toBigInteger().testBit(0);
                return odd ? magnitude.negate() : magnitude;
            }
            throw new ArithmeticException("Invalid operation: negative base " + value
                    + " with non-integer exponent " + exponent.value);
        }
        return new HighPrecisionValue(DecimalMath.pow(value, exponent.value, mc));
    }

    /**
     * @throws ArithmeticException when this value is negative
     */
    public HighPrecisionValue sqrt(MathContext mc) {
        if (value.signum() < 0) {
            throw new ArithmeticException("Square root of negative number " + value);
        }
        return new HighPrecisionValue(value.sqrt(mc));
    }

    public HighPrecisionValue abs() {
        return value.signum() < 0 ? new HighPrecisionValue(value.negate()) : this;
    }

    public HighPrecisionValue negate() {
        return new HighPrecisionValue(value.negate());
    }

    /**
     * Quantizes to {@code mc.getPrecision()} significant digits.
     */
    public HighPrecisionValue round(MathContext mc) {
        return new HighPrecisionValue(value.round(mc));
    }

    /**
     * Rounds to a fixed number of decimal places (currency display rounding).
     */
    public HighPrecisionValue roundToDecimalPlaces(int decimalPlaces) {
        return new HighPrecisionValue(value.setScale(decimalPlaces, ROUNDING));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public int signum() {
        return value.signum();
    }

    public boolean isInteger() {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    public BigDecimal toBigDecimal() {
        return value;
    }

    public String toPlainString() {
        return value.toPlainString();
    }

    private static boolean fitsIntegerPower(BigDecimal exponent, MathContext mc) {
        BigDecimal magnitude = exponent.abs();
        if (magnitude.compareTo(MAX_INTEGER_EXPONENT) > 0) {
            return false;
        }
        int digits = magnitude.stripTrailingZeros().precision() - magnitude.stripTrailingZeros().scale();
        return mc.getPrecision() == 0 || digits <= mc.getPrecision();
    }

    @Override
    public int compareTo(HighPrecisionValue o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HighPrecisionValue that = (HighPrecisionValue) o;
        return value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
