package com.liveprecision.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Natural logarithm and exponential for {@link BigDecimal}, used for non-integer powers.
 * Both work with 20 guard digits and round to the caller's context at the end.
 */
final class DecimalMath {

    private static final int GUARD_DIGITS = 20;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal REDUCTION_LIMIT = new BigDecimal("0.01");
    private static final BigDecimal LN10_APPROX = new BigDecimal("2.302585092994045684");
    /** Results are kept to decimal exponents within the BigDecimal scale range. */
    private static final BigDecimal MAX_DECIMAL_EXPONENT = BigDecimal.valueOf(999_999_999L);

    private DecimalMath() {}

    /**
     * {@code base^exponent} for a strictly positive base.
     */
    static BigDecimal pow(BigDecimal base, BigDecimal exponent, MathContext mc) {
        MathContext work = widen(mc, GUARD_DIGITS);
        BigDecimal product = exponent.multiply(ln(base, work), work);
        return exp(product, mc);
    }

    static BigDecimal ln(BigDecimal x, MathContext mc) {
        if (x.signum() <= 0) {
            throw new ArithmeticException("Logarithm of non-positive value " + x);
        }
        if (x.compareTo(BigDecimal.ONE) == 0) {
            return BigDecimal.ZERO;
        }
        MathContext work = widen(mc, GUARD_DIGITS);
        // x = mantissa * 10^exponent with mantissa in [1, 10)
        int exponent = x.precision() - x.scale() - 1;
        BigDecimal mantissa = x.movePointLeft(exponent);
        BigDecimal result = lnReduced(mantissa, work);
        if (exponent != 0) {
            BigDecimal ln10 = lnReduced(BigDecimal.TEN, work);
            result = result.add(ln10.multiply(BigDecimal.valueOf(exponent), work), work);
        }
        return result.round(mc);
    }

    /**
     * e^x as {@code e^r * 10^k} with {@code k = round(x / ln 10)}, so the series only sees {@code |r| <= ln 10 / 2}.
     */
    static BigDecimal exp(BigDecimal x, MathContext mc) {
        if (x.signum() == 0) {
            return BigDecimal.ONE;
        }
        BigDecimal k = x.divide(LN10_APPROX, MathContext.DECIMAL64).setScale(0, RoundingMode.HALF_EVEN);
        if (k.abs().compareTo(MAX_DECIMAL_EXPONENT) > 0) {
            throw new ArithmeticException((x.signum() > 0 ? "Overflow" : "Underflow") + ": exponent "
                    + x.round(new MathContext(10)) + " exceeds maximum supported magnitude");
        }
        if (k.signum() == 0) {
            return expSeries(x, mc);
        }
        int integerDigits = Math.max(0, x.precision() - x.scale());
        MathContext work = widen(mc, GUARD_DIGITS + integerDigits);
        BigDecimal ln10 = lnReduced(BigDecimal.TEN, work);
        BigDecimal remainder = x.subtract(ln10.multiply(k, work), work);
        return expSeries(remainder, widen(mc, GUARD_DIGITS))
                .scaleByPowerOfTen(k.intValueExact())
                .round(mc);
    }

    private static BigDecimal expSeries(BigDecimal x, MathContext mc) {
        if (x.signum() == 0) {
            return BigDecimal.ONE;
        }
        if (x.signum() < 0) {
            BigDecimal positive = expSeries(x.negate(), widen(mc, 5));
            return BigDecimal.ONE.divide(positive, mc);
        }
        int halvings = 0;
        BigDecimal reduced = x;
        while (reduced.compareTo(HALF) > 0) {
            reduced = reduced.divide(TWO);
            halvings++;
        }
        MathContext work = widen(mc, GUARD_DIGITS + halvings);
        BigDecimal threshold = BigDecimal.ONE.movePointLeft(work.getPrecision() + 2);
        BigDecimal sum = BigDecimal.ONE;
        BigDecimal term = BigDecimal.ONE;
        for (int k = 1; ; k++) {
            term = term.multiply(reduced, work).divide(BigDecimal.valueOf(k), work);
            if (term.abs().compareTo(threshold) < 0) {
                break;
            }
            sum = sum.add(term, work);
        }
        for (int i = 0; i < halvings; i++) {
            sum = sum.multiply(sum, work);
        }
        return sum.round(mc);
    }

    /**
     * ln(m) for m > 0 using square-root reduction towards 1 and the series ln(m) = 2 atanh((m-1)/(m+1)).
     */
    private static BigDecimal lnReduced(BigDecimal m, MathContext work) {
        int halvings = 0;
        BigDecimal reduced = m;
        while (reduced.subtract(BigDecimal.ONE).abs().compareTo(REDUCTION_LIMIT) > 0) {
            reduced = reduced.sqrt(work);
            halvings++;
        }
        BigDecimal z = reduced.subtract(BigDecimal.ONE).divide(reduced.add(BigDecimal.ONE), work);
        BigDecimal z2 = z.multiply(z, work);
        BigDecimal threshold = BigDecimal.ONE.movePointLeft(work.getPrecision() + 2);
        BigDecimal power = z;
        BigDecimal sum = z;
        for (int k = 3; ; k += 2) {
            power = power.multiply(z2, work);
            BigDecimal term = power.divide(BigDecimal.valueOf(k), work);
            if (term.abs().compareTo(threshold) < 0) {
                break;
            }
            sum = sum.add(term, work);
        }
        return sum.multiply(BigDecimal.valueOf(1L << (halvings + 1)), work);
    }

    private static MathContext widen(MathContext mc, int extraDigits) {
        return new MathContext(mc.getPrecision() + extraDigits, RoundingMode.HALF_EVEN);
    }
}
