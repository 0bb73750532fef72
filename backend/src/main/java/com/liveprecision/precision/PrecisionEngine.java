package com.liveprecision.precision;

import com.liveprecision.domain.HighPrecisionValue;
import lombok.extern.slf4j.Slf4j;

import java.math.MathContext;
import java.util.Locale;

/**
 * Stateless arbitrary-precision calculator. Operands arrive as decimal literals; every successful result is
 * quantized to the active number of significant digits with HALF_EVEN rounding.
 * <p>
 * Validation order: operation name, operand1 literal, arity, operand2 literal. No arithmetic runs before all
 * inputs are valid. Safe for concurrent use.
 */
@Slf4j
public class PrecisionEngine {

    private final int defaultPrecision;
    private final int maxPrecision;
    private final MathContext defaultContext;

    public PrecisionEngine(int defaultPrecision, int maxPrecision) {
        if (defaultPrecision < 1 || defaultPrecision > maxPrecision) {
            throw new IllegalArgumentException("precision must be in [1, " + maxPrecision + "], got " + defaultPrecision);
        }
        this.defaultPrecision = defaultPrecision;
        this.maxPrecision = maxPrecision;
        this.defaultContext = HighPrecisionValue.context(defaultPrecision);
    }

    public PrecisionEngine() {
        this(HighPrecisionValue.DEFAULT_PRECISION, 1000);
    }

    public HighPrecisionValue calculate(String operation, String operand1, String operand2) {
        return calculate(operation, operand1, operand2, null);
    }

    /**
     * @param operation         operation name or alias, e.g. {@code "divide"} or {@code "/"}
     * @param operand1          first operand literal
     * @param operand2          second operand literal; null or blank for unary operations
     * @param precisionOverride significant digits for this call only; null uses the configured default
     * @throws PrecisionException with the failure code describing why no value was produced
     */
    public HighPrecisionValue calculate(String operation, String operand1, String operand2, Integer precisionOverride) {
        Operation op = Operation.fromName(operation)
                .orElseThrow(() -> new PrecisionException(PrecisionFailure.UNSUPPORTED_OPERATION,
                        "Unsupported operation: '" + operation + "'"));
        MathContext mc = contextFor(precisionOverride);
        HighPrecisionValue a = parseOperand("operand1", operand1);
        HighPrecisionValue b = null;
        if (op.isBinary()) {
            if (operand2 == null || operand2.isBlank()) {
                throw new PrecisionException(PrecisionFailure.MISSING_OPERAND,
                        "Operation '" + op.getName() + "' requires two operands: operand2 is missing");
            }
            b = parseOperand("operand2", operand2);
        }
        HighPrecisionValue result = apply(op, a, b, mc).round(mc);
        log.debug("{} {} {} = {} (precision {})", op.getName(), operand1, operand2, result, mc.getPrecision());
        return result;
    }

    public int getDefaultPrecision() {
        return defaultPrecision;
    }

    public int getMaxPrecision() {
        return maxPrecision;
    }

    private HighPrecisionValue apply(Operation op, HighPrecisionValue a, HighPrecisionValue b, MathContext mc) {
        try {
            return switch (op) {
                case ADD -> a.add(b, mc);
                case SUBTRACT -> a.subtract(b, mc);
                case MULTIPLY -> a.multiply(b, mc);
                case DIVIDE -> {
                    if (b.isZero()) {
                        throw new PrecisionException(PrecisionFailure.DIVISION_BY_ZERO,
                                "Division by zero: divisor is exactly 0");
                    }
                    yield a.divide(b, mc);
                }
                case POWER -> power(a, b, mc);
                case SQRT -> {
                    if (a.isNegative()) {
                        throw new PrecisionException(PrecisionFailure.NEGATIVE_RADICAND,
                                "Cannot take square root of negative number " + a);
                    }
                    yield a.sqrt(mc);
                }
                case ABS -> a.abs();
                case NEGATE -> a.negate();
            };
        } catch (PrecisionException e) {
            throw e;
        } catch (ArithmeticException e) {
            throw translate(op, e);
        }
    }

    private HighPrecisionValue power(HighPrecisionValue base, HighPrecisionValue exponent, MathContext mc) {
        if (base.isZero() && exponent.isNegative()) {
            throw new PrecisionException(PrecisionFailure.DIVISION_BY_ZERO,
                    "Division by zero: 0 raised to negative power " + exponent);
        }
        if (base.isNegative() && !exponent.isInteger()) {
            throw new PrecisionException(PrecisionFailure.INVALID_OPERATION,
                    "Invalid operation: negative base " + base + " with non-integer exponent " + exponent);
        }
        return base.pow(exponent, mc);
    }

    private static PrecisionException translate(Operation op, ArithmeticException e) {
        String message = String.valueOf(e.getMessage());
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("overflow") || lower.contains("underflow")) {
            return new PrecisionException(PrecisionFailure.OVERFLOW,
                    "Numeric overflow in " + op.getName() + ": " + message, e);
        }
        return new PrecisionException(PrecisionFailure.INVALID_OPERATION,
                "Invalid operation " + op.getName() + ": " + message, e);
    }

    private MathContext contextFor(Integer precisionOverride) {
        if (precisionOverride == null) {
            return defaultContext;
        }
        if (precisionOverride < 1 || precisionOverride > maxPrecision) {
            throw new PrecisionException(PrecisionFailure.INVALID_OPERATION,
                    "Invalid precision override " + precisionOverride + ": must be in [1, " + maxPrecision + "]");
        }
        return HighPrecisionValue.context(precisionOverride);
    }

    private static HighPrecisionValue parseOperand(String name, String literal) {
        try {
            return HighPrecisionValue.parse(literal);
        } catch (NumberFormatException e) {
            throw new PrecisionException(PrecisionFailure.INVALID_NUMERIC_LITERAL,
                    "Invalid literal for " + name + ": '" + literal + "'", e);
        }
    }
}
