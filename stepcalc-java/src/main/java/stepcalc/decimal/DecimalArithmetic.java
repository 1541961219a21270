package stepcalc.decimal;

import stepcalc.error.InvalidOperationException;
import stepcalc.error.InvalidOperationException.Reason;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Exact decimal arithmetic over {@link BigDecimal}. Only division and negative powers
 * round, to {@code scale} fractional digits with the configured rounding mode.
 * Failures carry no range; the evaluator anchors them at the offending node.
 */
public final class DecimalArithmetic {

    public static final int DEFAULT_SCALE = 40;
    public static final int DEFAULT_MAX_EXPONENT = 1_000_000;
    /** Upper bound on the estimated digit count of {@code base^|n|}. */
    public static final long MAX_POWER_DIGITS = 1_000_000L;

    public static final DecimalArithmetic DEFAULT =
            new DecimalArithmetic(DEFAULT_SCALE, RoundingMode.HALF_UP, DEFAULT_MAX_EXPONENT);

    private final int scale;
    private final RoundingMode rounding;
    private final int maxExponent;

    public DecimalArithmetic(int scale, RoundingMode rounding, int maxExponent) {
        if (scale < 0) throw new IllegalArgumentException("scale must be >= 0: " + scale);
        if (maxExponent < 0) throw new IllegalArgumentException("maxExponent must be >= 0: " + maxExponent);
        this.scale = scale;
        this.rounding = rounding;
        this.maxExponent = maxExponent;
    }

    public int scale() {
        return scale;
    }

    public RoundingMode rounding() {
        return rounding;
    }

    public int maxExponent() {
        return maxExponent;
    }

    public BigDecimal add(BigDecimal a, BigDecimal b) {
        return a.add(b);
    }

    public BigDecimal subtract(BigDecimal a, BigDecimal b) {
        return a.subtract(b);
    }

    public BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return a.multiply(b);
    }

    public BigDecimal negate(BigDecimal a) {
        return a.negate();
    }

    public BigDecimal divide(BigDecimal a, BigDecimal b) {
        if (b.signum() == 0) throw new InvalidOperationException(Reason.DIVISION_BY_ZERO);
        return a.divide(b, scale, rounding).stripTrailingZeros();
    }

    /** Truncated-division remainder: the result takes the sign of {@code a}. */
    public BigDecimal modulo(BigDecimal a, BigDecimal b) {
        if (b.signum() == 0) throw new InvalidOperationException(Reason.DIVISION_BY_ZERO);
        return a.remainder(b);
    }

    public BigDecimal power(BigDecimal base, BigDecimal exponent) {
        if (!isInteger(exponent)) throw new InvalidOperationException(Reason.NON_INTEGER_EXPONENT);
        if (exponent.abs().compareTo(BigDecimal.valueOf(maxExponent)) > 0) {
            throw new InvalidOperationException(Reason.EXPONENT_TOO_LARGE);
        }

        int n = exponent.intValueExact();
        if (estimatedDigits(base, Math.abs(n)) > MAX_POWER_DIGITS) {
            throw new InvalidOperationException(Reason.EXPONENT_TOO_LARGE);
        }
        if (n >= 0) return base.pow(n);

        if (base.signum() == 0) throw new InvalidOperationException(Reason.DIVISION_BY_ZERO);
        BigDecimal denominator = base.pow(-n, MathContext.UNLIMITED);
        return BigDecimal.ONE.divide(denominator, scale, rounding).stripTrailingZeros();
    }

    // precision(b^n) <= precision(b) * n
    private static long estimatedDigits(BigDecimal base, int n) {
        if (base.signum() == 0) return 1;
        return (long) base.stripTrailingZeros().precision() * n;
    }

    public static boolean isInteger(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
