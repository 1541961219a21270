package stepcalc.print;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display form of a decimal: at most {@code maxFractionDigits} fractional digits,
 * no trailing zeros, plain notation, zero always as {@code "0"}.
 */
public final class NumberFormatter {

    public static final int DEFAULT_FRACTION_DIGITS = 12;

    private final int maxFractionDigits;

    public NumberFormatter() {
        this(DEFAULT_FRACTION_DIGITS);
    }

    public NumberFormatter(int maxFractionDigits) {
        if (maxFractionDigits < 0) {
            throw new IllegalArgumentException("maxFractionDigits must be >= 0: " + maxFractionDigits);
        }
        this.maxFractionDigits = maxFractionDigits;
    }

    public String format(BigDecimal value) {
        BigDecimal rounded = value.setScale(maxFractionDigits, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) return "0";
        return rounded.stripTrailingZeros().toPlainString();
    }
}
