package stepcalc.api;

import stepcalc.decimal.DecimalArithmetic;
import stepcalc.print.NumberFormatter;

import java.math.RoundingMode;
import java.util.Locale;
import java.util.Properties;

/**
 * @param scale        fractional digits kept by division and negative powers
 * @param rounding     rounding applied where a result cannot be exact
 * @param displayScale fractional digits shown by the formatter
 * @param maxExponent  largest accepted magnitude of an integer exponent
 */
public record CalcConfig(
        int scale,
        RoundingMode rounding,
        int displayScale,
        int maxExponent
) {

    public static final String PREFIX = "stepcalc.";

    public static final CalcConfig DEFAULT = new CalcConfig(
            DecimalArithmetic.DEFAULT_SCALE,
            RoundingMode.HALF_UP,
            NumberFormatter.DEFAULT_FRACTION_DIGITS,
            DecimalArithmetic.DEFAULT_MAX_EXPONENT);

    public CalcConfig {
        if (rounding == null) throw new IllegalArgumentException("rounding must not be null");
        if (scale < 0) throw new IllegalArgumentException("scale must be >= 0: " + scale);
        if (displayScale < 0) throw new IllegalArgumentException("displayScale must be >= 0: " + displayScale);
        if (maxExponent < 0) throw new IllegalArgumentException("maxExponent must be >= 0: " + maxExponent);
    }

    public static CalcConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /** Reads {@code stepcalc.*} keys; absent keys keep their defaults. */
    public static CalcConfig fromProperties(Properties props) {
        return new CalcConfig(
                intProp(props, "scale", DEFAULT.scale()),
                roundingProp(props, DEFAULT.rounding()),
                intProp(props, "displayScale", DEFAULT.displayScale()),
                intProp(props, "maxExponent", DEFAULT.maxExponent()));
    }

    public CalcConfig withScale(int scale) {
        return new CalcConfig(scale, rounding, displayScale, maxExponent);
    }

    public DecimalArithmetic arithmetic() {
        return new DecimalArithmetic(scale, rounding, maxExponent);
    }

    public NumberFormatter formatter() {
        return new NumberFormatter(displayScale);
    }

    private static int intProp(Properties props, String key, int def) {
        String v = props.getProperty(PREFIX + key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad value for " + PREFIX + key + ": " + v, e);
        }
    }

    private static RoundingMode roundingProp(Properties props, RoundingMode def) {
        String v = props.getProperty(PREFIX + "rounding");
        if (v == null || v.isBlank()) return def;
        try {
            return RoundingMode.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Bad value for " + PREFIX + "rounding: " + v, e);
        }
    }
}
