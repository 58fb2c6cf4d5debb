package com.libragraph.provenance.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders real numbers to a fixed number of significant digits in general
 * notation, the way {@code printf("%.Ng")} does without the {@code #} flag.
 *
 * <p>The value is rounded half-even on its exact decimal expansion. With
 * decimal exponent {@code e} of the rounded value, fixed notation is used when
 * {@code -4 <= e < digits}, scientific notation ({@code 1.5e+20}, at least two
 * exponent digits) otherwise. Trailing zeros and a dangling decimal point are
 * dropped. Specials render as {@code inf}, {@code -inf}, {@code nan} and
 * {@code -0}.
 *
 * <p>The output only ever contains digits, {@code -}, {@code +}, {@code .},
 * {@code e} and the letters of the specials.
 */
public final class FloatText {

    private FloatText() {
    }

    public static String format(double value, int significantDigits) {
        checkDigits(significantDigits);
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return Math.copySign(1.0, value) < 0 ? "-0" : "0";
        }
        // new BigDecimal(double) is the exact binary value, no decimal rounding yet
        return format(new BigDecimal(value), significantDigits);
    }

    public static String format(BigDecimal value, int significantDigits) {
        checkDigits(significantDigits);
        if (value.signum() == 0) {
            return "0";
        }
        BigDecimal rounded = value.round(new MathContext(significantDigits, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        BigDecimal stripped = rounded.stripTrailingZeros();

        if (exponent >= -4 && exponent < significantDigits) {
            return stripped.toPlainString();
        }

        String digits = stripped.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder(digits.length() + 8);
        if (stripped.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        sb.append(magnitude);
        return sb.toString();
    }

    private static void checkDigits(int significantDigits) {
        if (significantDigits < 1) {
            throw new IllegalArgumentException(
                    "significantDigits must be >= 1, got: " + significantDigits);
        }
    }
}
