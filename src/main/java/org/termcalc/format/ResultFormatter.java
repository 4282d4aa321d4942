package org.termcalc.format;

import org.termcalc.core.result.MathResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Renders {@link MathResult}s for display.
 * <p>
 * NaN and infinite values bypass the number format and render as {@code NaN}, {@code inf} and
 * {@code -inf}. Complex values render as {@code re+imi} with both parts in the selected format.
 */
public class ResultFormatter {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private final FormatMode mode;
    private final int precision;

    /**
     * Creates a new formatter.
     * @param mode The number format.
     * @param precision The maximum number of fractional digits.
     */
    public ResultFormatter(FormatMode mode, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative, got " + precision);
        }
        this.mode = mode;
        this.precision = precision;
    }

    public FormatMode getMode() {
        return mode;
    }

    public int getPrecision() {
        return precision;
    }

    /**
     * @param result The result to render.
     * @return The display text.
     */
    public String format(MathResult result) {
        if (result.isNaN()) {
            return "NaN";
        }
        if (result.isReal()) {
            return formatReal(result.getReal());
        }
        double im = result.getImaginary();
        boolean negative = im < 0.0 || (im == 0.0 && 1.0 / im < 0.0);
        return formatReal(result.getReal()) + (negative ? "-" : "+") + formatReal(Math.abs(im)) + "i";
    }

    /**
     * @param value A real value.
     * @return The display text of the value.
     */
    public String formatReal(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        switch (mode) {
            case DEC:
                BigDecimal rounded = BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP);
                return rounded.signum() == 0 ? "0" : rounded.stripTrailingZeros().toPlainString();
            case EXP:
                return String.format(Locale.ROOT, "%." + precision + "e", value);
            default:
                return formatRadix(value);
        }
    }

    /**
     * Writes the integer part in the radix of the mode, followed by at most {@code precision}
     * fractional digits. The expansion stops early once the remaining fraction is zero.
     */
    private String formatRadix(double value) {
        int radix = mode.getRadix();
        double abs = Math.abs(value);
        long integerPart = (long) abs;
        double fraction = abs - integerPart;

        StringBuilder sb = new StringBuilder();
        if (value < 0 && (integerPart != 0 || hasFractionDigits(fraction))) {
            sb.append('-');
        }
        sb.append(mode.getPrefix()).append(Long.toString(integerPart, radix));

        StringBuilder digits = new StringBuilder();
        for (int n = 0; n < precision && fraction != 0.0; n++) {
            fraction *= radix;
            int digit = (int) fraction;
            digits.append(DIGITS[digit]);
            fraction -= digit;
        }
        if (digits.length() > 0) {
            sb.append('.').append(digits);
        }
        return sb.toString();
    }

    private boolean hasFractionDigits(double fraction) {
        return precision > 0 && fraction != 0.0;
    }
}
