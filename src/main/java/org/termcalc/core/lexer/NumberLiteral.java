package org.termcalc.core.lexer;

import java.util.regex.Pattern;

/**
 * Converts the text of a number token into its value.
 * <p>
 * Decimal literals may carry a fraction and an exponent introduced by {@code E}. Integer literals
 * with the prefixes {@code 0x}, {@code 0o} and {@code 0b} are read in base 16, 8 and 2.
 */
public final class NumberLiteral {

    private static final Pattern DECIMAL = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)(E[+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]+");
    private static final Pattern OCT = Pattern.compile("0o[0-7]+");
    private static final Pattern BIN = Pattern.compile("0b[01]+");

    private NumberLiteral() {}

    /**
     * @param text The literal text, without the trailing {@code i} of complex literals.
     * @return The value of the literal.
     * @throws NumberFormatException if the text is not a valid literal.
     */
    public static double parse(String text) {
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (HEX.matcher(text).matches()) {
            return Long.parseLong(text.substring(2), 16);
        }
        if (OCT.matcher(text).matches()) {
            return Long.parseLong(text.substring(2), 8);
        }
        if (BIN.matcher(text).matches()) {
            return Long.parseLong(text.substring(2), 2);
        }
        throw new NumberFormatException("Invalid number literal: " + text);
    }

    /**
     * @param text The literal text.
     * @return {@code true} if {@link #parse(String)} accepts the text.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
