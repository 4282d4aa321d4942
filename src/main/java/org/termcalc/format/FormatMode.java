package org.termcalc.format;

import java.util.Locale;
import java.util.Optional;

/**
 * The output formats for results.
 */
public enum FormatMode {
    /** Decimal, rounded to the precision with trailing zeros removed. */
    DEC(10, ""),
    /** Binary with the prefix {@code 0b}. */
    BIN(2, "0b"),
    /** Octal with the prefix {@code 0o}. */
    OCT(8, "0o"),
    /** Hexadecimal with the prefix {@code 0x}. */
    HEX(16, "0x"),
    /** Decimal scientific notation. */
    EXP(10, "");

    private final int radix;
    private final String prefix;

    FormatMode(int radix, String prefix) {
        this.radix = radix;
        this.prefix = prefix;
    }

    public int getRadix() {
        return radix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * @param name The mode name, case-insensitive, e.g. {@code "hex"}.
     * @return The mode, or empty if the name is unknown.
     */
    public static Optional<FormatMode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
