package org.termcalc.core.diagnostics;

/**
 * Renders the caret marker that points at a position of an input line.
 */
public final class LocationMarker {

    /** The marker placed below the failing column. */
    public static final String MARKER = "^~~~";

    private LocationMarker() {}

    /**
     * Creates the two-line location string: the input, a newline, spaces up to the position
     * and the caret marker.
     *
     * @param input The input line.
     * @param position The zero-based column to mark. Negative values are treated as 0.
     * @return The location string, e.g. {@code "3+\n  ^~~~"}.
     */
    public static String mark(String input, int position) {
        StringBuilder sb = new StringBuilder(input.length() + position + 6);
        sb.append(input).append('\n');
        sb.append(" ".repeat(Math.max(0, position)));
        sb.append(MARKER);
        return sb.toString();
    }
}
