package org.termcalc.core.diagnostics;

import java.util.Optional;

/**
 * Describes a syntax or definition error: what was expected at a position of the input line,
 * and what was found there instead.
 *
 * @param input The complete input line.
 * @param expected The expected token category, e.g. {@code symbol ")"}.
 * @param found What was actually found, or null if nothing is reported.
 * @param position The zero-based column the caret points at.
 */
public record ExpectedError(
        String input,
        String expected,
        String found,
        int position
) {

    public Optional<String> foundText() {
        return Optional.ofNullable(found);
    }

    /**
     * Formats the diagnostic, e.g.
     * <pre>
     * Error: Expected symbol ")".
     * 2*(5-3
     *       ^~~~
     * </pre>
     * @return The formatted, user-visible message.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Error: Expected ").append(expected).append(".\n");
        sb.append(LocationMarker.mark(input, position));
        if (found != null) {
            sb.append(" Found: ").append(found);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
