package org.termcalc.core.lexer;

import org.termcalc.core.diagnostics.LocationMarker;

/**
 * Thrown when the tokenizer reaches a character that cannot start any token.
 */
public class TokenException extends Exception {

    private final String symbol;
    private final int position;

    /**
     * Creates the exception for an unknown character.
     * @param symbol The offending character as a string.
     * @param input The input line.
     * @param position The zero-based position of the character.
     */
    public TokenException(String symbol, String input, int position) {
        super("Error: Unknown token found: \"" + symbol + "\".\n" + LocationMarker.mark(input, position));
        this.symbol = symbol;
        this.position = position;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPosition() {
        return position;
    }
}
