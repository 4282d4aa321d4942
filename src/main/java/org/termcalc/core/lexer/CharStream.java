package org.termcalc.core.lexer;

/**
 * Provides character-wise access to an input line while tracking the read position.
 */
public class CharStream {

    private final String input;
    private int current = 0;

    /**
     * Creates a new stream positioned at the first character.
     * @param input The input line.
     */
    public CharStream(String input) {
        this.input = input;
    }

    /**
     * @return The current character without consuming it, or {@code '\0'} at the end.
     */
    public char peek() {
        if (isAtEnd()) return '\0';
        return input.charAt(current);
    }

    /**
     * Consumes the current character.
     * @return The consumed character.
     * @throws IllegalStateException if the stream is exhausted.
     */
    public char advance() {
        if (isAtEnd()) {
            throw new IllegalStateException("End of character stream reached at position " + current);
        }
        return input.charAt(current++);
    }

    public boolean isAtEnd() {
        return current >= input.length();
    }

    /**
     * @return The offset of the next unread character; the input length once exhausted.
     */
    public int position() {
        return current;
    }

    public String input() {
        return input;
    }
}
