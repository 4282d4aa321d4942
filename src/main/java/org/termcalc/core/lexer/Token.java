package org.termcalc.core.lexer;

import org.termcalc.core.result.NumberType;

/**
 * Represents a single token extracted from the input line by the {@link Tokenizer}.
 *
 * @param type The type of the token.
 * @param text The text of the token. For numbers this is the literal without the trailing 'i'
 *             of complex literals and with a leading '0' added to literals starting with '.'.
 * @param numberType The number type for {@link TokenType#NUMBER} tokens, null for all others.
 * @param endPosition The zero-based position of the token's last character in the input line.
 */
public record Token(
        TokenType type,
        String text,
        NumberType numberType,
        int endPosition
) {

    /**
     * Creates a non-number token.
     * @param type The token type.
     * @param text The token text.
     * @param endPosition The position of the last character.
     * @return The token.
     */
    public static Token of(TokenType type, String text, int endPosition) {
        return new Token(type, text, null, endPosition);
    }

    /**
     * Creates a number token.
     * @param numberType Whether the literal is real or complex.
     * @param text The literal text.
     * @param endPosition The position of the last character.
     * @return The token.
     */
    public static Token number(NumberType numberType, String text, int endPosition) {
        return new Token(TokenType.NUMBER, text, numberType, endPosition);
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return text;
    }
}
