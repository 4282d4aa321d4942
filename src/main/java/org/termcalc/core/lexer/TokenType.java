package org.termcalc.core.lexer;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 */
public enum TokenType {
    /** A numeric literal, real or complex. */
    NUMBER,
    /** A built-in constant, such as pi. */
    CONSTANT,
    /** A constant defined by the user. */
    USER_CONSTANT,
    /** A built-in function, such as cos. */
    FUNCTION,
    /** A function defined by the user. */
    USER_FUNCTION,
    /** An operation symbol, such as + or =. */
    OPERATION,
    /** A punctuation symbol: '(', ')' or ','. */
    PUNCTUATION,
    /** A name that is not followed by '(' and is not registered; valid only while defining. */
    UNKNOWN_CONSTANT,
    /** A name that is followed by '(' and is not registered; valid only while defining. */
    UNKNOWN_FUNCTION;

    /**
     * @return {@code true} for the constant-like leaf kinds, known or not.
     */
    public boolean isConstantLike() {
        return this == CONSTANT || this == USER_CONSTANT || this == UNKNOWN_CONSTANT;
    }
}
