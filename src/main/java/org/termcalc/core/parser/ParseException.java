package org.termcalc.core.parser;

import org.termcalc.core.diagnostics.ExpectedError;
import org.termcalc.core.lexer.TokenException;

import java.util.Optional;

/**
 * Thrown when an input line is not a valid expression or definition. The message is the complete
 * user-visible diagnostic, including the caret-marked input line.
 */
public class ParseException extends Exception {

    private final transient ExpectedError error;

    /**
     * Creates the exception for a mismatch between an expected and a found token.
     * @param error The structured error.
     */
    public ParseException(ExpectedError error) {
        super(error.format());
        this.error = error;
    }

    /**
     * Wraps a tokenizer failure without rewording it.
     * @param cause The tokenizer failure.
     */
    public ParseException(TokenException cause) {
        super(cause.getMessage(), cause);
        this.error = null;
    }

    /**
     * @return The structured error, or empty if this exception wraps a tokenizer failure.
     */
    public Optional<ExpectedError> getError() {
        return Optional.ofNullable(error);
    }
}
