package org.termcalc.core.api;

/**
 * An exception that is thrown when an input line cannot be calculated.
 * <p>
 * It is part of the public API and hides the internal exception types of the parser. The message
 * is the complete user-visible diagnostic.
 */
public class CalculationException extends Exception {

    /**
     * Constructs a new calculation exception with the specified detail message.
     * @param message The detail message.
     */
    public CalculationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new calculation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
