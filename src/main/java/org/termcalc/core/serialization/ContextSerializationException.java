package org.termcalc.core.serialization;

/**
 * Thrown when a context file cannot be written, read or understood.
 */
public class ContextSerializationException extends Exception {

    public ContextSerializationException(String message) {
        super(message);
    }

    public ContextSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
