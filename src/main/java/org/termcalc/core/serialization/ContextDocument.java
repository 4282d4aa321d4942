package org.termcalc.core.serialization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.termcalc.core.result.NumberType;

import java.util.List;
import java.util.Map;

/**
 * The persisted form of the user tables of a {@link org.termcalc.core.context.MathContext}.
 * Built-in tables are never part of the document.
 *
 * @param userConstants The user constants by name.
 * @param userFunctions The user functions by name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextDocument(
        Map<String, ConstantEntry> userConstants,
        Map<String, FunctionEntry> userFunctions
) {

    /**
     * A persisted user constant.
     * @param type Whether the value is real or complex.
     * @param re The real part.
     * @param im The imaginary part.
     */
    public record ConstantEntry(NumberType type, double re, double im) {}

    /**
     * A persisted user function. Only the definition text is needed to restore the function;
     * the parameter list is kept for readers of the file.
     * @param definition The input line that defined the function.
     * @param args The parameter names.
     */
    public record FunctionEntry(String definition, List<String> args) {}
}
