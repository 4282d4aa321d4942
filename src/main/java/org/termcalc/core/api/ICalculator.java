package org.termcalc.core.api;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.result.MathResult;

import java.util.Optional;

/**
 * Defines the public interface of the calculator core.
 */
public interface ICalculator {

    /**
     * Tokenizes, parses, validates and evaluates one input line. Definitions of user constants
     * and functions are stored in the given context.
     *
     * @param input The input line.
     * @param context The session registry; read for every line and modified by definitions.
     * @return The result of an expression, or empty for a definition.
     * @throws CalculationException if the line is malformed or not valid in the context.
     */
    Optional<MathResult> evaluateInput(String input, MathContext context) throws CalculationException;
}
