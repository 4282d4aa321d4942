package org.termcalc.core.semantics;

/**
 * The kinds of input lines the calculator accepts.
 */
public enum LineKind {
    /** A plain expression to evaluate, e.g. {@code 1+2}. */
    EXPRESSION,
    /** The definition of a user constant, e.g. {@code c = e + pi}. */
    CONSTANT_DEFINITION,
    /** The definition of a user function, e.g. {@code f(x, y) = x + y}. */
    FUNCTION_DEFINITION
}
