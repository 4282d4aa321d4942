package org.termcalc.core.result;

/**
 * Defines the sets of numbers a result or a number literal can belong to.
 */
public enum NumberType {
    /** A real number; the imaginary part is zero. */
    REAL,
    /** A complex number. */
    COMPLEX;

    /**
     * Combines the types of several operands: the result is complex if any operand is complex.
     * @param types The operand types.
     * @return {@link #COMPLEX} if any of the types is complex, otherwise {@link #REAL}.
     */
    public static NumberType combine(NumberType... types) {
        for (NumberType type : types) {
            if (type == COMPLEX) {
                return COMPLEX;
            }
        }
        return REAL;
    }
}
