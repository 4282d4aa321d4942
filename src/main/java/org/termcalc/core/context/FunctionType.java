package org.termcalc.core.context;

import java.util.List;

/**
 * The built-in functions. Inverse functions are reachable under two names each.
 */
public enum FunctionType {
    COS(1, "cos"),
    SIN(1, "sin"),
    TAN(1, "tan"),
    COT(1, "cot"),
    COSH(1, "cosh"),
    SINH(1, "sinh"),
    TANH(1, "tanh"),
    COTH(1, "coth"),
    ARCCOS(1, "arccos", "acos"),
    ARCSIN(1, "arcsin", "asin"),
    ARCTAN(1, "arctan", "atan"),
    ARCCOT(1, "arccot", "acot"),
    ARCCOSH(1, "arccosh", "acosh"),
    ARCSINH(1, "arcsinh", "asinh"),
    ARCTANH(1, "arctanh", "atanh"),
    ARCCOTH(1, "arccoth", "acoth"),
    EXP(1, "exp"),
    LN(1, "ln"),
    SQRT(1, "sqrt"),
    POW(2, "pow"),
    ROOT(2, "root"),
    RE(1, "re"),
    IM(1, "im");

    private final int arity;
    private final List<String> names;

    FunctionType(int arity, String... names) {
        this.arity = arity;
        this.names = List.of(names);
    }

    public int getArity() {
        return arity;
    }

    /**
     * @return All names the function is registered under; the first one is the canonical name.
     */
    public List<String> getNames() {
        return names;
    }
}
