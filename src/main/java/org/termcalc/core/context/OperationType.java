package org.termcalc.core.context;

import java.util.Arrays;
import java.util.Optional;

/**
 * The operations known to the calculator, with their symbol and binding strength.
 * A higher precedence binds tighter.
 */
public enum OperationType {
    ASSIGN("=", 1, false),
    ADD("+", 2, true),
    SUB("-", 2, true),
    MUL("*", 3, false),
    DIV("/", 3, false),
    MOD("%", 3, false),
    POW("^", 4, false);

    private final String symbol;
    private final int precedence;
    private final boolean unary;

    OperationType(String symbol, int precedence, boolean unary) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.unary = unary;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    /**
     * @return {@code true} if the operation may also appear as a prefix modifier of an operand.
     */
    public boolean isUnary() {
        return unary;
    }

    /**
     * @param symbol The operation symbol, e.g. {@code "+"}.
     * @return The matching operation, or empty if the symbol is not an operation.
     */
    public static Optional<OperationType> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
