package org.termcalc.core.context;

import org.termcalc.core.lexer.Token;
import org.termcalc.core.tree.TreeNode;

import java.util.List;

/**
 * A function defined by the user.
 *
 * @param body The expression tree of the right-hand side. Owned by the registry and never handed out.
 * @param parameters The ordered parameter names.
 * @param definition The trimmed input line that defined the function, e.g. {@code "f(x) = x^2"}.
 */
public record UserFunction(
        TreeNode<Token> body,
        List<String> parameters,
        String definition
) {
    public UserFunction {
        parameters = List.copyOf(parameters);
    }

    public int arity() {
        return parameters.size();
    }
}
