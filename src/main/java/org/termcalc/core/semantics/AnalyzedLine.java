package org.termcalc.core.semantics;

import org.termcalc.core.lexer.Token;
import org.termcalc.core.tree.TreeNode;

import java.util.List;

/**
 * The result of the semantic analysis of one input line.
 *
 * @param kind The kind of line.
 * @param name The name being defined, or null for an expression.
 * @param parameters The parameter names of a function definition; empty otherwise.
 * @param expression The tree to evaluate or store: the whole line for an expression, the
 *                   right-hand side for a definition.
 */
public record AnalyzedLine(
        LineKind kind,
        String name,
        List<String> parameters,
        TreeNode<Token> expression
) {
    public AnalyzedLine {
        parameters = List.copyOf(parameters);
    }

    static AnalyzedLine expression(TreeNode<Token> tree) {
        return new AnalyzedLine(LineKind.EXPRESSION, null, List.of(), tree);
    }

    static AnalyzedLine constant(String name, TreeNode<Token> rhs) {
        return new AnalyzedLine(LineKind.CONSTANT_DEFINITION, name, List.of(), rhs);
    }

    static AnalyzedLine function(String name, List<String> parameters, TreeNode<Token> rhs) {
        return new AnalyzedLine(LineKind.FUNCTION_DEFINITION, name, parameters, rhs);
    }
}
