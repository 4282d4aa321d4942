package org.termcalc.core.semantics;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.diagnostics.ExpectedError;
import org.termcalc.core.lexer.Token;
import org.termcalc.core.lexer.TokenType;
import org.termcalc.core.parser.ParseException;
import org.termcalc.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a parsed input line against the current {@link MathContext} and classifies it as an
 * expression, a constant definition or a function definition.
 * <p>
 * The parser accepts unknown names so that definitions can introduce them. This stage rejects
 * unknown names wherever they cannot be defined, checks the argument count of every call, and
 * makes sure an assignment only appears at the root of the line.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final String ASSIGN = "=";
    private static final String EXPECTED_NEW_NAME = "new constant name or function name";

    private final MathContext context;
    private final String input;

    /**
     * Creates a new analyzer.
     * @param context The registry the names are resolved against.
     * @param input The input line, for diagnostics.
     */
    public SemanticAnalyzer(MathContext context, String input) {
        this.context = context;
        this.input = input;
    }

    /**
     * Analyzes a parsed line.
     * @param tree The expression tree of the line.
     * @return The classified line.
     * @throws ParseException if the line is not valid in the current context.
     */
    public AnalyzedLine analyze(TreeNode<Token> tree) throws ParseException {
        checkNestedAssignments(tree, true);

        AnalyzedLine line;
        if (isAssignment(tree.getContent()) && tree.childCount() == 2) {
            line = analyzeDefinition(tree.getChild(0), tree.getChild(1));
        } else {
            checkExpression(tree);
            line = AnalyzedLine.expression(tree);
        }
        log.debug("Analyzed '{}' as {}", input, line.kind());
        return line;
    }

    private void checkNestedAssignments(TreeNode<Token> node, boolean root) throws ParseException {
        if (!root && isAssignment(node.getContent())) {
            throw error("assignment at top level", "nested assignment \"=\"", node.getContent());
        }
        for (TreeNode<Token> child : node.getChildren()) {
            checkNestedAssignments(child, false);
        }
    }

    private void checkExpression(TreeNode<Token> node) throws ParseException {
        Token token = node.getContent();
        switch (token.type()) {
            case UNKNOWN_CONSTANT ->
                    throw error("built-in or user defined constant", "unknown constant " + quote(token), token);
            case UNKNOWN_FUNCTION ->
                    throw error("built-in or user defined function", "unknown function \"" + token.text() + "(...)\"", token);
            case FUNCTION, USER_FUNCTION -> checkArity(node);
            default -> { }
        }
        for (TreeNode<Token> child : node.getChildren()) {
            checkExpression(child);
        }
    }

    private AnalyzedLine analyzeDefinition(TreeNode<Token> lhs, TreeNode<Token> rhs) throws ParseException {
        Token target = lhs.getContent();
        if (target.type() == TokenType.CONSTANT || target.type() == TokenType.FUNCTION) {
            throw error(EXPECTED_NEW_NAME, "built-in expression " + quote(target), target);
        }

        if (lhs.isLeaf() && (target.type() == TokenType.UNKNOWN_CONSTANT || target.type() == TokenType.USER_CONSTANT)) {
            checkDefinitionBody(rhs, null, List.of());
            return AnalyzedLine.constant(target.text(), rhs);
        }

        if (target.type() == TokenType.UNKNOWN_FUNCTION || target.type() == TokenType.USER_FUNCTION) {
            List<String> parameters = new ArrayList<>();
            for (TreeNode<Token> arg : lhs.getChildren()) {
                Token param = arg.getContent();
                if (!arg.isLeaf() || !param.type().isConstantLike()) {
                    throw error(EXPECTED_NEW_NAME, "expression " + quote(param), param);
                }
                parameters.add(param.text());
            }
            if (new HashSet<>(parameters).size() != parameters.size()) {
                throw new ParseException(new ExpectedError(input, "distinct arguments",
                        "function definition with partly equal arguments", 0));
            }
            checkDefinitionBody(rhs, target.text(), parameters);
            return AnalyzedLine.function(target.text(), parameters, rhs);
        }

        throw error(EXPECTED_NEW_NAME, "expression " + quote(target), target);
    }

    /**
     * Checks the right-hand side of a definition: every name must be known or be a parameter,
     * and a function must not call itself.
     *
     * @param functionName The name of the function being defined, or null for a constant.
     */
    private void checkDefinitionBody(TreeNode<Token> node, String functionName, List<String> parameters) throws ParseException {
        Set<String> params = new HashSet<>(parameters);
        checkDefinitionNode(node, functionName, params);
    }

    private void checkDefinitionNode(TreeNode<Token> node, String functionName, Set<String> params) throws ParseException {
        Token token = node.getContent();
        switch (token.type()) {
            case UNKNOWN_CONSTANT -> {
                if (!params.contains(token.text())) {
                    throw error("non-symbolic expression", "symbolic expression " + quote(token), token);
                }
            }
            case UNKNOWN_FUNCTION ->
                    throw error("non-symbolic expression", "symbolic expression " + quote(token), token);
            case USER_FUNCTION -> {
                if (token.text().equals(functionName)) {
                    throw error("non-recursive expression", "recursive call of " + quote(token), token);
                }
                checkArity(node);
            }
            case FUNCTION -> checkArity(node);
            default -> { }
        }
        for (TreeNode<Token> child : node.getChildren()) {
            checkDefinitionNode(child, functionName, params);
        }
    }

    private void checkArity(TreeNode<Token> call) throws ParseException {
        Token token = call.getContent();
        int expected = context.getFunctionArity(token.text()).orElse(call.childCount());
        if (expected != call.childCount()) {
            throw error(expected + " argument(s)", call.childCount() + " argument(s)", token);
        }
    }

    private static boolean isAssignment(Token token) {
        return token.is(TokenType.OPERATION, ASSIGN);
    }

    private ParseException error(String expected, String found, Token at) {
        return new ParseException(new ExpectedError(input, expected, found, at.endPosition()));
    }

    private static String quote(Token token) {
        return "\"" + token.text() + "\"";
    }
}
