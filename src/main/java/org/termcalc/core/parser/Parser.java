package org.termcalc.core.parser;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.diagnostics.ExpectedError;
import org.termcalc.core.lexer.NumberLiteral;
import org.termcalc.core.lexer.Token;
import org.termcalc.core.lexer.TokenException;
import org.termcalc.core.lexer.TokenType;
import org.termcalc.core.lexer.Tokenizer;
import org.termcalc.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses one input line into an expression tree by precedence climbing.
 * <p>
 * An operator token may appear either as a binary infix operator or, for the unary operations,
 * as a prefix modifier of the following operand. Prefix modifiers may be stacked ({@code 6*--2})
 * and bind tighter than any binary operator. Binary operators associate to the left.
 * <p>
 * Inner nodes of the resulting tree are operations (one child for a prefix modifier, two for a
 * binary operation) and function calls (one child per argument). Leaves are numbers and constants.
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    static final String EXPECTED_OPERAND = "operand (number, constant, function call) or an unary operation";

    private final MathContext context;
    private final Tokenizer tokenizer;

    /**
     * Creates a new parser.
     * @param input The input line.
     * @param context The registry used to classify symbols and operator precedence.
     */
    public Parser(String input, MathContext context) {
        this.context = context;
        this.tokenizer = new Tokenizer(input, context);
    }

    /**
     * Parses the entire input into a single expression tree.
     * @return The root of the expression tree.
     * @throws ParseException if the input is malformed or tokens remain after a complete expression.
     */
    public TreeNode<Token> parseToplevel() throws ParseException {
        TreeNode<Token> tree = parseExpression();
        if (!tokenizer.eof()) {
            Token trailing = peek();
            throw error("end of input", quote(trailing), trailing.endPosition());
        }
        log.debug("Parsed '{}' into {}", tokenizer.input(), tree);
        return tree;
    }

    private TreeNode<Token> parseExpression() throws ParseException {
        return parseOperation();
    }

    /**
     * Parses an element: a parenthesised expression, an operand (number, constant or function
     * call), or an unprocessed prefix operation without operand.
     */
    private TreeNode<Token> parseElement() throws ParseException {
        if (isPunctuation("(")) {
            next();
            TreeNode<Token> expression = parseExpression();
            consumePunctuation(")");
            return expression;
        }

        if (tokenizer.eof()) {
            throw error(EXPECTED_OPERAND, "end of input", tokenizer.position());
        }
        Token token = next();
        switch (token.type()) {
            case NUMBER:
                if (!NumberLiteral.isValid(token.text())) {
                    throw error("literal number", "Invalid literal symbol(s).", token.endPosition());
                }
                return new TreeNode<>(token);
            case CONSTANT:
            case USER_CONSTANT:
            case UNKNOWN_CONSTANT:
                return new TreeNode<>(token);
            case FUNCTION:
            case USER_FUNCTION:
            case UNKNOWN_FUNCTION:
                return parseFunction(token);
            case OPERATION:
                if (context.isUnaryOperation(token.text())) {
                    return new TreeNode<>(token);
                }
                throw error("unary operation", "non-unary operation " + quote(token), token.endPosition());
            default:
                throw error(EXPECTED_OPERAND, "unexpected symbol " + quote(token), token.endPosition());
        }
    }

    private TreeNode<Token> parseFunction(Token name) throws ParseException {
        consumePunctuation("(");
        List<TreeNode<Token>> args = parseArguments();
        consumePunctuation(")");
        return new TreeNode<>(name, args);
    }

    private List<TreeNode<Token>> parseArguments() throws ParseException {
        List<TreeNode<Token>> args = new ArrayList<>();
        if (tokenizer.eof() || isPunctuation(")")) {
            return args;
        }

        while (!tokenizer.eof()) {
            args.add(parseExpression());
            if (tokenizer.eof()) {
                break;
            }
            if (isPunctuation(",")) {
                next();
                if (isPunctuation(")")) {
                    throw error("an argument", "symbol \")\"", peek().endPosition());
                }
            } else if (isPunctuation(")")) {
                break;
            } else {
                Token unexpected = peek();
                throw error("\",\" or \")\"", quote(unexpected), unexpected.endPosition());
            }
        }
        return args;
    }

    /**
     * Parses an operand followed by any binary continuation. A leading prefix operation is folded
     * together with its operand first and then treated like a plain operand.
     */
    private TreeNode<Token> parseOperation() throws ParseException {
        TreeNode<Token> element = parseElement();
        if (isUnprocessedUnary(element)) {
            element = parseUnary(element);
        }
        if (tokenizer.eof()) {
            return element;
        }
        return parseBinary(element, 0);
    }

    /**
     * Precedence climbing: folds every following binary operation that binds tighter than
     * {@code minPrecedence} into the left operand.
     */
    private TreeNode<Token> parseBinary(TreeNode<Token> left, int minPrecedence) throws ParseException {
        if (tokenizer.eof()) {
            return left;
        }
        Token operator = peek();
        if (operator.type() != TokenType.OPERATION) {
            return left;
        }
        int precedence = context.getOperationPrecedence(operator.text());
        if (precedence <= minPrecedence) {
            return left;
        }
        next();

        TreeNode<Token> operation = new TreeNode<>(operator);
        operation.addChild(left);

        TreeNode<Token> right = parseElement();
        if (isUnprocessedUnary(right)) {
            right = parseUnary(right);
        }
        operation.addChild(tokenizer.eof() ? right : parseBinary(right, precedence));

        return tokenizer.eof() ? operation : parseBinary(operation, minPrecedence);
    }

    /**
     * Attaches the operand to a prefix operation. Stacked prefix operations nest, so
     * {@code --2} becomes {@code -(-(2))}.
     */
    private TreeNode<Token> parseUnary(TreeNode<Token> operation) throws ParseException {
        TreeNode<Token> operand = parseElement();
        if (isUnprocessedUnary(operand)) {
            operand = parseUnary(operand);
        }
        operation.addChild(operand);
        return operation;
    }

    private static boolean isUnprocessedUnary(TreeNode<Token> node) {
        return node.getContent().type() == TokenType.OPERATION && node.isLeaf();
    }

    private boolean isPunctuation(String symbol) throws ParseException {
        return !tokenizer.eof() && peek().is(TokenType.PUNCTUATION, symbol);
    }

    private void consumePunctuation(String symbol) throws ParseException {
        if (isPunctuation(symbol)) {
            next();
            return;
        }
        String expected = "symbol \"" + symbol + "\"";
        if (tokenizer.eof()) {
            throw error(expected, null, tokenizer.position());
        }
        Token found = peek();
        throw error(expected, quote(found), found.endPosition());
    }

    private Token peek() throws ParseException {
        try {
            return tokenizer.peek();
        } catch (TokenException e) {
            throw new ParseException(e);
        }
    }

    private Token next() throws ParseException {
        try {
            return tokenizer.next();
        } catch (TokenException e) {
            throw new ParseException(e);
        }
    }

    private ParseException error(String expected, String found, int position) {
        return new ParseException(new ExpectedError(tokenizer.input(), expected, found, position));
    }

    private static String quote(Token token) {
        return "\"" + token.text() + "\"";
    }
}
