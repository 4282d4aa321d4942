package org.termcalc.core.evaluator;

import org.termcalc.core.context.FunctionType;
import org.termcalc.core.context.MathContext;
import org.termcalc.core.context.MathOperations;
import org.termcalc.core.context.OperationType;
import org.termcalc.core.lexer.NumberLiteral;
import org.termcalc.core.lexer.Token;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.result.NumberType;
import org.termcalc.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks an expression tree and computes its value against a {@link MathContext}.
 * <p>
 * Evaluation never throws: a subtree whose value is undefined yields {@link MathResult#nan()}.
 * User function calls are evaluated by substituting the unevaluated argument subtrees into a
 * copy of the stored body.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private final MathContext context;
    private final int maxCallDepth;
    private int callDepth = 0;
    private boolean depthExceeded = false;

    /**
     * Creates an evaluator with the default call depth limit.
     * @param context The registry to resolve symbols against.
     */
    public Evaluator(MathContext context) {
        this(context, DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Creates an evaluator.
     * @param context The registry to resolve symbols against.
     * @param maxCallDepth The maximum nesting of user function calls.
     */
    public Evaluator(MathContext context, int maxCallDepth) {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive, got " + maxCallDepth);
        }
        this.context = context;
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Evaluates an expression tree.
     * @param tree The tree to evaluate.
     * @return The value, or NaN if it is undefined.
     */
    public MathResult evaluate(TreeNode<Token> tree) {
        callDepth = 0;
        depthExceeded = false;
        MathResult result = evaluateNode(tree);
        log.debug("Evaluated {} to {}", tree, result);
        return result;
    }

    private MathResult evaluateNode(TreeNode<Token> node) {
        Token token = node.getContent();
        switch (token.type()) {
            case NUMBER:
                return evaluateNumber(token);
            case CONSTANT:
            case USER_CONSTANT:
                return context.getConstantValue(token.text()).orElseGet(MathResult::nan);
            case OPERATION:
                return evaluateOperation(node);
            case FUNCTION:
                return evaluateFunction(node);
            case USER_FUNCTION:
                return evaluateUserFunction(node);
            default:
                log.trace("Unresolved symbol '{}' evaluates to NaN", token.text());
                return MathResult.nan();
        }
    }

    private MathResult evaluateNumber(Token token) {
        double value;
        try {
            value = NumberLiteral.parse(token.text());
        } catch (NumberFormatException e) {
            log.trace("Invalid number literal '{}' evaluates to NaN", token.text());
            return MathResult.nan();
        }
        return token.numberType() == NumberType.COMPLEX
                ? MathResult.complex(0.0, value)
                : MathResult.real(value);
    }

    private MathResult evaluateOperation(TreeNode<Token> node) {
        Optional<OperationType> op = context.getOperationType(node.getContent().text());
        if (op.isEmpty()) {
            return MathResult.nan();
        }
        if (node.childCount() == 1) {
            return MathOperations.unary(op.get(), evaluateNode(node.getChild(0)));
        }
        if (node.childCount() == 2) {
            MathResult left = evaluateNode(node.getChild(0));
            MathResult right = evaluateNode(node.getChild(1));
            return MathOperations.binary(op.get(), left, right);
        }
        return MathResult.nan();
    }

    private MathResult evaluateFunction(TreeNode<Token> node) {
        Optional<FunctionType> fn = context.getFunctionType(node.getContent().text());
        if (fn.isEmpty()) {
            return MathResult.nan();
        }
        List<MathResult> args = new ArrayList<>(node.childCount());
        for (TreeNode<Token> child : node.getChildren()) {
            args.add(evaluateNode(child));
        }
        return MathOperations.function(fn.get(), args);
    }

    private MathResult evaluateUserFunction(TreeNode<Token> node) {
        String name = node.getContent().text();
        if (depthExceeded) {
            return MathResult.nan();
        }
        if (callDepth >= maxCallDepth) {
            depthExceeded = true;
            log.warn("Call depth limit of {} exceeded in user function '{}'", maxCallDepth, name);
            return MathResult.nan();
        }
        Optional<TreeNode<Token>> body = context.substituteUserFunctionTree(name, node.getChildren());
        if (body.isEmpty()) {
            return MathResult.nan();
        }
        callDepth++;
        try {
            return evaluateNode(body.get());
        } finally {
            callDepth--;
        }
    }
}
