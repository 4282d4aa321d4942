package org.termcalc.core.context;

import org.termcalc.core.lexer.Token;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mathematical environment of a calculator session: the fixed tables of operations, functions,
 * constants and symbol classes, plus the user-defined constants and functions.
 * <p>
 * Lookups consult the built-in tables first. The fixed tables are derived in the constructor and
 * never persisted. Instances are not thread-safe; use one per session.
 */
public class MathContext {

    private static final Logger log = LoggerFactory.getLogger(MathContext.class);

    private static final Set<Character> PUNCTUATION = Set.of('(', ')', ',');

    private final Map<String, OperationType> operations = new HashMap<>();
    private final Map<String, FunctionType> functions = new HashMap<>();
    private final Map<String, MathResult> constants = new HashMap<>();

    private final Map<String, MathResult> userConstants = new LinkedHashMap<>();
    private final Map<String, UserFunction> userFunctions = new LinkedHashMap<>();

    /**
     * Creates a new context with the built-in tables and empty user tables.
     */
    public MathContext() {
        for (OperationType op : OperationType.values()) {
            operations.put(op.getSymbol(), op);
        }
        for (FunctionType fn : FunctionType.values()) {
            for (String name : fn.getNames()) {
                functions.put(name, fn);
            }
        }
        constants.put("pi", MathResult.real(Math.PI));
        constants.put("e", MathResult.real(Math.E));
        constants.put("i", MathResult.complex(0.0, 1.0));
    }

    // --- symbol classes ---

    public boolean isNumberSymbol(char c) {
        return c >= '0' && c <= '9';
    }

    public boolean isLiteralSymbol(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public boolean isPunctuationSymbol(char c) {
        return PUNCTUATION.contains(c);
    }

    // --- operations ---

    public boolean isOperation(String symbol) {
        return operations.containsKey(symbol);
    }

    public boolean isUnaryOperation(String symbol) {
        OperationType op = operations.get(symbol);
        return op != null && op.isUnary();
    }

    public Optional<OperationType> getOperationType(String symbol) {
        return Optional.ofNullable(operations.get(symbol));
    }

    /**
     * @param symbol The operation symbol.
     * @return The precedence of the operation.
     * @throws IllegalArgumentException if the symbol is not an operation.
     */
    public int getOperationPrecedence(String symbol) {
        OperationType op = operations.get(symbol);
        if (op == null) {
            throw new IllegalArgumentException("Not an operation: " + symbol);
        }
        return op.getPrecedence();
    }

    // --- functions ---

    public boolean isFunction(String name) {
        return isBuiltInFunction(name) || isUserFunction(name);
    }

    public boolean isBuiltInFunction(String name) {
        return functions.containsKey(name);
    }

    public boolean isUserFunction(String name) {
        return userFunctions.containsKey(name);
    }

    public Optional<FunctionType> getFunctionType(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Returns the number of arguments a function expects. For a user function this is the number
     * of its parameters.
     * @param name The function name.
     * @return The arity, or empty if the name is not a function.
     */
    public Optional<Integer> getFunctionArity(String name) {
        FunctionType builtIn = functions.get(name);
        if (builtIn != null) {
            return Optional.of(builtIn.getArity());
        }
        UserFunction user = userFunctions.get(name);
        return user == null ? Optional.empty() : Optional.of(user.arity());
    }

    // --- constants ---

    public boolean isConstant(String name) {
        return isBuiltInConstant(name) || isUserConstant(name);
    }

    public boolean isBuiltInConstant(String name) {
        return constants.containsKey(name);
    }

    public boolean isUserConstant(String name) {
        return userConstants.containsKey(name);
    }

    /**
     * Looks up the value of a constant, built-in first.
     * @param name The constant name.
     * @return The value, or empty if the name is unknown.
     */
    public Optional<MathResult> getConstantValue(String name) {
        MathResult builtIn = constants.get(name);
        if (builtIn != null) {
            return Optional.of(builtIn);
        }
        return Optional.ofNullable(userConstants.get(name));
    }

    // --- user tables ---

    /**
     * Defines or overwrites a user constant. A user function of the same name is removed.
     * @param name The constant name.
     * @param value The value.
     */
    public void addUserConstant(String name, MathResult value) {
        if (userFunctions.remove(name) != null) {
            log.debug("User function '{}' replaced by constant", name);
        }
        userConstants.put(name, value);
        log.debug("Defined user constant {} = {}", name, value);
    }

    /**
     * @param name The constant name.
     * @return {@code true} if a user constant was removed.
     */
    public boolean removeUserConstant(String name) {
        return userConstants.remove(name) != null;
    }

    /**
     * Defines or overwrites a user function. A user constant of the same name is removed.
     * @param name The function name.
     * @param body The body tree; the context takes ownership of it.
     * @param parameters The ordered parameter names.
     * @param definition The defining input line.
     */
    public void addUserFunction(String name, TreeNode<Token> body, List<String> parameters, String definition) {
        if (userConstants.remove(name) != null) {
            log.debug("User constant '{}' replaced by function", name);
        }
        userFunctions.put(name, new UserFunction(body, parameters, definition));
        log.debug("Defined user function {}({})", name, String.join(", ", parameters));
    }

    /**
     * @param name The function name.
     * @return {@code true} if a user function was removed.
     */
    public boolean removeUserFunction(String name) {
        return userFunctions.remove(name) != null;
    }

    /**
     * @return A read-only view of the user constants in definition order.
     */
    public Map<String, MathResult> getUserConstants() {
        return Collections.unmodifiableMap(userConstants);
    }

    /**
     * @return A read-only view of the user functions in definition order.
     */
    public Map<String, UserFunction> getUserFunctions() {
        return Collections.unmodifiableMap(userFunctions);
    }

    /**
     * Produces the expression tree of a user function call: a copy of the stored body in which
     * every constant-like leaf named after a parameter is replaced by a copy of the matching
     * argument subtree.
     *
     * @param name The user function name.
     * @param args The argument subtrees, in parameter order.
     * @return The substituted tree, or empty if the function is unknown or the argument count
     *         does not match its parameter count.
     */
    public Optional<TreeNode<Token>> substituteUserFunctionTree(String name, List<TreeNode<Token>> args) {
        UserFunction function = userFunctions.get(name);
        if (function == null || function.arity() != args.size()) {
            return Optional.empty();
        }
        List<String> params = function.parameters();
        TreeNode<Token> substituted = function.body().replaceLeaves(
                leaf -> leaf.getContent().type().isConstantLike() && params.contains(leaf.getContent().text()),
                leaf -> args.get(params.indexOf(leaf.getContent().text())).deepCopy());
        return Optional.of(substituted);
    }
}
