package org.termcalc.core.api;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.evaluator.Evaluator;
import org.termcalc.core.parser.ParseException;
import org.termcalc.core.parser.Parser;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.semantics.AnalyzedLine;
import org.termcalc.core.semantics.SemanticAnalyzer;
import org.termcalc.core.lexer.Token;
import org.termcalc.core.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The calculator implementation. It runs the pipeline of parsing, semantic analysis and
 * evaluation for a single line. It is stateless apart from its settings; all session state lives
 * in the {@link MathContext} passed to each call.
 */
public class Calculator implements ICalculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    /** The name of the user constant that holds the result of the last expression. */
    public static final String ANSWER_CONSTANT = "ans";

    private final boolean trackAnswer;
    private final int maxCallDepth;

    /**
     * Creates a calculator that stores every expression result as {@value #ANSWER_CONSTANT}.
     */
    public Calculator() {
        this(true, Evaluator.DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Creates a calculator.
     * @param trackAnswer Whether expression results are stored as the user constant {@value #ANSWER_CONSTANT}.
     * @param maxCallDepth The maximum nesting of user function calls during evaluation.
     */
    public Calculator(boolean trackAnswer, int maxCallDepth) {
        this.trackAnswer = trackAnswer;
        this.maxCallDepth = maxCallDepth;
    }

    @Override
    public Optional<MathResult> evaluateInput(String input, MathContext context) throws CalculationException {
        String line = input.trim();
        AnalyzedLine analyzed;
        try {
            TreeNode<Token> tree = new Parser(line, context).parseToplevel();
            analyzed = new SemanticAnalyzer(context, line).analyze(tree);
        } catch (ParseException e) {
            log.debug("Rejected input '{}': {}", line, e.getMessage());
            throw new CalculationException(e.getMessage(), e);
        }

        Evaluator evaluator = new Evaluator(context, maxCallDepth);
        switch (analyzed.kind()) {
            case CONSTANT_DEFINITION -> {
                MathResult value = evaluator.evaluate(analyzed.expression());
                context.addUserConstant(analyzed.name(), value);
                return Optional.empty();
            }
            case FUNCTION_DEFINITION -> {
                context.addUserFunction(analyzed.name(), analyzed.expression(), analyzed.parameters(), line);
                return Optional.empty();
            }
            default -> {
                MathResult result = evaluator.evaluate(analyzed.expression());
                if (trackAnswer) {
                    context.addUserConstant(ANSWER_CONSTANT, result);
                }
                return Optional.of(result);
            }
        }
    }
}
