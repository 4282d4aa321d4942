package org.termcalc.cli;

import org.termcalc.cli.config.CalculatorSettings;
import org.termcalc.core.api.CalculationException;
import org.termcalc.core.api.ICalculator;
import org.termcalc.core.context.MathContext;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.serialization.ContextSerializer;
import org.termcalc.format.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The state of one calculator session: the math context, the output format and the collaborators
 * that act on them. Lines typed by the user are routed either to the {@link CommandProcessor} or
 * to the calculator core.
 */
public class CalculatorSession {

    private static final Logger log = LoggerFactory.getLogger(CalculatorSession.class);

    private final ICalculator calculator;
    private final ContextSerializer serializer;
    private final CalculatorSettings settings;
    private final CommandProcessor commands;

    private MathContext context;
    private ResultFormatter formatter;

    /**
     * Creates a session with an empty context.
     * @param calculator The calculator core.
     * @param settings The session settings.
     */
    public CalculatorSession(ICalculator calculator, CalculatorSettings settings) {
        this.calculator = calculator;
        this.settings = settings;
        this.serializer = new ContextSerializer(calculator);
        this.context = new MathContext();
        this.formatter = new ResultFormatter(settings.formatMode(), settings.precision());
        this.commands = new CommandProcessor(this);
    }

    /**
     * Handles one line of the interactive mode and prints its outcome.
     * @param line The line as typed.
     * @param out The output for results and diagnostics.
     * @return {@code false} if the session should end.
     */
    public boolean handleLine(String line, PrintWriter out) {
        if (line.isBlank()) {
            return true;
        }
        CommandResult command = commands.process(line);
        if (command.handled()) {
            command.output().ifPresent(out::println);
            out.flush();
            return !command.exit();
        }
        try {
            calculator.evaluateInput(line, context)
                    .ifPresent(result -> out.println(settings.answerPrefix() + formatter.format(result)));
        } catch (CalculationException e) {
            out.println(e.getMessage());
        }
        out.flush();
        return true;
    }

    /**
     * Evaluates the given inputs in order and prints the results on one line, separated by
     * {@code "; "}. The run stops at the first input that fails.
     *
     * @param inputs The inputs to evaluate.
     * @param out The output for results and diagnostics.
     * @return {@code true} if every input was calculated.
     */
    public boolean evaluateAll(List<String> inputs, PrintWriter out) {
        List<String> results = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            try {
                Optional<MathResult> result = calculator.evaluateInput(inputs.get(i), context);
                result.ifPresent(r -> results.add(formatter.format(r)));
            } catch (CalculationException e) {
                log.debug("Input {} of {} failed", i + 1, inputs.size());
                if (!results.isEmpty()) {
                    out.println(String.join("; ", results));
                }
                out.println("In input " + (i + 1) + ":");
                out.println(e.getMessage());
                out.flush();
                return false;
            }
        }
        if (!results.isEmpty()) {
            out.println(String.join("; ", results));
        }
        out.flush();
        return true;
    }

    public MathContext getContext() {
        return context;
    }

    void setContext(MathContext context) {
        this.context = context;
    }

    public ResultFormatter getFormatter() {
        return formatter;
    }

    void setFormatter(ResultFormatter formatter) {
        this.formatter = formatter;
    }

    public CalculatorSettings getSettings() {
        return settings;
    }

    ContextSerializer getSerializer() {
        return serializer;
    }
}
