package org.termcalc.cli;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.context.UserFunction;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.serialization.ContextSerializationException;
import org.termcalc.format.FormatMode;
import org.termcalc.format.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Intercepts the session commands before a line reaches the calculator:
 * <ul>
 *     <li>{@code exit}, {@code quit}</li>
 *     <li>{@code save [path]}, {@code load [path]}</li>
 *     <li>{@code format <dec|bin|oct|hex|exp> [precision]}</li>
 *     <li>{@code info}</li>
 *     <li>{@code remove <name>}</li>
 * </ul>
 * A line is only taken as a command when its first word is a command name and the argument count
 * fits, so that an input like {@code info = 5} still defines a constant.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    private static final String EXPRESSION_START = "=+-*^%(";

    private final CalculatorSession session;

    /**
     * @param session The session the commands act on.
     */
    public CommandProcessor(CalculatorSession session) {
        this.session = session;
    }

    /**
     * Runs the line if it is a command.
     * @param line The input line.
     * @return The outcome; {@link CommandResult#handled()} is false if the line is not a command.
     */
    public CommandResult process(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return CommandResult.notACommand();
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length > 1 && EXPRESSION_START.indexOf(parts[1].charAt(0)) >= 0) {
            return CommandResult.notACommand();
        }

        String command = parts[0];
        String[] args = Arrays.copyOfRange(parts, 1, parts.length);
        switch (command) {
            case "exit":
            case "quit":
                return args.length == 0 ? CommandResult.exitSession() : CommandResult.notACommand();
            case "info":
                return args.length == 0 ? CommandResult.done(info()) : CommandResult.notACommand();
            case "save":
                return args.length <= 1 ? CommandResult.done(save(pathArgument(args))) : CommandResult.notACommand();
            case "load":
                return args.length <= 1 ? CommandResult.done(load(pathArgument(args))) : CommandResult.notACommand();
            case "format":
                return args.length == 1 || args.length == 2 ? CommandResult.done(format(args)) : CommandResult.notACommand();
            case "remove":
                return args.length == 1 ? CommandResult.done(remove(args[0])) : CommandResult.notACommand();
            default:
                return CommandResult.notACommand();
        }
    }

    private Path pathArgument(String[] args) {
        return args.length == 1 ? Path.of(args[0]) : session.getSettings().contextFile();
    }

    private String save(Path file) {
        try {
            session.getSerializer().save(session.getContext(), file);
            return "Saved context to " + file + ".";
        } catch (ContextSerializationException e) {
            log.warn("Save failed: {}", e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private String load(Path file) {
        try {
            session.setContext(session.getSerializer().load(file));
            return "Loaded context from " + file + ".";
        } catch (ContextSerializationException e) {
            log.warn("Load failed: {}", e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private String format(String[] args) {
        Optional<FormatMode> mode = FormatMode.fromName(args[0]);
        if (mode.isEmpty()) {
            String modes = Arrays.stream(FormatMode.values())
                    .map(m -> m.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            return "Error: Unknown format \"" + args[0] + "\". Expected one of: " + modes + ".";
        }

        int precision = session.getFormatter().getPrecision();
        if (args.length == 2) {
            try {
                precision = Integer.parseInt(args[1]);
            } catch (NumberFormatException e) {
                precision = -1;
            }
            if (precision < 0) {
                return "Error: Invalid precision \"" + args[1] + "\". Expected a non-negative integer.";
            }
        }

        session.setFormatter(new ResultFormatter(mode.get(), precision));
        log.debug("Output format changed to {} with precision {}", mode.get(), precision);
        return "Format set to " + mode.get().name().toLowerCase(Locale.ROOT) + " with precision " + precision + ".";
    }

    private String info() {
        MathContext context = session.getContext();
        Map<String, MathResult> constants = context.getUserConstants();
        Map<String, UserFunction> functions = context.getUserFunctions();
        if (constants.isEmpty() && functions.isEmpty()) {
            return "No user defined constants or functions.";
        }

        StringBuilder sb = new StringBuilder();
        if (!constants.isEmpty()) {
            sb.append("Constants:");
            constants.forEach((name, value) ->
                    sb.append("\n  ").append(name).append(" = ").append(session.getFormatter().format(value)));
        }
        if (!functions.isEmpty()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("Functions:");
            functions.values().forEach(fn -> sb.append("\n  ").append(fn.definition()));
        }
        return sb.toString();
    }

    private String remove(String name) {
        MathContext context = session.getContext();
        if (context.removeUserConstant(name)) {
            return "Removed constant \"" + name + "\".";
        }
        if (context.removeUserFunction(name)) {
            return "Removed function \"" + name + "\".";
        }
        return "Error: No user defined constant or function \"" + name + "\".";
    }
}
