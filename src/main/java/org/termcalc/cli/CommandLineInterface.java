package org.termcalc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.termcalc.cli.config.CalculatorSettings;
import org.termcalc.cli.config.ConfigLoader;
import org.termcalc.cli.config.LoggingConfigurator;
import org.termcalc.core.api.Calculator;
import org.termcalc.core.serialization.ContextSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry point of the terminal calculator.
 * <p>
 * With expressions on the command line, they are calculated in order and the results are printed
 * on one line. Without, an interactive session is started.
 */
@Command(
    name = "termcalc",
    mixinStandardHelpOptions = true,
    version = "termcalc 1.0",
    description = "Calculates mathematical expressions with real and complex numbers."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CALCULATION_ERROR = 1;
    static final int EXIT_FAILURE = 2;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: termcalc.conf)")
    private File configFile;

    @Option(names = "--context", description = "Context file with user constants and functions to load on start")
    private File contextFile;

    @Parameters(arity = "0..*", paramLabel = "EXPR", description = "Expressions to calculate. Starts an interactive session if omitted.")
    private List<String> expressions;

    private PrintWriter out = new PrintWriter(System.out, true);

    @Override
    public Integer call() {
        CalculatorSession session;
        try {
            Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            CalculatorSettings settings = CalculatorSettings.fromConfig(config);
            session = new CalculatorSession(new Calculator(settings.trackAnswer(), settings.maxCallDepth()), settings);
            if (contextFile != null) {
                session.setContext(session.getSerializer().load(contextFile.toPath()));
            }
        } catch (ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (ContextSerializationException e) {
            log.error("Failed to load context: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        if (expressions != null && !expressions.isEmpty()) {
            return session.evaluateAll(expressions, out) ? EXIT_OK : EXIT_CALCULATION_ERROR;
        }
        return runInteractive(session);
    }

    private int runInteractive(CalculatorSession session) {
        Terminal terminal;
        try {
            terminal = TerminalBuilder.builder().system(true).build();
        } catch (IOException e) {
            log.debug("System terminal not available, falling back to dumb terminal: {}", e.getMessage());
            try {
                terminal = TerminalBuilder.builder().dumb(true).build();
            } catch (IOException fallbackError) {
                log.error("Failed to open a terminal: {}", fallbackError.getMessage());
                return EXIT_FAILURE;
            }
        }

        try (Terminal t = terminal) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(t)
                    .history(new DefaultHistory())
                    .build();
            PrintWriter writer = t.writer();
            String prompt = session.getSettings().prompt();
            while (true) {
                String line;
                try {
                    line = lineReader.readLine(prompt);
                } catch (UserInterruptException e) {
                    // Ctrl+C
                    return EXIT_OK;
                } catch (EndOfFileException e) {
                    // Ctrl+D
                    return EXIT_OK;
                }
                if (line == null || !session.handleLine(line, writer)) {
                    return EXIT_OK;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to close terminal: {}", e.getMessage());
            return EXIT_OK;
        }
    }

    void setOut(PrintWriter out) {
        this.out = out;
    }

    /**
     * Creates the configured picocli command line. Arguments that look like options but are not
     * known, such as {@code -3+2}, are taken as expressions.
     * @param cli The command instance.
     * @return The command line.
     */
    static CommandLine createCommandLine(CommandLineInterface cli) {
        final CommandLine commandLine = new CommandLine(cli);
        commandLine.setCommandName("termcalc");
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            log.error("Unexpected failure: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }
}
