package org.termcalc.cli;

import java.util.Optional;

/**
 * The outcome of offering a line to the {@link CommandProcessor}.
 *
 * @param handled Whether the line was a command. Unhandled lines go to the calculator.
 * @param exit Whether the session should end.
 * @param message Text to show to the user, or null.
 */
public record CommandResult(boolean handled, boolean exit, String message) {

    static CommandResult notACommand() {
        return new CommandResult(false, false, null);
    }

    static CommandResult done(String message) {
        return new CommandResult(true, false, message);
    }

    static CommandResult exitSession() {
        return new CommandResult(true, true, null);
    }

    public Optional<String> output() {
        return Optional.ofNullable(message);
    }
}
