package org.termcalc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.termcalc.format.FormatMode;

import java.nio.file.Path;

/**
 * A typed view over the {@code termcalc} block of the configuration.
 *
 * @param prompt The prompt of the interactive mode.
 * @param answerPrefix The text printed before each result in the interactive mode.
 * @param trackAnswer Whether expression results are stored as the constant {@code ans}.
 * @param contextFile The default file for {@code save} and {@code load}.
 * @param formatMode The initial output format.
 * @param precision The initial number of fractional digits.
 * @param maxCallDepth The maximum nesting of user function calls.
 */
public record CalculatorSettings(
        String prompt,
        String answerPrefix,
        boolean trackAnswer,
        Path contextFile,
        FormatMode formatMode,
        int precision,
        int maxCallDepth
) {
    private static final String ROOT = "termcalc";

    /**
     * Reads the settings from a resolved configuration.
     * @param config The configuration; must contain the {@code termcalc} block.
     * @return The settings.
     * @throws ConfigException if a value is missing or invalid.
     */
    public static CalculatorSettings fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        String modeName = c.getString("format.mode");
        FormatMode mode = FormatMode.fromName(modeName).orElseThrow(() ->
                new ConfigException.BadValue(c.origin(), "format.mode", "Unknown format mode '" + modeName + "'"));
        int precision = c.getInt("format.precision");
        if (precision < 0) {
            throw new ConfigException.BadValue(c.origin(), "format.precision", "Must not be negative: " + precision);
        }
        int maxCallDepth = c.getInt("max-call-depth");
        if (maxCallDepth < 1) {
            throw new ConfigException.BadValue(c.origin(), "max-call-depth", "Must be positive: " + maxCallDepth);
        }
        return new CalculatorSettings(
                c.getString("prompt"),
                c.getString("answer-prefix"),
                c.getBoolean("track-answer"),
                Path.of(c.getString("context-file")),
                mode,
                precision,
                maxCallDepth);
    }
}
