package org.termcalc.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.termcalc.core.api.CalculationException;
import org.termcalc.core.api.ICalculator;
import org.termcalc.core.context.MathContext;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.serialization.ContextDocument.ConstantEntry;
import org.termcalc.core.serialization.ContextDocument.FunctionEntry;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes and restores the user constants and functions of a {@link MathContext} as JSON.
 * <p>
 * Functions are stored by their definition text and restored by calculating that text again
 * against the new context. Since a function may refer to another one stored after it, the
 * definitions are replayed in passes until a pass restores nothing new.
 */
public class ContextSerializer {

    private static final Logger log = LoggerFactory.getLogger(ContextSerializer.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ICalculator calculator;

    /**
     * @param calculator The calculator used to replay function definitions on load.
     */
    public ContextSerializer(ICalculator calculator) {
        this.calculator = calculator;
    }

    /**
     * Serializes the user tables of a context.
     * @param context The context to serialize.
     * @return The JSON document.
     * @throws ContextSerializationException if the document cannot be written.
     */
    public String toJson(MathContext context) throws ContextSerializationException {
        Map<String, ConstantEntry> constants = new LinkedHashMap<>();
        context.getUserConstants().forEach((name, value) ->
                constants.put(name, new ConstantEntry(value.getType(), value.getReal(), value.getImaginary())));

        Map<String, FunctionEntry> functions = new LinkedHashMap<>();
        context.getUserFunctions().forEach((name, fn) ->
                functions.put(name, new FunctionEntry(fn.definition(), fn.parameters())));

        try {
            return objectMapper.writeValueAsString(new ContextDocument(constants, functions));
        } catch (JsonProcessingException e) {
            throw new ContextSerializationException("Failed to serialize context: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Creates a fresh context and restores the user tables from a JSON document.
     * @param json The JSON document.
     * @return The restored context.
     * @throws ContextSerializationException if the document is not valid JSON of the expected shape.
     */
    public MathContext fromJson(String json) throws ContextSerializationException {
        ContextDocument document;
        try {
            document = objectMapper.readValue(json, ContextDocument.class);
        } catch (JsonProcessingException e) {
            throw new ContextSerializationException("Invalid context document: " + e.getOriginalMessage(), e);
        }

        MathContext context = new MathContext();
        if (document.userConstants() != null) {
            document.userConstants().forEach((name, entry) -> context.addUserConstant(name, toResult(entry)));
        }
        if (document.userFunctions() != null) {
            restoreFunctions(context, document.userFunctions());
        }
        log.debug("Restored {} constant(s) and {} function(s)",
                context.getUserConstants().size(), context.getUserFunctions().size());
        return context;
    }

    /**
     * Writes the user tables of a context to a file, replacing its content.
     * @param context The context to save.
     * @param file The target file.
     * @throws ContextSerializationException if the file cannot be written.
     */
    public void save(MathContext context, Path file) throws ContextSerializationException {
        String json = toJson(context);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContextSerializationException("Failed to write context file " + file + ": " + e.getMessage(), e);
        }
        log.info("Saved context to {}", file);
    }

    /**
     * Reads a context file into a fresh context.
     * @param file The file to read.
     * @return The restored context.
     * @throws ContextSerializationException if the file cannot be read or parsed.
     */
    public MathContext load(Path file) throws ContextSerializationException {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContextSerializationException("Failed to read context file " + file + ": " + e.getMessage(), e);
        }
        MathContext context = fromJson(json);
        log.info("Loaded context from {}", file);
        return context;
    }

    private void restoreFunctions(MathContext context, Map<String, FunctionEntry> functions) {
        Map<String, FunctionEntry> pending = new LinkedHashMap<>(functions);
        Map<String, String> lastErrors = new LinkedHashMap<>();
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            for (Iterator<Map.Entry<String, FunctionEntry>> it = pending.entrySet().iterator(); it.hasNext(); ) {
                Map.Entry<String, FunctionEntry> entry = it.next();
                String definition = entry.getValue().definition();
                if (definition == null) {
                    lastErrors.put(entry.getKey(), "missing definition");
                    continue;
                }
                try {
                    calculator.evaluateInput(definition, context);
                    it.remove();
                    lastErrors.remove(entry.getKey());
                    progress = true;
                } catch (CalculationException e) {
                    lastErrors.put(entry.getKey(), e.getMessage());
                }
            }
        }
        pending.keySet().forEach(name ->
                log.warn("Skipping user function '{}' that could not be restored: {}", name, lastErrors.get(name)));
    }

    private static MathResult toResult(ConstantEntry entry) {
        if (entry.type() == null) {
            return MathResult.real(entry.re());
        }
        return new MathResult(entry.type(), new Complex(entry.re(), entry.im()));
    }
}
