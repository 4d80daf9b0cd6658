package com.logpipeline.processor.parser;

import io.krakens.grok.api.Grok;
import io.krakens.grok.api.GrokCompiler;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matcher for fixed grammars written as Grok expressions. The default Grok patterns
 * are available, plus the format grammars in {@value #PATTERN_FILE} on the classpath.
 * Every listed field must be captured; {@code timestamp} is required.
 */
public abstract class GrokLogFormatMatcher implements LogFormatMatcher {

    static final String PATTERN_FILE = "patterns/security-logs";

    private final String expression;
    private final Grok grok;
    private final List<String> fields;

    /**
     * @param expression Grok expression; anchor it with {@code ^} and {@code $} as the grammar requires,
     *     since Grok finds the first match anywhere in the line
     * @param fields captured field names, in the order they are stored
     */
    protected GrokLogFormatMatcher(String expression, List<String> fields) {
        this.expression = expression;
        this.grok = compile(expression);
        this.fields = List.copyOf(fields);
    }

    @Override
    public Optional<ParsedRecord> match(String line) {
        if (!accepts(line)) {
            return Optional.empty();
        }
        Map<String, Object> captures = grok.match(line).capture();
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : fields) {
            Object value = captures.get(field);
            if (value == null) {
                return Optional.empty();
            }
            values.put(field, value.toString());
        }
        return Optional.of(new ParsedRecord(type(), values.get("timestamp"), values));
    }

    static Grok compile(String expression) {
        GrokCompiler compiler = GrokCompiler.newInstance();
        compiler.registerDefaultPatterns();
        try (Reader reader = new InputStreamReader(openPatternFile(), StandardCharsets.UTF_8)) {
            compiler.register(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load Grok patterns from " + PATTERN_FILE, e);
        }
        return compiler.compile(expression, true);
    }

    private static InputStream openPatternFile() throws FileNotFoundException {
        InputStream in = GrokLogFormatMatcher.class.getClassLoader().getResourceAsStream(PATTERN_FILE);
        if (in == null) {
            throw new FileNotFoundException(PATTERN_FILE + " not found on classpath!");
        }
        return in;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + expression;
    }
}
