package com.logpipeline.processor.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured form of one log line. {@code fields} always holds {@code timestamp}; the
 * other keys depend on the format. Values are the original tokens, never converted.
 */
public record ParsedRecord(LogType logType, String timestamp, Map<String, String> fields) {

    public ParsedRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
