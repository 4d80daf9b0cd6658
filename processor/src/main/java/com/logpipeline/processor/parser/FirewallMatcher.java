package com.logpipeline.processor.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pipe-delimited key=value firewall lines:
 * {@code 2024-01-15T10:23:45.123Z|action=accept|src=192.168.1.100|dst=10.0.0.50|...}.
 * The first segment is the timestamp; every later segment holding {@code =} is split
 * on its first {@code =}.
 */
public class FirewallMatcher implements LogFormatMatcher {

    private static final int MIN_SEGMENTS = 3;

    @Override
    public LogType type() {
        return LogType.FIREWALL;
    }

    @Override
    public boolean accepts(String line) {
        return line.indexOf('|') >= 0 && line.indexOf('=') >= 0;
    }

    @Override
    public Optional<ParsedRecord> match(String line) {
        if (!accepts(line)) {
            return Optional.empty();
        }
        String[] segments = line.split("\\|", -1);
        if (segments.length < MIN_SEGMENTS) {
            return Optional.empty();
        }

        String timestamp = segments[0];
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("timestamp", timestamp);
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            int eq = segment.indexOf('=');
            if (eq < 0) {
                continue;
            }
            fields.put(segment.substring(0, eq), segment.substring(eq + 1));
        }
        // A timestamp=... pair never overrides the leading segment.
        fields.put("timestamp", timestamp);
        return Optional.of(new ParsedRecord(LogType.FIREWALL, timestamp, fields));
    }
}
