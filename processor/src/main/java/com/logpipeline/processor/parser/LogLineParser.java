package com.logpipeline.processor.parser;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a raw log line by trying each matcher in priority order. The first
 * matcher that accepts and matches the line wins.
 */
public class LogLineParser {

    private final List<LogFormatMatcher> matchers;

    public LogLineParser(List<LogFormatMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * Firewall, then DNS, then auth.
     */
    public static LogLineParser withDefaultFormats() {
        return new LogLineParser(List.of(new FirewallMatcher(), new DnsMatcher(), new AuthMatcher()));
    }

    /**
     * @return the parsed record, or empty if no format claims the line
     */
    public Optional<ParsedRecord> parse(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }
        for (LogFormatMatcher matcher : matchers) {
            if (!matcher.accepts(line)) {
                continue;
            }
            Optional<ParsedRecord> record = matcher.match(line);
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }

    public List<LogFormatMatcher> matchers() {
        return matchers;
    }
}
