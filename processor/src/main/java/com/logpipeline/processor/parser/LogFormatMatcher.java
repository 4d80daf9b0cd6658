package com.logpipeline.processor.parser;

import java.util.Optional;

/**
 * One log format. Implementations are stateless and thread safe.
 */
public interface LogFormatMatcher {

    LogType type();

    /**
     * Cheap structural check run before the full grammar. Returning {@code false}
     * means the line cannot belong to this format.
     */
    boolean accepts(String line);

    /**
     * Applies the full grammar.
     *
     * @return the record, or empty when the line does not match this format
     */
    Optional<ParsedRecord> match(String line);
}
