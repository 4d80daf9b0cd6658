package com.logpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire unit on the log queue: one trimmed log line and the name of the file it came from.
 * Serialized as {@code {"line": ..., "source_file": ...}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessage {
    @JsonProperty("line")
    private String line;

    @JsonProperty("source_file")
    private String sourceFile;
}
