package com.logpipeline.common.queue;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Redis keys used by the log queue.
 */
@Data
@ConfigurationProperties(prefix = "pipeline.queue")
public class QueueProperties {

    /** List the reader pushes to and the processor pops from. */
    private String name = "log_queue";

    private String processingSuffix = ":processing:";

    private String deadLetterSuffix = ":dead";

    public String processingKey(String consumer) {
        return name + processingSuffix + consumer;
    }

    public String deadLetterKey() {
        return name + deadLetterSuffix;
    }
}
