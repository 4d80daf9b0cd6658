package com.logpipeline.processor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pipeline.processor")
public class ProcessorProperties {

    /** Base name of this processor; worker {@code n} leases messages as {@code <name>-<n>}. */
    private String consumerName = "processor-1";

    private int workers = 1;

    /** Rows written per transaction. */
    private int batchSize = 50;

    /** How long a worker blocks waiting for the first message of a batch. */
    private Duration pollTimeout = Duration.ofSeconds(1);

    /** Log a progress line every this many indexed rows. */
    private long progressEvery = 1000;

    /** Pause after a failed poll or write before trying again. */
    private Duration failureBackoff = Duration.ofSeconds(2);

    /** Attempts at reaching the queue broker on startup before giving up. */
    private int connectAttempts = 5;

    private Duration connectBackoff = Duration.ofSeconds(2);

    /** Move unparseable and malformed payloads to the dead-letter list instead of dropping them. */
    private boolean deadLetterEnabled = false;
}
