package com.logpipeline.processor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pipeline.store")
public class StoreProperties {

    /** Attempts at reaching the database on startup before giving up. */
    private int connectAttempts = 5;

    private Duration connectBackoff = Duration.ofSeconds(2);

    /** Also create per-format expression indexes on {@code parsed_data}. */
    private boolean auxiliaryIndexes = true;
}
