package com.logpipeline.reader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@Data
@ConfigurationProperties(prefix = "pipeline.reader")
public class ReaderProperties {

    private Path logDir = Path.of("./data/logs");

    private String fileSuffix = ".log";

    /** Lines pushed to the queue per round trip; the file cursor advances once per batch. */
    private int batchSize = 500;

    /** Where file cursors live: {@code redis} survives restarts, {@code memory} does not. */
    private String progressStore = "redis";

    private String progressKey = "log_reader:progress";
}
