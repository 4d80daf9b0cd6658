package com.logpipeline.processor.service;

import com.logpipeline.processor.config.ProcessorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by all consumer workers of this process.
 */
@Slf4j
@Component
public class ProcessorMetrics {

    public static final String REASON_UNPARSEABLE = "unparseable";
    public static final String REASON_MALFORMED = "malformed";
    public static final String REASON_REJECTED = "rejected";

    private final MeterRegistry meterRegistry;
    private final Counter logsProcessedCounter;
    private final Counter batchesProcessedCounter;
    private final Timer dbWriteLatencyTimer;
    private final AtomicLong indexedTotal = new AtomicLong();
    private final long progressEvery;

    public ProcessorMetrics(MeterRegistry meterRegistry, ProcessorProperties properties) {
        this.meterRegistry = meterRegistry;
        this.progressEvery = Math.max(1, properties.getProgressEvery());

        this.logsProcessedCounter = Counter.builder("logs.processed")
            .description("Total number of log lines parsed and persisted")
            .register(meterRegistry);
        this.batchesProcessedCounter = Counter.builder("logs.batches.processed")
            .description("Total number of batches written")
            .register(meterRegistry);
        this.dbWriteLatencyTimer = Timer.builder("logs.db.write.latency")
            .description("Time taken to write log batches to the database")
            .register(meterRegistry);
    }

    public Timer dbWriteLatency() {
        return dbWriteLatencyTimer;
    }

    public void dropped(String reason) {
        Counter.builder("logs.dropped")
            .description("Queue messages that produced no row")
            .tag("reason", reason)
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records a committed batch and logs progress whenever the running total
     * crosses a multiple of the progress interval.
     */
    public void indexed(int rows) {
        logsProcessedCounter.increment(rows);
        batchesProcessedCounter.increment();
        long total = indexedTotal.addAndGet(rows);
        if (total / progressEvery > (total - rows) / progressEvery) {
            log.info("Indexed {} records so far...", String.format("%,d", total));
        }
    }

    public long indexedTotal() {
        return indexedTotal.get();
    }
}
