package com.logpipeline.processor.service;

import com.logpipeline.common.PipelineRole;
import com.logpipeline.common.model.QueueMessageCodec;
import com.logpipeline.common.queue.LogQueueConsumer;
import com.logpipeline.processor.config.ProcessorProperties;
import com.logpipeline.processor.parser.LogLineParser;
import com.logpipeline.processor.store.LogStore;
import com.logpipeline.processor.store.SchemaBootstrap;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Ensures the schema, then, for the {@code processor} role, checks the queue broker and
 * starts the consumer workers.
 * The {@code init-db} role stops after the schema step.
 */
@Slf4j
@Component
public class ProcessorRunner implements ApplicationRunner {

    private final SchemaBootstrap schemaBootstrap;
    private final QueueBootstrap queueBootstrap;
    private final LogQueueConsumer queue;
    private final QueueMessageCodec codec;
    private final LogLineParser parser;
    private final LogStore store;
    private final ProcessorMetrics metrics;
    private final ProcessorProperties properties;

    private final List<LogConsumerWorker> workers = new ArrayList<>();
    private ExecutorService executor;

    public ProcessorRunner(SchemaBootstrap schemaBootstrap,
                           QueueBootstrap queueBootstrap,
                           LogQueueConsumer queue,
                           QueueMessageCodec codec,
                           LogLineParser parser,
                           LogStore store,
                           ProcessorMetrics metrics,
                           ProcessorProperties properties) {
        this.schemaBootstrap = schemaBootstrap;
        this.queueBootstrap = queueBootstrap;
        this.queue = queue;
        this.codec = codec;
        this.parser = parser;
        this.store = store;
        this.metrics = metrics;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineRole role = PipelineRole.fromArgs(args.getNonOptionArgs()).orElse(PipelineRole.PROCESSOR);
        schemaBootstrap.ensureSchema();
        if (role == PipelineRole.INIT_DB) {
            log.info("Initialized 'logs' table.");
            return;
        }
        long waiting = queueBootstrap.awaitQueue();
        log.info("Connected to queue, {} messages waiting", waiting);
        startWorkers();
    }

    void startWorkers() {
        int count = Math.max(1, properties.getWorkers());
        executor = Executors.newFixedThreadPool(count, new CustomizableThreadFactory("log-consumer-"));
        for (int i = 0; i < count; i++) {
            LogConsumerWorker worker = new LogConsumerWorker(
                properties.getConsumerName() + "-" + i, queue, codec, parser, store, metrics, properties);
            workers.add(worker);
            executor.submit(worker);
        }
        log.info("Consuming from queue with {} worker(s)...", count);
    }

    List<LogConsumerWorker> workers() {
        return workers;
    }

    @PreDestroy
    public void stop() throws InterruptedException {
        if (executor == null) {
            return;
        }
        workers.forEach(LogConsumerWorker::stop);
        executor.shutdown();
        long waitMillis = properties.getPollTimeout().toMillis() + properties.getFailureBackoff().toMillis() + 1000;
        if (!executor.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
            log.warn("Consumer workers did not stop within {} ms", waitMillis);
            executor.shutdownNow();
        }
        log.info("Stopped after indexing {} records", metrics.indexedTotal());
    }
}
