package com.logpipeline.processor.service;

import com.logpipeline.common.model.MalformedMessageException;
import com.logpipeline.common.model.QueueMessage;
import com.logpipeline.common.model.QueueMessageCodec;
import com.logpipeline.common.queue.Delivery;
import com.logpipeline.common.queue.LogQueueConsumer;
import com.logpipeline.processor.config.ProcessorProperties;
import com.logpipeline.processor.model.LogEntity;
import com.logpipeline.processor.parser.LogLineParser;
import com.logpipeline.processor.parser.ParsedRecord;
import com.logpipeline.processor.store.LogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One consumer loop: lease a batch of messages, parse them, write the rows in one
 * transaction, then acknowledge. Messages whose batch fails to write are released
 * back to the queue, except rows the store refuses as invalid, which are dropped one
 * by one. Each worker owns its own lease list and batch buffers.
 */
@Slf4j
public class LogConsumerWorker implements Runnable {

    private final String consumer;
    private final LogQueueConsumer queue;
    private final QueueMessageCodec codec;
    private final LogLineParser parser;
    private final LogStore store;
    private final ProcessorMetrics metrics;
    private final ProcessorProperties properties;

    private volatile boolean running = true;

    public LogConsumerWorker(String consumer,
                             LogQueueConsumer queue,
                             QueueMessageCodec codec,
                             LogLineParser parser,
                             LogStore store,
                             ProcessorMetrics metrics,
                             ProcessorProperties properties) {
        this.consumer = consumer;
        this.queue = queue;
        this.codec = codec;
        this.parser = parser;
        this.store = store;
        this.metrics = metrics;
        this.properties = properties;
    }

    public String consumer() {
        return consumer;
    }

    @Override
    public void run() {
        try {
            queue.recover(consumer);
        } catch (RuntimeException e) {
            log.error("Consumer {} could not recover leased messages, they stay leased until the next start",
                consumer, e);
        }
        log.info("Consumer {} polling queue", consumer);
        while (running) {
            try {
                processBatch();
            } catch (RuntimeException e) {
                log.error("Consumer {} failed to poll the queue", consumer, e);
                pause();
                recoverAfterFailure();
            }
        }
        log.info("Consumer {} stopped", consumer);
    }

    public void stop() {
        running = false;
    }

    /**
     * Waits up to the poll timeout for a message, then drains whatever is immediately
     * available up to the batch size and writes it. If the broker fails while the batch
     * is being collected, every message still leased by this call is released.
     *
     * @return number of rows written
     */
    public int processBatch() {
        Optional<Delivery> first = queue.dequeue(consumer, properties.getPollTimeout());
        if (first.isEmpty()) {
            return 0;
        }

        List<Pending> batch = new ArrayList<>();
        Delivery current = first.get();
        try {
            accept(current, batch);
            current = null;
            while (batch.size() < properties.getBatchSize()) {
                Optional<Delivery> next = queue.dequeue(consumer, Duration.ZERO);
                if (next.isEmpty()) {
                    break;
                }
                current = next.get();
                accept(current, batch);
                current = null;
            }
        } catch (RuntimeException e) {
            List<Delivery> held = new ArrayList<>(batch.stream().map(Pending::delivery).toList());
            if (current != null) {
                held.add(current);
            }
            try {
                release(held);
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        return flush(batch);
    }

    private void accept(Delivery delivery, List<Pending> batch) {
        QueueMessage message;
        try {
            message = codec.decode(delivery.payload());
        } catch (MalformedMessageException e) {
            log.debug("Dropping malformed payload: {}", e.getMessage());
            discard(delivery, ProcessorMetrics.REASON_MALFORMED);
            return;
        }

        Optional<ParsedRecord> record = parser.parse(message.getLine());
        if (record.isEmpty()) {
            log.debug("Dropping unparseable line from {}", message.getSourceFile());
            discard(delivery, ProcessorMetrics.REASON_UNPARSEABLE);
            return;
        }
        batch.add(new Pending(delivery, LogEntity.of(message, record.get())));
    }

    private void discard(Delivery delivery, String reason) {
        if (properties.isDeadLetterEnabled()) {
            queue.deadLetter(delivery, reason);
        } else {
            queue.acknowledge(delivery);
        }
        metrics.dropped(reason);
    }

    private int flush(List<Pending> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        List<LogEntity> rows = batch.stream().map(Pending::row).toList();
        try {
            metrics.dbWriteLatency().record(() -> store.writeAll(rows));
        } catch (DataIntegrityViolationException e) {
            log.warn("Store rejected a batch of {} rows, writing them one at a time: {}",
                rows.size(), e.getMostSpecificCause().getMessage());
            return writeEach(batch);
        } catch (RuntimeException e) {
            log.error("Failed to write batch of {} rows, releasing it back to the queue", rows.size(), e);
            release(batch.stream().map(Pending::delivery).toList());
            pause();
            return 0;
        }

        // Acknowledge only after the batch is committed.
        batch.forEach(pending -> acknowledge(pending.delivery()));
        metrics.indexed(rows.size());
        return rows.size();
    }

    /**
     * Writes each row in its own transaction. Rows the store refuses outright are
     * discarded; a failure of any other kind releases the rest of the batch.
     */
    private int writeEach(List<Pending> batch) {
        int written = 0;
        for (int i = 0; i < batch.size(); i++) {
            Pending pending = batch.get(i);
            try {
                metrics.dbWriteLatency().record(() -> store.write(pending.row()));
            } catch (DataIntegrityViolationException e) {
                log.warn("Dropping row from {} rejected by the store: {}",
                    pending.row().getSourceFile(), e.getMostSpecificCause().getMessage());
                discard(pending.delivery(), ProcessorMetrics.REASON_REJECTED);
                continue;
            } catch (RuntimeException e) {
                log.error("Failed to write row, releasing the remaining {} messages", batch.size() - i, e);
                release(batch.subList(i, batch.size()).stream().map(Pending::delivery).toList());
                pause();
                break;
            }
            acknowledge(pending.delivery());
            written++;
        }
        if (written > 0) {
            metrics.indexed(written);
        }
        return written;
    }

    private void acknowledge(Delivery delivery) {
        try {
            queue.acknowledge(delivery);
        } catch (RuntimeException e) {
            log.error("Failed to acknowledge message for consumer {}", consumer, e);
        }
    }

    /**
     * Releases newest first so the messages come back out in their original order.
     */
    private void release(List<Delivery> deliveries) {
        for (int i = deliveries.size() - 1; i >= 0; i--) {
            queue.release(deliveries.get(i));
        }
    }

    private void recoverAfterFailure() {
        if (!running) {
            return;
        }
        try {
            queue.recover(consumer);
        } catch (RuntimeException e) {
            log.warn("Consumer {} could not recover leased messages yet: {}", consumer, e.toString());
        }
    }

    private void pause() {
        try {
            Thread.sleep(properties.getFailureBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private record Pending(Delivery delivery, LogEntity row) {
    }
}
