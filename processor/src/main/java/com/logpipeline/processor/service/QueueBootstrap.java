package com.logpipeline.processor.service;

import com.logpipeline.common.queue.LogQueueConsumer;
import com.logpipeline.processor.config.ProcessorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Checks that the queue broker answers before the workers start, retrying a bounded
 * number of times while it is unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueBootstrap {

    private final LogQueueConsumer queue;
    private final ProcessorProperties properties;

    /**
     * @return the number of messages waiting in the queue
     * @throws QueueUnavailableException once every attempt has failed
     */
    public long awaitQueue() {
        int attempts = Math.max(1, properties.getConnectAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return queue.size();
            } catch (DataAccessException e) {
                if (attempt >= attempts) {
                    throw new QueueUnavailableException("Queue broker unreachable after " + attempts + " attempts", e);
                }
                log.warn("Queue broker connection failed, retrying in {}s... (attempt {}/{})",
                    properties.getConnectBackoff().toSeconds(), attempt, attempts);
                sleep();
            }
        }
    }

    private void sleep() {
        try {
            Thread.sleep(properties.getConnectBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the queue broker", e);
        }
    }
}
