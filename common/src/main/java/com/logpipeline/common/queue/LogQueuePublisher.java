package com.logpipeline.common.queue;

import com.logpipeline.common.model.QueueMessage;

import java.util.List;

/**
 * Producer side of the log queue.
 */
public interface LogQueuePublisher {

    void enqueue(QueueMessage message);

    /**
     * Enqueues all messages in one round trip. Consumers receive them in list order.
     */
    void enqueueAll(List<QueueMessage> messages);
}
