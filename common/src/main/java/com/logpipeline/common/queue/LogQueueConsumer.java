package com.logpipeline.common.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Consumer side of the log queue. Dequeue leases a payload to the named consumer
 * instead of deleting it; the payload leaves the broker only once it is acknowledged
 * or dead-lettered.
 */
public interface LogQueueConsumer {

    /**
     * Waits up to {@code timeout} for the next payload. A zero timeout polls without
     * blocking. An empty result is a normal outcome, not a failure.
     */
    Optional<Delivery> dequeue(String consumer, Duration timeout);

    void acknowledge(Delivery delivery);

    /**
     * Returns the payload to the queue so that it is the next one handed out.
     */
    void release(Delivery delivery);

    void deadLetter(Delivery delivery, String reason);

    /**
     * Moves every payload still leased by {@code consumer} back to the queue.
     *
     * @return number of payloads moved
     */
    int recover(String consumer);

    long size();
}
