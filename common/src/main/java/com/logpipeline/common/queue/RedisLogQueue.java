package com.logpipeline.common.queue;

import com.logpipeline.common.model.QueueMessage;
import com.logpipeline.common.model.QueueMessageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Log queue backed by a Redis list. Producers LPUSH, consumers BRPOPLPUSH into a
 * per-consumer processing list, which is the lease.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisLogQueue implements LogQueuePublisher, LogQueueConsumer {

    private final StringRedisTemplate redisTemplate;
    private final QueueMessageCodec codec;
    private final QueueProperties properties;

    @Override
    public void enqueue(QueueMessage message) {
        lists().leftPush(properties.getName(), codec.encode(message));
    }

    @Override
    public void enqueueAll(List<QueueMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        // LPUSH with several values inserts them head-first in argument order, so the
        // first message ends up nearest the tail and is popped first.
        List<String> payloads = messages.stream().map(codec::encode).toList();
        lists().leftPushAll(properties.getName(), payloads);
    }

    @Override
    public Optional<Delivery> dequeue(String consumer, Duration timeout) {
        String processingKey = properties.processingKey(consumer);
        String payload;
        if (timeout.isZero() || timeout.isNegative()) {
            payload = lists().rightPopAndLeftPush(properties.getName(), processingKey);
        } else {
            payload = lists().rightPopAndLeftPush(properties.getName(), processingKey,
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return Optional.ofNullable(payload).map(p -> new Delivery(consumer, p));
    }

    @Override
    public void acknowledge(Delivery delivery) {
        lists().remove(properties.processingKey(delivery.consumer()), 1, delivery.payload());
    }

    @Override
    public void release(Delivery delivery) {
        // Push back before dropping the lease: a crash in between duplicates, never loses.
        lists().rightPush(properties.getName(), delivery.payload());
        lists().remove(properties.processingKey(delivery.consumer()), 1, delivery.payload());
    }

    @Override
    public void deadLetter(Delivery delivery, String reason) {
        log.debug("Dead-lettering payload from {} ({})", delivery.consumer(), reason);
        lists().leftPush(properties.deadLetterKey(), delivery.payload());
        lists().remove(properties.processingKey(delivery.consumer()), 1, delivery.payload());
    }

    @Override
    public int recover(String consumer) {
        String processingKey = properties.processingKey(consumer);
        int moved = 0;
        while (lists().rightPopAndLeftPush(processingKey, properties.getName()) != null) {
            moved++;
        }
        if (moved > 0) {
            log.info("Recovered {} unacknowledged messages for consumer {}", moved, consumer);
        }
        return moved;
    }

    @Override
    public long size() {
        Long size = lists().size(properties.getName());
        return size == null ? 0 : size;
    }

    private ListOperations<String, String> lists() {
        return redisTemplate.opsForList();
    }
}
