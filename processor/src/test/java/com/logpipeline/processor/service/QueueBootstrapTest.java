package com.logpipeline.processor.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.logpipeline.common.queue.LogQueueConsumer;
import com.logpipeline.processor.config.ProcessorProperties;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class QueueBootstrapTest {

    private LogQueueConsumer queue;
    private ProcessorProperties properties;

    @BeforeEach
    void setUp() {
        queue = mock(LogQueueConsumer.class);
        properties = new ProcessorProperties();
        properties.setConnectBackoff(Duration.ZERO);
    }

    @Test
    void returnsQueueDepthOnceTheBrokerAnswers() {
        when(queue.size())
            .thenThrow(new RedisConnectionFailureException("refused"))
            .thenReturn(42L);

        assertEquals(42L, new QueueBootstrap(queue, properties).awaitQueue());
        verify(queue, times(2)).size();
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        when(queue.size()).thenThrow(new RedisConnectionFailureException("refused"));

        QueueUnavailableException e = assertThrows(QueueUnavailableException.class,
            () -> new QueueBootstrap(queue, properties).awaitQueue());

        assertEquals("Queue broker unreachable after 5 attempts", e.getMessage());
        verify(queue, times(5)).size();
    }

    @Test
    void otherFailuresAreNotRetried() {
        when(queue.size()).thenThrow(new IllegalStateException("bug"));

        assertThrows(IllegalStateException.class, () -> new QueueBootstrap(queue, properties).awaitQueue());
        verify(queue, times(1)).size();
    }
}
