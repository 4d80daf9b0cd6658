package com.logpipeline.common.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of {@link QueueMessage} payloads.
 */
@Component
public class QueueMessageCodec {

    private final ObjectMapper objectMapper;

    public QueueMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(QueueMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue message", e);
        }
    }

    /**
     * @throws MalformedMessageException if the payload is not a JSON object carrying
     *     a non-empty {@code line} and a {@code source_file}
     */
    public QueueMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("Empty payload");
        }
        QueueMessage message;
        try {
            message = objectMapper.readValue(payload, QueueMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Payload is not a queue message: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.getLine() == null || message.getLine().isEmpty()) {
            throw new MalformedMessageException("Payload has no line");
        }
        if (message.getSourceFile() == null) {
            throw new MalformedMessageException("Payload has no source_file");
        }
        return message;
    }
}
