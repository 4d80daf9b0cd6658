package com.logpipeline.common.model;

/**
 * Raised when a queue payload cannot be decoded into a {@link QueueMessage}.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
