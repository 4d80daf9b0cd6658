package com.logpipeline.processor.service;

/**
 * The queue broker could not be reached within the configured number of attempts.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
