package com.logpipeline.processor.store;

/**
 * The store could not be reached within the configured number of attempts.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
