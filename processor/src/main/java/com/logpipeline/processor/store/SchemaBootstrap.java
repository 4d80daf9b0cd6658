package com.logpipeline.processor.store;

import com.logpipeline.processor.config.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Ensures the schema on startup, retrying while the database is unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaBootstrap {

    private final LogStore store;
    private final StoreProperties properties;

    /**
     * @throws StoreUnavailableException once every attempt has failed
     */
    public void ensureSchema() {
        int attempts = Math.max(1, properties.getConnectAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                store.ensureSchema();
                return;
            } catch (DataAccessException | TransactionException e) {
                if (attempt >= attempts) {
                    throw new StoreUnavailableException(
                        "Database unreachable after " + attempts + " attempts", e);
                }
                log.warn("Database connection failed, retrying in {}s... (attempt {}/{})",
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
            throw new IllegalStateException("Interrupted while waiting for the database", e);
        }
    }
}
