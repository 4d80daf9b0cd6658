package com.logpipeline.processor.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.logpipeline.processor.config.StoreProperties;
import com.logpipeline.processor.model.LogEntity;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.CannotCreateTransactionException;

class SchemaBootstrapTest {

    private StoreProperties properties;

    @BeforeEach
    void setUp() {
        properties = new StoreProperties();
        properties.setConnectBackoff(Duration.ZERO);
    }

    @Test
    void succeedsOnceTheDatabaseComesUp() {
        FlakyStore store = new FlakyStore(2);

        new SchemaBootstrap(store, properties).ensureSchema();

        assertEquals(3, store.attempts);
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        FlakyStore store = new FlakyStore(Integer.MAX_VALUE);

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
            () -> new SchemaBootstrap(store, properties).ensureSchema());

        assertEquals(5, store.attempts);
        assertEquals("Database unreachable after 5 attempts", e.getMessage());
        assertInstanceOf(CannotCreateTransactionException.class, e.getCause());
    }

    @Test
    void nonConnectionErrorsAreNotRetried() {
        LogStore broken = new LogStore() {
            @Override
            public void ensureSchema() {
                throw new IllegalStateException("bug");
            }

            @Override
            public void writeAll(List<LogEntity> rows) {
            }
        };

        assertThrows(IllegalStateException.class, () -> new SchemaBootstrap(broken, properties).ensureSchema());
    }

    @Test
    void connectionFailuresFromJdbcAreRetried() {
        properties.setConnectAttempts(2);
        LogStore store = new LogStore() {
            int calls;

            @Override
            public void ensureSchema() {
                if (calls++ == 0) {
                    throw new CannotGetJdbcConnectionException("refused");
                }
            }

            @Override
            public void writeAll(List<LogEntity> rows) {
            }
        };

        new SchemaBootstrap(store, properties).ensureSchema();
    }

    private static final class FlakyStore implements LogStore {
        private final int failures;
        private int attempts;

        FlakyStore(int failures) {
            this.failures = failures;
        }

        @Override
        public void ensureSchema() {
            attempts++;
            if (attempts <= failures) {
                throw new CannotCreateTransactionException("Could not open JPA EntityManager for transaction");
            }
        }

        @Override
        public void writeAll(List<LogEntity> rows) {
        }
    }
}
