package com.logpipeline.processor.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.logpipeline.processor.config.StoreProperties;
import com.logpipeline.processor.model.LogEntity;
import com.logpipeline.processor.repository.LogRepository;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class PostgresLogStoreTest {

    private LogRepository repository;
    private JdbcTemplate jdbcTemplate;
    private PlatformTransactionManager transactionManager;
    private StoreProperties properties;
    private PostgresLogStore store;
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = mock(LogRepository.class);
        jdbcTemplate = mock(JdbcTemplate.class);
        transactionManager = mock(PlatformTransactionManager.class);
        doAnswer(invocation -> executed.add(invocation.getArgument(0))).when(jdbcTemplate).execute(anyString());
        properties = new StoreProperties();
        store = new PostgresLogStore(repository, jdbcTemplate, new TransactionTemplate(transactionManager), properties);
    }

    @Test
    void ensureSchemaTakesAdvisoryLockBeforeDdl() {
        store.ensureSchema();

        assertTrue(executed.get(0).startsWith("SELECT pg_advisory_xact_lock("));
        assertEquals(PostgresLogStore.CREATE_TABLE, executed.get(1));
        assertEquals(1 + 1 + 2 + 4, executed.size());
        verify(transactionManager).commit(any());
    }

    @Test
    void everyDdlStatementIsCreateIfAbsent() {
        for (String statement : store.schemaStatements()) {
            assertTrue(statement.startsWith("CREATE TABLE IF NOT EXISTS")
                || statement.startsWith("CREATE INDEX IF NOT EXISTS"), statement);
        }
    }

    @Test
    void ensureSchemaTwiceIssuesTheSameStatements() {
        store.ensureSchema();
        List<String> first = new ArrayList<>(executed);
        executed.clear();

        store.ensureSchema();

        assertEquals(first, executed);
    }

    @Test
    void tableKeepsOriginalTimestampAsText() {
        assertTrue(PostgresLogStore.CREATE_TABLE.contains("timestamp TEXT"));
        assertTrue(PostgresLogStore.CREATE_TABLE.contains("parsed_data JSONB"));
        assertTrue(PostgresLogStore.CREATE_TABLE.contains("indexed_at TIMESTAMP DEFAULT NOW()"));
    }

    @Test
    void auxiliaryIndexesCanBeDisabled() {
        properties.setAuxiliaryIndexes(false);

        assertEquals(3, store.schemaStatements().size());
    }

    @Test
    void writeAllSavesBatchInOneTransaction() {
        List<LogEntity> rows = List.of(new LogEntity(), new LogEntity());

        store.writeAll(rows);

        verify(repository).saveAll(rows);
        verify(transactionManager).commit(any());
    }

    @Test
    void writeDelegatesToSingleRowBatch() {
        LogEntity row = new LogEntity();

        store.write(row);

        verify(repository).saveAll(List.of(row));
    }

    @Test
    void emptyBatchTouchesNothing() {
        store.writeAll(List.of());

        verify(repository, never()).saveAll(anyList());
        verifyNoInteractions(transactionManager);
    }
}
