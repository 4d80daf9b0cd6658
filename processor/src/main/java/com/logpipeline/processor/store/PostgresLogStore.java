package com.logpipeline.processor.store;

import com.logpipeline.processor.config.StoreProperties;
import com.logpipeline.processor.model.LogEntity;
import com.logpipeline.processor.repository.LogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL store. Rows go through JPA in one transaction per batch; the schema is
 * managed with plain DDL under an advisory lock so concurrent processors can start together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostgresLogStore implements LogStore {

    /** Key for {@code pg_advisory_xact_lock}, shared by every process bootstrapping the schema. */
    static final long SCHEMA_LOCK_KEY = 0x6c6f67735f6462L;

    static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS logs ("
        + "id SERIAL PRIMARY KEY, "
        + "log_type VARCHAR(50), "
        + "raw_line TEXT, "
        + "timestamp TEXT, "
        + "source_file VARCHAR(255), "
        + "parsed_data JSONB, "
        + "indexed_at TIMESTAMP DEFAULT NOW())";

    static final List<String> BASE_INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_logs_log_type ON logs (log_type)",
        "CREATE INDEX IF NOT EXISTS idx_logs_timestamp ON logs (timestamp)");

    static final List<String> AUXILIARY_INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_logs_fw_src ON logs ((parsed_data->>'src'), timestamp) WHERE log_type = 'firewall'",
        "CREATE INDEX IF NOT EXISTS idx_logs_fw_dst_port ON logs ((parsed_data->>'dst_port')) WHERE log_type = 'firewall'",
        "CREATE INDEX IF NOT EXISTS idx_logs_dns_domain ON logs ((parsed_data->>'query_domain')) WHERE log_type = 'dns'",
        "CREATE INDEX IF NOT EXISTS idx_logs_auth_source ON logs ((parsed_data->>'source_ip'), (parsed_data->>'status')) WHERE log_type = 'auth'");

    private final LogRepository logRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final StoreProperties properties;

    @Override
    public void ensureSchema() {
        List<String> statements = schemaStatements();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.execute("SELECT pg_advisory_xact_lock(" + SCHEMA_LOCK_KEY + ")");
            statements.forEach(jdbcTemplate::execute);
        });
        log.info("Ensured 'logs' table and {} indexes", statements.size() - 1);
    }

    List<String> schemaStatements() {
        List<String> statements = new ArrayList<>();
        statements.add(CREATE_TABLE);
        statements.addAll(BASE_INDEXES);
        if (properties.isAuxiliaryIndexes()) {
            statements.addAll(AUXILIARY_INDEXES);
        }
        return statements;
    }

    @Override
    public void writeAll(List<LogEntity> rows) {
        if (rows.isEmpty()) {
            return;
        }
        transactionTemplate.executeWithoutResult(status -> logRepository.saveAll(rows));
    }
}
