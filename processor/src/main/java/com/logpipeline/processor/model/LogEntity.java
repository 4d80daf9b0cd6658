package com.logpipeline.processor.model;

import com.logpipeline.common.model.QueueMessage;
import com.logpipeline.processor.parser.ParsedRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One indexed log line in the {@code logs} table. The table and its indexes are
 * created by {@link com.logpipeline.processor.store.PostgresLogStore#ensureSchema()}.
 * {@code timestamp} keeps the original token; {@code indexed_at} is filled in by the database.
 */
@Entity
@Table(name = "logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_type", length = 50)
    private String logType;

    @Column(name = "raw_line", columnDefinition = "TEXT")
    private String rawLine;

    @Column(name = "timestamp", columnDefinition = "TEXT")
    private String timestamp;

    @Column(name = "source_file", length = 255)
    private String sourceFile;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "parsed_data", columnDefinition = "JSONB")
    private Map<String, String> parsedData;

    @Column(name = "indexed_at", insertable = false, updatable = false)
    private LocalDateTime indexedAt;

    /**
     * Builds the row for a parsed queue message. {@code parsed_data} holds every
     * extracted field plus {@code log_type}, which always agrees with the column.
     */
    public static LogEntity of(QueueMessage message, ParsedRecord record) {
        Map<String, String> parsedData = new LinkedHashMap<>(record.fields());
        parsedData.put("log_type", record.logType().value());

        LogEntity entity = new LogEntity();
        entity.setLogType(record.logType().value());
        entity.setRawLine(message.getLine());
        entity.setTimestamp(record.timestamp());
        entity.setSourceFile(message.getSourceFile());
        entity.setParsedData(parsedData);
        return entity;
    }
}
