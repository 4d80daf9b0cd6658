package com.logpipeline.processor.store;

import com.logpipeline.processor.model.LogEntity;

import java.util.List;

/**
 * Relational store for indexed log rows.
 */
public interface LogStore {

    /**
     * Creates the table and indexes if they are missing. Safe to call repeatedly and
     * from several processes at once.
     */
    void ensureSchema();

    /**
     * Writes all rows atomically: either every row is visible afterwards or none is.
     */
    void writeAll(List<LogEntity> rows);

    default void write(LogEntity row) {
        writeAll(List.of(row));
    }
}
