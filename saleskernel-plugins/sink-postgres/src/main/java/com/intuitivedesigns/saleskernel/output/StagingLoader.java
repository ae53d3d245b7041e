/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.core.CanonicalField;
import com.intuitivedesigns.saleskernel.core.CanonicalRecord;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Truncate-and-reload of the staging table inside a caller-owned {@link TransactionScope}.
 * Neither operation commits.
 */
public final class StagingLoader {

    private static final Logger log = LoggerFactory.getLogger(StagingLoader.class);

    private final int batchSize;
    private final MetricsRuntime metrics;

    public StagingLoader(int batchSize, MetricsRuntime metrics) {
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be > 0");
        this.batchSize = batchSize;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public void truncate(TransactionScope scope, String table) throws SQLException {
        final String sql = "TRUNCATE TABLE " + SqlIdentifiers.quote(table);
        log.debug("SQL: {}", sql);
        try (Statement st = scope.connection().createStatement()) {
            st.execute(sql);
        } catch (SQLException e) {
            log.error("❌ Failed to truncate {}: {}", table, e.getMessage());
            throw e;
        }
        scope.advance(TransactionState.TRUNCATED);
        log.info("Table {} truncated.", table);
    }

    /**
     * Inserts {@code records} with one positional parameter per entry of {@code columns}.
     * A column with no counterpart in {@link CanonicalRecord} is bound as NULL.
     * Empty input is a successful no-op.
     *
     * @return number of rows inserted
     * @throws SQLException rethrown after logging so the enclosing scope rolls back
     */
    public int bulkLoad(TransactionScope scope, String table, List<CanonicalRecord> records, List<String> columns)
            throws SQLException {
        Objects.requireNonNull(columns, "columns");
        if (records == null || records.isEmpty()) {
            log.info("No records to load into {}.", table);
            return 0;
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Column list must not be empty");
        }

        final String sql = insertSql(table, columns);
        log.debug("SQL: {}", sql);

        final int[] sqlTypes = new int[columns.size()];
        for (int i = 0; i < sqlTypes.length; i++) {
            sqlTypes[i] = sqlType(columns.get(i));
        }

        final long start = System.nanoTime();
        int rowIndex = 0;
        try (PreparedStatement ps = scope.connection().prepareStatement(sql)) {
            int pending = 0;
            for (CanonicalRecord record : records) {
                for (int i = 0; i < sqlTypes.length; i++) {
                    bind(ps, i + 1, record == null ? null : record.get(columns.get(i)), sqlTypes[i]);
                }
                ps.addBatch();
                rowIndex++;
                if (++pending == batchSize) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        } catch (SQLException e) {
            metrics.counter("staging.load.errors");
            log.error("❌ Bulk load into {} failed near row {} of {}: {}",
                    table, rowIndex, records.size(), e.getMessage());
            throw e;
        }

        scope.advance(TransactionState.LOADED);
        metrics.counter("staging.rows.loaded", records.size());
        metrics.timer("staging.load.latency", (System.nanoTime() - start) / 1_000_000L);
        log.info("Loaded {} rows into {}.", records.size(), table);
        return records.size();
    }

    // --- Helpers ---

    static String insertSql(String table, List<String> columns) {
        final StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (int i = 0; i < columns.size(); i++) {
            placeholders.add("?");
        }
        return "INSERT INTO " + SqlIdentifiers.quote(table)
                + " (" + SqlIdentifiers.quotedList(columns) + ") VALUES " + placeholders;
    }

    private static int sqlType(String column) {
        return CanonicalField.fromColumn(column).map(f -> switch (f) {
            case PRICE_CENTS, SHIPPING_COST_CENTS, PURCHASE_RATING, INSTALLMENTS_QUANTITY -> Types.INTEGER;
            case LATITUDE, LONGITUDE -> Types.DOUBLE;
            case PURCHASE_DATE -> Types.DATE;
            case ETL_LOAD_TIMESTAMP -> Types.TIMESTAMP;
            default -> Types.VARCHAR;
        }).orElse(Types.NULL);
    }

    private static void bind(PreparedStatement ps, int index, Object value, int sqlType) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
        } else if (value instanceof Instant instant) {
            // TIMESTAMP WITHOUT TIME ZONE holds UTC wall-clock time
            ps.setObject(index, LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        } else {
            ps.setObject(index, value);
        }
    }
}
