/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the analytical queries over the populated warehouse and logs a preview of each result.
 * Every {@code *.sql} file in the queries directory holds exactly one SELECT; files run in name order.
 */
public final class AnalyticsReport {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsReport.class);

    static final int PREVIEW_ROWS = 5;

    private final MetricsRuntime metrics;

    public AnalyticsReport(MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return rows per query file name, in execution order; empty when the directory is missing
     */
    public Map<String, List<Map<String, Object>>> runAll(TransactionScope scope, Path queriesDir) throws SQLException {
        Objects.requireNonNull(scope, "scope");

        final Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
        if (queriesDir == null || !Files.isDirectory(queriesDir)) {
            log.warn("Analytics queries directory {} not found. Skipping report.", queriesDir);
            return results;
        }

        log.info("📊 Running analytics queries from {}", queriesDir);
        for (Path query : SchemaProvisioner.discover(queriesDir)) {
            results.put(query.getFileName().toString(), run(scope, query));
        }
        log.info("✅ Analytics report finished: {} queries.", results.size());
        return results;
    }

    public List<Map<String, Object>> run(TransactionScope scope, Path query) throws SQLException {
        final String name = query.getFileName().toString();
        final List<String> statements;
        try {
            statements = SqlScript.split(Files.readString(query, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SchemaScriptException(name, e);
        }
        if (statements.size() != 1) {
            throw new SchemaScriptException(name,
                    new IllegalArgumentException("expected one query, found " + statements.size()));
        }

        final List<Map<String, Object>> rows = new ArrayList<>();
        try (Statement st = scope.connection().createStatement();
             ResultSet rs = st.executeQuery(statements.get(0))) {
            final ResultSetMetaData meta = rs.getMetaData();
            final int columns = meta.getColumnCount();
            while (rs.next()) {
                final Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
                }
                rows.add(row);
            }
        } catch (SQLException e) {
            log.error("❌ Query {} failed: {}", name, e.getMessage());
            throw new SchemaScriptException(name, e);
        }

        metrics.counter("analytics.queries.run");
        log.info("📊 {} ({} rows)", name, rows.size());
        rows.stream().limit(PREVIEW_ROWS).forEach(row -> log.info("    {}", row));
        return rows;
    }
}
