/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.CanonicalField;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validated connection and load settings for the relational side of the pipeline.
 * {@link #fromConfig(PipelineConfig)} fails before any connection is attempted.
 */
public record PostgresSettings(
        String jdbcUrl,
        String username,
        String password,
        String stagingTable,
        List<String> stagingColumns,
        int batchSize,
        long connectTimeoutMs,
        int poolSize,
        Path schemaDir,
        Path populateDir,
        List<String> populateScripts,
        Path queriesDir
) {

    // Config keys
    public static final String KEY_URL = "postgres.url";
    public static final String KEY_HOST = "postgres.host";
    public static final String KEY_PORT = "postgres.port";
    public static final String KEY_DATABASE = "postgres.database";
    public static final String KEY_USERNAME = "postgres.username";
    public static final String KEY_PASSWORD = "postgres.password";
    public static final String KEY_STAGING_TABLE = "postgres.staging.table";
    public static final String KEY_STAGING_COLUMNS = "postgres.staging.columns";
    public static final String KEY_BATCH_SIZE = "postgres.batch.size";
    public static final String KEY_CONNECT_TIMEOUT_MS = "postgres.connect.timeout.ms";
    public static final String KEY_POOL_SIZE = "postgres.pool.size";
    public static final String KEY_SCHEMA_DIR = "schema.scripts.dir";
    public static final String KEY_POPULATE_DIR = "populate.scripts.dir";
    public static final String KEY_POPULATE_SCRIPTS = "populate.scripts";
    public static final String KEY_QUERIES_DIR = "analytics.queries.dir";

    // Defaults
    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_STAGING_TABLE = "staging_produtos_ecommerce";
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 5000L;
    public static final int DEFAULT_POOL_SIZE = 2;
    public static final String DEFAULT_SCHEMA_DIR = "sql/schema";
    public static final String DEFAULT_POPULATE_DIR = "sql/populate";
    public static final List<String> DEFAULT_POPULATE_SCRIPTS = List.of(
            "01_populate_dim_tempo.sql",
            "02_populate_dim_local.sql",
            "03_populate_dim_vendedor.sql",
            "04_populate_dim_produto.sql",
            "05_populate_dim_pagamento.sql",
            "06_populate_fato_vendas.sql");

    // Hikari enforces a 250ms floor on connection timeouts
    private static final long MIN_CONNECT_TIMEOUT_MS = 250L;

    public PostgresSettings {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        SqlIdentifiers.quote(stagingTable);
        stagingColumns = List.copyOf(stagingColumns);
        if (stagingColumns.isEmpty()) {
            throw new IllegalArgumentException("Staging column list must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String c : stagingColumns) {
            SqlIdentifiers.quote(c);
            if (!seen.add(c)) {
                throw new IllegalArgumentException("Duplicate staging column: " + c);
            }
        }
        if (batchSize <= 0) throw new IllegalArgumentException("Batch size must be > 0");
        if (poolSize <= 0) throw new IllegalArgumentException("Pool size must be > 0");
        connectTimeoutMs = Math.max(MIN_CONNECT_TIMEOUT_MS, connectTimeoutMs);
        Objects.requireNonNull(schemaDir, "schemaDir");
        Objects.requireNonNull(populateDir, "populateDir");
        populateScripts = List.copyOf(populateScripts);
        // queriesDir may be null: no analytics report
    }

    public static PostgresSettings fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String url = resolveJdbcUrl(config);
        final String username = config.require(KEY_USERNAME);
        final String password = config.require(KEY_PASSWORD);

        return new PostgresSettings(
                url,
                username,
                password,
                config.getString(KEY_STAGING_TABLE, DEFAULT_STAGING_TABLE).trim(),
                config.getList(KEY_STAGING_COLUMNS, CanonicalField.columnNames()),
                config.getInt(KEY_BATCH_SIZE, DEFAULT_BATCH_SIZE),
                config.getLong(KEY_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS),
                config.getInt(KEY_POOL_SIZE, DEFAULT_POOL_SIZE),
                Path.of(config.getString(KEY_SCHEMA_DIR, DEFAULT_SCHEMA_DIR)),
                Path.of(config.getString(KEY_POPULATE_DIR, DEFAULT_POPULATE_DIR)),
                config.getList(KEY_POPULATE_SCRIPTS, DEFAULT_POPULATE_SCRIPTS),
                optionalPath(config, KEY_QUERIES_DIR));
    }

    private static Path optionalPath(PipelineConfig config, String key) {
        final String value = config.getString(key, null);
        return (value == null || value.isBlank()) ? null : Path.of(value.trim());
    }

    /**
     * An explicit {@code postgres.url} wins; otherwise host, port and database are required.
     */
    static String resolveJdbcUrl(PipelineConfig config) {
        final String explicit = config.getString(KEY_URL, null);
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        final String host = config.require(KEY_HOST);
        final String database = config.require(KEY_DATABASE);
        final int port = config.getInt(KEY_PORT, DEFAULT_PORT);
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Invalid " + KEY_PORT + ": " + port);
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    public boolean isPostgres() {
        return jdbcUrl.startsWith("jdbc:postgresql:");
    }

    @Override
    public String toString() {
        return "PostgresSettings[url=" + jdbcUrl + ", user=" + username + ", table=" + stagingTable
                + ", columns=" + stagingColumns.size() + ", batchSize=" + batchSize + "]";
    }
}
