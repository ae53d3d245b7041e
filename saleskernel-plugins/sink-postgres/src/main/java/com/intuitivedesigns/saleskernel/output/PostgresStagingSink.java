/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.CanonicalRecord;
import com.intuitivedesigns.saleskernel.core.OutputSink;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Relational sink of the pipeline.
 * Features:
 * - HikariCP connection pool (auto-commit off, no connection until first use)
 * - {@link #prepare()}: schema scripts in one transaction
 * - {@link #write(List)}: truncate + bulk load + commit in one transaction
 * - {@link #complete()}: warehouse population scripts in one transaction, then the optional analytics report
 */
public final class PostgresStagingSink implements OutputSink<CanonicalRecord> {

    private static final Logger log = LoggerFactory.getLogger(PostgresStagingSink.class);

    private final DataSource dataSource;
    private final PostgresSettings settings;
    private final MetricsRuntime metrics;
    private final StagingLoader loader;
    private final SchemaProvisioner provisioner;
    private final WarehousePopulator populator;
    private final AnalyticsReport report;

    public PostgresStagingSink(DataSource dataSource, PostgresSettings settings, MetricsRuntime metrics) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.loader = new StagingLoader(settings.batchSize(), metrics);
        this.provisioner = new SchemaProvisioner(metrics);
        this.populator = new WarehousePopulator(metrics);
        this.report = new AnalyticsReport(metrics);
    }

    public static PostgresStagingSink fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        // Validates everything before the pool exists
        final PostgresSettings settings = PostgresSettings.fromConfig(config);
        final HikariDataSource ds = new HikariDataSource(hikariConfig(settings));

        log.info("✅ PostgresStagingSink Active. {}", settings);
        return new PostgresStagingSink(ds, settings, metrics);
    }

    static HikariConfig hikariConfig(PostgresSettings settings) {
        final HikariConfig hikari = new HikariConfig();
        String url = settings.jdbcUrl();
        if (settings.isPostgres() && !url.contains("reWriteBatchedInserts")) {
            // Lets the driver collapse executeBatch() into multi-row inserts
            url += (url.contains("?") ? "&" : "?") + "reWriteBatchedInserts=true";
        }
        hikari.setJdbcUrl(url);
        hikari.setUsername(settings.username());
        hikari.setPassword(settings.password());
        hikari.setPoolName("saleskernel-staging");

        hikari.setMaximumPoolSize(settings.poolSize());
        hikari.setMinimumIdle(0);
        hikari.setConnectionTimeout(settings.connectTimeoutMs());
        hikari.setAutoCommit(false); // We control transactions manually
        hikari.setInitializationFailTimeout(-1); // Connect lazily; failures surface per stage

        if (settings.isPostgres()) {
            hikari.addDataSourceProperty("cachePrepStmts", "true");
            hikari.addDataSourceProperty("prepStmtCacheSize", "250");
            hikari.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        }
        return hikari;
    }

    public PostgresSettings settings() {
        return settings;
    }

    @Override
    public void prepare() throws SQLException {
        TransactionScope.execute(dataSource, metrics,
                scope -> provisioner.apply(scope, settings.schemaDir()));
    }

    @Override
    public int write(List<CanonicalRecord> batch) throws SQLException {
        if (batch == null || batch.isEmpty()) {
            log.warn("No records to load. Staging table {} left untouched.", settings.stagingTable());
            return 0;
        }

        final int loaded = TransactionScope.execute(dataSource, metrics, scope -> {
            loader.truncate(scope, settings.stagingTable());
            return loader.bulkLoad(scope, settings.stagingTable(), batch, settings.stagingColumns());
        });
        log.info("✅ Staging load committed: {} rows in {}", loaded, settings.stagingTable());
        return loaded;
    }

    @Override
    public void complete() throws SQLException {
        TransactionScope.execute(dataSource, metrics,
                scope -> populator.populate(scope, settings.populateDir(), settings.populateScripts()));

        if (settings.queriesDir() == null) {
            return;
        }
        // Warehouse already committed; report failures are logged only
        try {
            TransactionScope.execute(dataSource, metrics, scope -> report.runAll(scope, settings.queriesDir()));
        } catch (SQLException e) {
            metrics.counter("analytics.queries.failed");
            log.warn("⚠️ Analytics report failed. Warehouse population is unaffected.", e);
        }
    }

    @Override
    public String id() {
        return PostgresSinkPlugin.ID;
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
        log.info("PostgresStagingSink Closed.");
    }
}
