/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.MicrometerMetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WarehousePopulatorTest {

    @TempDir
    Path dir;

    private MicrometerMetricsRuntime metrics;
    private DataSource ds;
    private WarehousePopulator populator;

    @BeforeEach
    void setUp() throws Exception {
        metrics = new MicrometerMetricsRuntime();
        ds = H2Database.dataSource(H2Database.newUrl());
        populator = new WarehousePopulator(metrics);

        H2Database.execute(ds, "CREATE TABLE sales (seller_name VARCHAR(100))");
        H2Database.execute(ds, "INSERT INTO sales VALUES ('ana'), ('bruno'), ('ana'), ('vendedor desconhecido')");
        H2Database.execute(ds, "CREATE TABLE dim_vendedor (nome_vendedor VARCHAR(100) UNIQUE)");

        Files.writeString(dir.resolve("01_dim_vendedor.sql"), """
                INSERT INTO dim_vendedor (nome_vendedor)
                SELECT DISTINCT s.seller_name
                FROM sales s
                WHERE s.seller_name <> 'vendedor desconhecido'
                  AND NOT EXISTS (SELECT 1 FROM dim_vendedor d WHERE d.nome_vendedor = s.seller_name);
                """);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private int populate(List<String> scripts) throws SQLException {
        return TransactionScope.execute(ds, metrics, scope -> populator.populate(scope, dir, scripts));
    }

    @Test
    void runsConfiguredScriptsAndSkipsMissingOnes() throws SQLException {
        int applied = populate(List.of("01_dim_vendedor.sql", "02_not_there.sql"));

        assertEquals(1, applied);
        assertEquals(2, H2Database.count(ds, "dim_vendedor"));
        assertEquals(1.0, metrics.count("warehouse.scripts.applied"));

        // re-running does not duplicate dimension rows
        populate(List.of("01_dim_vendedor.sql"));
        assertEquals(2, H2Database.count(ds, "dim_vendedor"));
    }

    @Test
    void missingDirectoryIsSkipped() throws SQLException {
        int applied = TransactionScope.execute(ds, metrics,
                scope -> populator.populate(scope, dir.resolve("absent"), List.of("01_dim_vendedor.sql")));

        assertEquals(0, applied);
        assertEquals(0, H2Database.count(ds, "dim_vendedor"));
    }

    @Test
    void failingScriptRollsBackEarlierOnesAndStops() throws Exception {
        Files.writeString(dir.resolve("02_broken.sql"), "INSERT INTO no_such_dimension VALUES (1);");
        Files.writeString(dir.resolve("03_after.sql"), "INSERT INTO dim_vendedor VALUES ('never');");

        SchemaScriptException ex = assertThrows(SchemaScriptException.class,
                () -> populate(List.of("01_dim_vendedor.sql", "02_broken.sql", "03_after.sql")));

        assertEquals("02_broken.sql", ex.script());
        assertEquals(0, H2Database.count(ds, "dim_vendedor"));
    }
}
