/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.NoopMetricsRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class SchemaProvisionerTest {

    @TempDir
    Path dir;

    private DataSource ds;
    private SchemaProvisioner provisioner;

    @BeforeEach
    void setUp() {
        ds = H2Database.dataSource(H2Database.newUrl());
        provisioner = new SchemaProvisioner(NoopMetricsRuntime.INSTANCE);
    }

    private int apply(Path schemaDir) throws SQLException {
        return TransactionScope.execute(ds, NoopMetricsRuntime.INSTANCE, scope -> provisioner.apply(scope, schemaDir));
    }

    @Test
    void appliesSqlFilesInNameOrder() throws Exception {
        // 02 depends on 01
        Files.writeString(dir.resolve("02_dim_b.sql"),
                "CREATE TABLE IF NOT EXISTS dim_b (id INT REFERENCES dim_a(id));");
        Files.writeString(dir.resolve("01_dim_a.sql"),
                "-- base table\nCREATE TABLE IF NOT EXISTS dim_a (id INT PRIMARY KEY);\n"
                        + "COMMENT ON TABLE dim_a IS 'a; b';");
        Files.writeString(dir.resolve("README.txt"), "not sql");

        assertEquals(2, apply(dir));
        assertTrue(H2Database.tableExists(ds, "dim_a"));
        assertTrue(H2Database.tableExists(ds, "dim_b"));

        // idempotent
        assertEquals(2, apply(dir));
    }

    @Test
    void missingOrEmptyDirectoryIsANoOp() throws Exception {
        assertEquals(0, apply(dir.resolve("absent")));
        assertEquals(0, apply(dir));
    }

    @Test
    void failingScriptStopsTheRemainingOnes() throws IOException {
        Files.writeString(dir.resolve("01_ok.sql"), "CREATE TABLE IF NOT EXISTS ok_table (id INT);");
        Files.writeString(dir.resolve("02_broken.sql"), "CREATE TABLE broken (;");
        Files.writeString(dir.resolve("03_never.sql"), "CREATE TABLE never_created (id INT);");

        SchemaScriptException ex = assertThrows(SchemaScriptException.class, () -> apply(dir));

        assertEquals("02_broken.sql", ex.script());
        assertTrue(ex.getMessage().contains("02_broken.sql"));
        assertInstanceOf(SQLException.class, ex.getCause());
    }

    @Test
    void scriptsAfterAFailureAreNotExecuted() throws Exception {
        Files.writeString(dir.resolve("01_broken.sql"), "THIS IS NOT SQL;");
        Files.writeString(dir.resolve("02_never.sql"), "CREATE TABLE never_created (id INT);");

        assertThrows(SchemaScriptException.class, () -> apply(dir));

        assertFalse(H2Database.tableExists(ds, "never_created"));
    }
}
