/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void environmentAliasesOverrideFileValues(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("sk.properties");
        Files.writeString(file, "postgres.host=file-host\npostgres.port=5433\nsink.type=POSTGRES\n");

        PipelineConfig config = PipelineConfig.load(file, Map.of(
                "POSTGRES_HOST", "env-host",
                "API_BASE_URL", "http://api.local/sales",
                "UNRELATED", "ignored"));

        assertEquals("env-host", config.getString("postgres.host", null));
        assertEquals(5433, config.getInt("postgres.port", 5432));
        assertEquals("http://api.local/sales", config.getString("source.rest.url", null));
        assertEquals("POSTGRES", config.getString("sink.type", null));
        assertFalse(config.hasPath("UNRELATED"));
    }

    @Test
    void blankEnvironmentValuesDoNotOverride(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("sk.properties");
        Files.writeString(file, "postgres.database=sales\n");

        PipelineConfig config = PipelineConfig.load(file, Map.of("POSTGRES_DB", "  "));

        assertEquals("sales", config.getString("postgres.database", null));
    }

    @Test
    void loadWithoutFileUsesEnvironmentOnly() {
        PipelineConfig config = PipelineConfig.load(null, Map.of("MONGO_URI", "mongodb://localhost:27017"));

        assertEquals("mongodb://localhost:27017", config.getString("mongodb.uri", null));
        assertEquals(1, config.keys().size());
    }

    @Test
    void requireRejectsMissingAndBlankValues() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of("postgres.host", "  "));

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> config.require("postgres.user"));
        assertTrue(missing.getMessage().contains("postgres.user"));

        IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
                () -> config.require("postgres.host"));
        assertTrue(blank.getMessage().contains("Blank"));
    }

    @Test
    void typedAccessorsFallBackOnMalformedValues() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "postgres.batch.size", "lots",
                "source.rest.timeout.ms", "2500",
                "metrics.enabled", "false"));

        assertEquals(1000, config.getInt("postgres.batch.size", 1000));
        assertEquals(2500L, config.getLong("source.rest.timeout.ms", 10_000L));
        assertFalse(config.getBoolean("metrics.enabled", true));
    }

    @Test
    void listsAreTrimmedAndBlankEntriesDropped() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of("populate.scripts", " a.sql, ,b.sql ,"));

        assertEquals(List.of("a.sql", "b.sql"), config.getList("populate.scripts", List.of()));
        assertEquals(List.of("x"), config.getList("missing", List.of("x")));
    }

    @Test
    void withReturnsModifiedCopy() {
        PipelineConfig original = PipelineConfig.fromMap(Map.of("sink.type", "POSTGRES"));
        PipelineConfig changed = original.with("sink.type", "OTHER");

        assertEquals("POSTGRES", original.getString("sink.type", null));
        assertEquals("OTHER", changed.getString("sink.type", null));
    }
}
