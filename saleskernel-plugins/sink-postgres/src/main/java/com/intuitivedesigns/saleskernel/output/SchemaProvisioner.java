/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Applies every {@code *.sql} file of a directory, in file-name order, inside the caller's transaction.
 *
 * <p>Scripts are expected to be idempotent ({@code CREATE ... IF NOT EXISTS}). The first failing
 * script stops the run; the ones after it are not executed. A missing or empty directory is a
 * warning, not an error.</p>
 */
public final class SchemaProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SchemaProvisioner.class);

    private final MetricsRuntime metrics;

    public SchemaProvisioner(MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return number of scripts applied
     * @throws SchemaScriptException for the first script that fails
     */
    public int apply(TransactionScope scope, Path schemaDir) throws SQLException {
        Objects.requireNonNull(scope, "scope");
        final List<Path> scripts = discover(schemaDir);
        if (scripts.isEmpty()) {
            return 0;
        }

        log.info("Applying {} schema scripts from {}", scripts.size(), schemaDir);
        int applied = 0;
        for (Path script : scripts) {
            final int statements = ScriptRunner.run(scope.connection(), script);
            applied++;
            metrics.counter("schema.scripts.applied");
            log.info("  ✔ {} ({} statements)", script.getFileName(), statements);
        }
        log.info("✅ Schema ready: {} scripts applied.", applied);
        return applied;
    }

    static List<Path> discover(Path dir) throws SchemaScriptException {
        if (dir == null || !Files.isDirectory(dir)) {
            log.warn("Schema directory {} not found. Assuming schema already exists.", dir);
            return List.of();
        }
        final List<Path> scripts;
        try (Stream<Path> files = Files.list(dir)) {
            scripts = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".sql"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SchemaScriptException(dir.toString(), e);
        }
        if (scripts.isEmpty()) {
            log.warn("No .sql scripts found in {}.", dir);
        }
        return scripts;
    }
}
