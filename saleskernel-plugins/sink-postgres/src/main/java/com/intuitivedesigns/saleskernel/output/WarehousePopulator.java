/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Runs the dimension and fact population scripts, in the configured order, from the staging table.
 * Missing scripts are skipped with a warning; a failing script stops the rest.
 */
public final class WarehousePopulator {

    private static final Logger log = LoggerFactory.getLogger(WarehousePopulator.class);

    private final MetricsRuntime metrics;

    public WarehousePopulator(MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return number of scripts applied
     */
    public int populate(TransactionScope scope, Path scriptsDir, List<String> scriptNames) throws SQLException {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(scriptNames, "scriptNames");

        if (scriptsDir == null || !Files.isDirectory(scriptsDir)) {
            log.warn("Population scripts directory {} not found. Skipping warehouse population.", scriptsDir);
            return 0;
        }

        log.info("Populating data warehouse from {}", scriptsDir);
        int applied = 0;
        for (String name : scriptNames) {
            final Path script = scriptsDir.resolve(name);
            if (!Files.isRegularFile(script)) {
                log.warn("Population script {} not found. Skipping.", name);
                continue;
            }
            ScriptRunner.run(scope.connection(), script);
            applied++;
            metrics.counter("warehouse.scripts.applied");
            log.info("  ✔ {}", name);
        }
        log.info("✅ Warehouse population finished: {}/{} scripts applied.", applied, scriptNames.size());
        return applied;
    }
}
