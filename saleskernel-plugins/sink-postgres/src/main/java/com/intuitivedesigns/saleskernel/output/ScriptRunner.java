/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Executes one script file statement by statement on an existing connection.
 */
final class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    private ScriptRunner() {}

    /**
     * @return number of statements executed
     * @throws SchemaScriptException naming the script on read or execution failure
     */
    static int run(Connection connection, Path script) throws SchemaScriptException {
        final String name = script.getFileName().toString();
        final String text;
        try {
            text = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SchemaScriptException(name, e);
        }

        final List<String> statements = SqlScript.split(text);
        if (statements.isEmpty()) {
            log.warn("Script {} contains no statements.", name);
            return 0;
        }

        try (Statement st = connection.createStatement()) {
            for (String sql : statements) {
                log.debug("SQL [{}]: {}", name, sql);
                st.execute(sql);
            }
        } catch (SQLException e) {
            log.error("❌ Script {} failed: {}", name, e.getMessage());
            throw new SchemaScriptException(name, e);
        }
        return statements.size();
    }
}
