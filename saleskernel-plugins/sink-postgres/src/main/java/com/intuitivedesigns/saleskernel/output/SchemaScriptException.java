/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import java.sql.SQLException;

/**
 * A schema or population script could not be read or failed to execute.
 */
public class SchemaScriptException extends SQLException {

    private final String script;

    public SchemaScriptException(String script, Throwable cause) {
        super("Script '" + script + "' failed: " + (cause == null ? "unknown error" : cause.getMessage()),
                (cause instanceof SQLException sql) ? sql.getSQLState() : null,
                cause);
        this.script = script;
    }

    public String script() {
        return script;
    }
}
