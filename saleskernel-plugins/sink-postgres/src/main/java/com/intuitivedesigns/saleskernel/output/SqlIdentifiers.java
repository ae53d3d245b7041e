/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import java.util.List;
import java.util.StringJoiner;

/**
 * Quoting for table and column names that are concatenated into SQL text.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {}

    /**
     * Wraps {@code name} in double quotes, doubling any embedded quote.
     * Quoted names are case-sensitive and may be reserved words.
     *
     * @throws IllegalArgumentException for a null or blank name
     */
    public static String quote(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("SQL identifier must not be blank");
        }
        if (name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("SQL identifier must not contain NUL characters");
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    public static String quotedList(List<String> names) {
        StringJoiner j = new StringJoiner(", ");
        for (String n : names) {
            j.add(quote(n));
        }
        return j.toString();
    }
}
