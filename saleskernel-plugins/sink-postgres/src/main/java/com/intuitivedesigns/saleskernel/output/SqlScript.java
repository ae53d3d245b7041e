/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a SQL script into individual statements.
 *
 * <p>A {@code ;} ends a statement only outside single-quoted literals, double-quoted
 * identifiers, dollar-quoted bodies ({@code $$ ... $$}, {@code $tag$ ... $tag$}) and
 * comments. Comments are kept in the statement text; statements that are blank or
 * comment-only are dropped.</p>
 */
public final class SqlScript {

    private SqlScript() {}

    public static List<String> split(String script) {
        if (script == null || script.isBlank()) return List.of();

        final List<String> statements = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        boolean hasCode = false;

        final int n = script.length();
        int i = 0;
        while (i < n) {
            final char c = script.charAt(i);

            if (c == '-' && i + 1 < n && script.charAt(i + 1) == '-') {
                int end = script.indexOf('\n', i);
                end = (end < 0) ? n : end;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < n && script.charAt(i + 1) == '*') {
                int end = script.indexOf("*/", i + 2);
                end = (end < 0) ? n : end + 2;
                current.append(script, i, end);
                i = end;
                continue;
            }
            if (c == '\'' || c == '"') {
                final int end = closingQuote(script, i, c);
                current.append(script, i, end);
                hasCode = true;
                i = end;
                continue;
            }
            if (c == '$') {
                final String tag = dollarTag(script, i);
                if (tag != null) {
                    int close = script.indexOf(tag, i + tag.length());
                    final int end = (close < 0) ? n : close + tag.length();
                    current.append(script, i, end);
                    hasCode = true;
                    i = end;
                    continue;
                }
            }
            if (c == ';') {
                flush(statements, current, hasCode);
                hasCode = false;
                i++;
                continue;
            }

            current.append(c);
            if (!Character.isWhitespace(c)) hasCode = true;
            i++;
        }
        flush(statements, current, hasCode);
        return Collections.unmodifiableList(statements);
    }

    // --- Helpers ---

    private static void flush(List<String> out, StringBuilder current, boolean hasCode) {
        final String stmt = current.toString().strip();
        if (hasCode && !stmt.isEmpty()) {
            out.add(stmt);
        }
        current.setLength(0);
    }

    // Index just past the closing quote; a doubled quote is an escaped one.
    private static int closingQuote(String s, int open, char quote) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    // "$tag$" starting at i, or null when the '$' does not open a dollar quote (e.g. "$1").
    private static String dollarTag(String s, int i) {
        int j = i + 1;
        while (j < s.length()) {
            final char c = s.charAt(j);
            if (c == '$') {
                return s.substring(i, j + 1);
            }
            final boolean valid = (j == i + 1)
                    ? (Character.isLetter(c) || c == '_')
                    : (Character.isLetterOrDigit(c) || c == '_');
            if (!valid) return null;
            j++;
        }
        return null;
    }
}
