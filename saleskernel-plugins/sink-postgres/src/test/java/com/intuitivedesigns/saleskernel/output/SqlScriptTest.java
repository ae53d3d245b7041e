/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.output;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScriptTest {

    @Test
    void splitsOnSemicolonsAndDropsBlankStatements() {
        List<String> statements = SqlScript.split("CREATE TABLE a (id INT);\n\n;  CREATE TABLE b (id INT)");

        assertEquals(List.of("CREATE TABLE a (id INT)", "CREATE TABLE b (id INT)"), statements);
    }

    @Test
    void semicolonsInsideLiteralsAndIdentifiersAreKept() {
        List<String> statements = SqlScript.split(
                "COMMENT ON TABLE t IS 'a; b ''quoted''';\nSELECT \"odd;name\" FROM t;");

        assertEquals(2, statements.size());
        assertEquals("COMMENT ON TABLE t IS 'a; b ''quoted'''", statements.get(0));
        assertEquals("SELECT \"odd;name\" FROM t", statements.get(1));
    }

    @Test
    void commentsDoNotTerminateOrCreateStatements() {
        String script = """
                -- header; not a statement
                CREATE TABLE a (id INT); -- trailing; comment
                /* block; comment */
                -- only comments after this
                """;

        List<String> statements = SqlScript.split(script);

        assertEquals(1, statements.size());
        assertTrue(statements.get(0).startsWith("-- header; not a statement"));
        assertTrue(statements.get(0).endsWith("CREATE TABLE a (id INT)"));
    }

    @Test
    void dollarQuotedBodiesStayWhole() {
        String script = "CREATE FUNCTION f() RETURNS int AS $body$ BEGIN RETURN 1; END; $body$ LANGUAGE plpgsql;"
                + "DO $$ BEGIN PERFORM 1; END $$;"
                + "SELECT $1";

        List<String> statements = SqlScript.split(script);

        assertEquals(3, statements.size());
        assertTrue(statements.get(0).contains("RETURN 1; END; $body$"));
        assertEquals("DO $$ BEGIN PERFORM 1; END $$", statements.get(1));
        assertEquals("SELECT $1", statements.get(2));
    }

    @Test
    void emptyInput() {
        assertTrue(SqlScript.split(null).isEmpty());
        assertTrue(SqlScript.split("  \n ").isEmpty());
    }

    @Test
    void identifiersAreQuotedAndEscaped() {
        assertEquals("\"staging\"", SqlIdentifiers.quote("staging"));
        assertEquals("\"Mixed Case\"", SqlIdentifiers.quote("Mixed Case"));
        assertEquals("\"a\"\"b\"", SqlIdentifiers.quote("a\"b"));
        assertEquals("\"x\", \"y\"", SqlIdentifiers.quotedList(List.of("x", "y")));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(" "));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.quote(null));
    }
}
