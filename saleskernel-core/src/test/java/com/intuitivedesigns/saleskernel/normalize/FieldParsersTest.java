/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FieldParsersTest {

    @Test
    void nullIsMissingForEveryParser() {
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.identifier(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.text(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.cents(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.embeddedCents(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.integer(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.decimal(null).status());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.purchaseDate(null).status());
    }

    @Test
    void emptyIdentifierIsMissing() {
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.identifier("").status());
        assertEquals("17", FieldParsers.identifier(17).value());
        assertEquals(" a1 ", FieldParsers.identifier(" a1 ").value());
    }

    @Test
    void textIsLowerCasedThenTrimmed() {
        assertEquals("mouse gamer", FieldParsers.text("  Mouse GAMER ").value());
        assertEquals("42", FieldParsers.text(42).value());
        assertEquals("", FieldParsers.text("   ").value());
    }

    @Test
    void centsTruncateTowardZeroWithExactDecimals() {
        assertEquals(4990, FieldParsers.cents("49.9").value());
        assertEquals(4990, FieldParsers.cents(49.9).value());
        assertEquals(29, FieldParsers.cents("0.29").value());
        assertEquals(1234, FieldParsers.cents(" 12.345 ").value());
        assertEquals(-199, FieldParsers.cents(-1.999).value());
        assertEquals(1000, FieldParsers.cents(10).value());
        assertEquals(150, FieldParsers.cents(new BigDecimal("1.50")).value());
    }

    @Test
    void unusableAmountsAreMalformed() {
        assertTrue(FieldParsers.cents("abc").isMalformed());
        assertTrue(FieldParsers.cents("NaN").isMalformed());
        assertTrue(FieldParsers.cents(Double.NaN).isMalformed());
        assertTrue(FieldParsers.cents(Boolean.TRUE).isMalformed());
        assertTrue(FieldParsers.cents("1e12").isMalformed(), "does not fit an int");
        assertNull(FieldParsers.cents("abc").value());
        assertNotNull(FieldParsers.cents("abc").detail());
    }

    @Test
    void extremeExponentsAreRejectedWithoutExpandingThem() {
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertTrue(FieldParsers.cents("1e999999999").isMalformed());
            assertTrue(FieldParsers.cents("9e99999999").isMalformed());
            assertTrue(FieldParsers.cents("-9e99999999").isMalformed());
            assertEquals(0, FieldParsers.cents("1e-999999999").value());
            assertEquals(0, FieldParsers.cents("-0.001").value());
            assertTrue(FieldParsers.integer(new BigDecimal("9e99999999")).isMalformed());
            assertEquals(0, FieldParsers.integer(new BigDecimal("1e-999999999")).value());
        });
    }

    @Test
    void shippingUsesFirstNumericRun() {
        assertEquals(1250, FieldParsers.embeddedCents("R$ 12.50").value());
        assertEquals(700, FieldParsers.embeddedCents("R$ 7,50 frete").value());
        assertEquals(50, FieldParsers.embeddedCents(".5").value());
        assertEquals(1500, FieldParsers.embeddedCents(15).value());
        assertEquals(2390, FieldParsers.embeddedCents(23.9).value());
        assertTrue(FieldParsers.embeddedCents("grátis").isMalformed());
    }

    @Test
    void integersAcceptIntegralStringsAndTruncateNumbers() {
        assertEquals(4, FieldParsers.integer("4").value());
        assertEquals(3, FieldParsers.integer(" 3 ").value());
        assertEquals(4, FieldParsers.integer(4.7).value());
        assertEquals(5, FieldParsers.integer(5L).value());
        assertTrue(FieldParsers.integer("4.5").isMalformed());
        assertTrue(FieldParsers.integer("quatro").isMalformed());
        assertTrue(FieldParsers.integer(Boolean.FALSE).isMalformed());
        assertTrue(FieldParsers.integer(Long.MAX_VALUE).isMalformed());
    }

    @Test
    void coordinates() {
        assertEquals(-23.55052, FieldParsers.decimal("-23.55052").value());
        assertEquals(-46.6, FieldParsers.decimal(-46.6).value());
        assertTrue(FieldParsers.decimal("north").isMalformed());
        assertTrue(FieldParsers.decimal(Double.POSITIVE_INFINITY).isMalformed());
    }

    @Test
    void purchaseDateIsStrictDayMonthYear() {
        assertEquals(LocalDate.of(2024, 3, 5), FieldParsers.purchaseDate("05/03/2024").value());
        assertEquals(LocalDate.of(2024, 3, 5), FieldParsers.purchaseDate("5/3/2024").value());
        assertTrue(FieldParsers.purchaseDate("31/02/2024").isMalformed());
        assertTrue(FieldParsers.purchaseDate("2024-03-05").isMalformed());
        assertTrue(FieldParsers.purchaseDate(" 05/03/2024").isMalformed());
        assertTrue(FieldParsers.purchaseDate(20240305).isMalformed());
        assertEquals(FieldOutcome.Status.MISSING, FieldParsers.purchaseDate("  ").status());
    }

    @Test
    void outcomeRejectsInconsistentState() {
        assertThrows(NullPointerException.class, () -> FieldOutcome.parsed(null));
        assertThrows(IllegalArgumentException.class,
                () -> new FieldOutcome<>("x", FieldOutcome.Status.MISSING, null));
        assertEquals("fallback", FieldOutcome.<String>missing().orElse("fallback"));
    }
}
