/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalRecordTest {

    private static final Instant LOADED_AT = Instant.parse("2024-03-06T10:15:30Z");

    private static CanonicalRecord sample() {
        return new CanonicalRecord(null, "mouse", "eletronicos", 4990, 750,
                LocalDate.of(2024, 3, 5), "ana", "sp", 4, "boleto", 1,
                -23.5, -46.6, LOADED_AT);
    }

    @Test
    void asMapKeepsAllFourteenColumnsInCanonicalOrder() {
        Map<String, Object> map = sample().asMap();

        assertEquals(14, map.size());
        assertEquals(CanonicalField.columnNames(), new ArrayList<>(map.keySet()));
        assertTrue(map.containsKey("product_id"));
        assertNull(map.get("product_id"));
        assertEquals(4990, map.get("price_cents"));
    }

    @Test
    void lookupByColumnName() {
        CanonicalRecord r = sample();

        assertEquals(LocalDate.of(2024, 3, 5), r.get("purchase_date"));
        assertEquals(LOADED_AT, r.get("etl_load_timestamp"));
        assertNull(r.get("no_such_column"));
        assertNull(r.get((String) null));
    }
}
