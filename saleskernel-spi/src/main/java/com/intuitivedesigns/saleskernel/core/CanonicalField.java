/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The fourteen columns of a {@link CanonicalRecord}, in canonical order.
 */
public enum CanonicalField {
    PRODUCT_ID("product_id"),
    PRODUCT_NAME("product_name"),
    CATEGORY_NAME("category_name"),
    PRICE_CENTS("price_cents"),
    SHIPPING_COST_CENTS("shipping_cost_cents"),
    PURCHASE_DATE("purchase_date"),
    SELLER_NAME("seller_name"),
    PURCHASE_LOCATION_CODE("purchase_location_code"),
    PURCHASE_RATING("purchase_rating"),
    PAYMENT_TYPE("payment_type"),
    INSTALLMENTS_QUANTITY("installments_quantity"),
    LATITUDE("latitude"),
    LONGITUDE("longitude"),
    ETL_LOAD_TIMESTAMP("etl_load_timestamp");

    private static final List<String> COLUMN_NAMES = Arrays.stream(values())
            .map(CanonicalField::columnName)
            .toList();

    private final String columnName;

    CanonicalField(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public static List<String> columnNames() {
        return COLUMN_NAMES;
    }

    public static Optional<CanonicalField> fromColumn(String columnName) {
        if (columnName == null) return Optional.empty();
        for (CanonicalField f : values()) {
            if (f.columnName.equals(columnName)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
