/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fixed-shape, normalized representation of one sale.
 *
 * <p>Every component is always present; absent source data is an explicit {@code null}
 * or a named default chosen by the normalizer. Text fields are lower-case and trimmed.
 * Monetary values are integer minor units (cents).</p>
 */
public record CanonicalRecord(
        String productId,
        String productName,
        String categoryName,
        Integer priceCents,
        Integer shippingCostCents,
        LocalDate purchaseDate,
        String sellerName,
        String purchaseLocationCode,
        Integer purchaseRating,
        String paymentType,
        Integer installmentsQuantity,
        Double latitude,
        Double longitude,
        Instant etlLoadTimestamp
) {

    /**
     * Value of a column by its canonical name.
     * Unknown names resolve to {@code null} rather than failing, so callers can bind
     * arbitrary column lists positionally.
     */
    public Object get(String columnName) {
        return CanonicalField.fromColumn(columnName).map(this::get).orElse(null);
    }

    public Object get(CanonicalField field) {
        return switch (field) {
            case PRODUCT_ID -> productId;
            case PRODUCT_NAME -> productName;
            case CATEGORY_NAME -> categoryName;
            case PRICE_CENTS -> priceCents;
            case SHIPPING_COST_CENTS -> shippingCostCents;
            case PURCHASE_DATE -> purchaseDate;
            case SELLER_NAME -> sellerName;
            case PURCHASE_LOCATION_CODE -> purchaseLocationCode;
            case PURCHASE_RATING -> purchaseRating;
            case PAYMENT_TYPE -> paymentType;
            case INSTALLMENTS_QUANTITY -> installmentsQuantity;
            case LATITUDE -> latitude;
            case LONGITUDE -> longitude;
            case ETL_LOAD_TIMESTAMP -> etlLoadTimestamp;
        };
    }

    /**
     * All fourteen columns in canonical order. Null values are kept as entries.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (CanonicalField f : CanonicalField.values()) {
            map.put(f.columnName(), get(f));
        }
        return Collections.unmodifiableMap(map);
    }
}
