/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import com.intuitivedesigns.saleskernel.core.CanonicalField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sentinel values substituted for canonical fields that are still null after parsing.
 * Numeric, date and coordinate fields default to null.
 */
public final class CanonicalDefaults {

    public static final String PRODUCT_NAME = "nome indisponível";
    public static final String CATEGORY_NAME = "outros";
    public static final String SELLER_NAME = "vendedor desconhecido";
    public static final String PURCHASE_LOCATION_CODE = "n/a";
    public static final String PAYMENT_TYPE = "não especificado";

    private static final Map<CanonicalField, Object> DEFAULTS;

    static {
        Map<CanonicalField, Object> m = new EnumMap<>(CanonicalField.class);
        m.put(CanonicalField.PRODUCT_NAME, PRODUCT_NAME);
        m.put(CanonicalField.CATEGORY_NAME, CATEGORY_NAME);
        m.put(CanonicalField.SELLER_NAME, SELLER_NAME);
        m.put(CanonicalField.PURCHASE_LOCATION_CODE, PURCHASE_LOCATION_CODE);
        m.put(CanonicalField.PAYMENT_TYPE, PAYMENT_TYPE);
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private CanonicalDefaults() {}

    /**
     * @return the sentinel for {@code field}, or {@code null} when the field defaults to null
     */
    public static Object defaultFor(CanonicalField field) {
        return DEFAULTS.get(field);
    }

    public static boolean hasSentinel(CanonicalField field) {
        return DEFAULTS.containsKey(field);
    }
}
