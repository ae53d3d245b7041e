/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import com.intuitivedesigns.saleskernel.core.CanonicalField;

/**
 * Known labels of the upstream sales API and the canonical column each one feeds.
 */
public enum SourceField {
    ID("id", CanonicalField.PRODUCT_ID),
    PRODUCT("Produto", CanonicalField.PRODUCT_NAME),
    CATEGORY("Categoria do Produto", CanonicalField.CATEGORY_NAME),
    PRICE("Preço", CanonicalField.PRICE_CENTS),
    SHIPPING("Frete", CanonicalField.SHIPPING_COST_CENTS),
    PURCHASE_DATE("Data da Compra", CanonicalField.PURCHASE_DATE),
    SELLER("Vendedor", CanonicalField.SELLER_NAME),
    PURCHASE_LOCATION("Local da compra", CanonicalField.PURCHASE_LOCATION_CODE),
    PURCHASE_RATING("Avaliação da compra", CanonicalField.PURCHASE_RATING),
    PAYMENT_TYPE("Tipo de pagamento", CanonicalField.PAYMENT_TYPE),
    INSTALLMENTS("Quantidade de parcelas", CanonicalField.INSTALLMENTS_QUANTITY),
    LATITUDE("lat", CanonicalField.LATITUDE),
    LONGITUDE("lon", CanonicalField.LONGITUDE);

    private final String label;
    private final CanonicalField target;

    SourceField(String label, CanonicalField target) {
        this.label = label;
        this.target = target;
    }

    public String label() {
        return label;
    }

    public CanonicalField target() {
        return target;
    }
}
