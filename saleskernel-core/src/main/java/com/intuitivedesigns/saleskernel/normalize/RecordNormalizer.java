/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import com.intuitivedesigns.saleskernel.core.CanonicalField;
import com.intuitivedesigns.saleskernel.core.CanonicalRecord;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one raw sale record into a {@link CanonicalRecord}.
 *
 * <p>Stateless and never throws for malformed input. Each field resolves independently to a
 * {@link FieldOutcome}; a malformed field is logged at WARN and degrades to its default without
 * affecting any other field.</p>
 *
 * <p>Pipeline, in order:</p>
 * <ol>
 *   <li>Field selection and rename ({@link SourceField}); empty {@code id} means no product id.</li>
 *   <li>Text normalization (lower-case, trim) of the five text fields.</li>
 *   <li>Numeric coercion: cents, integers, coordinates.</li>
 *   <li>Date parsing ({@code dd/MM/yyyy}).</li>
 *   <li>Default substitution ({@link CanonicalDefaults}) for fields still null.</li>
 *   <li>Batch timestamp stamp, after defaulting.</li>
 * </ol>
 */
public final class RecordNormalizer {

    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    private static final String UNKNOWN_RECORD = "unknown id/name";

    private final MetricsRuntime metrics;

    public RecordNormalizer(MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @param raw source record; {@code null} is treated as an empty record
     * @param batchTimestamp capture time shared by the whole batch
     */
    public CanonicalRecord normalize(Map<String, ?> raw, Instant batchTimestamp) {
        Objects.requireNonNull(batchTimestamp, "batchTimestamp");

        final Map<CanonicalField, FieldOutcome<?>> outcomes = inspect(raw);
        final String recordRef = describe(outcomes, raw);

        final Map<CanonicalField, Object> values = new EnumMap<>(CanonicalField.class);
        int malformed = 0;
        int defaulted = 0;

        // 5. Defaults: only fields that are still null after parsing
        for (Map.Entry<CanonicalField, FieldOutcome<?>> e : outcomes.entrySet()) {
            final CanonicalField field = e.getKey();
            final FieldOutcome<?> outcome = e.getValue();

            if (outcome.isMalformed()) {
                malformed++;
                log.warn("Invalid value for '{}' in record '{}': {}. Using default {}.",
                        field.columnName(), recordRef, outcome.detail(), quoted(CanonicalDefaults.defaultFor(field)));
            }

            Object value = outcome.value();
            if (value == null && CanonicalDefaults.hasSentinel(field)) {
                value = CanonicalDefaults.defaultFor(field);
                defaulted++;
            }
            values.put(field, value);
        }

        // 6. ETL metadata
        values.put(CanonicalField.ETL_LOAD_TIMESTAMP, batchTimestamp);

        metrics.counter("normalize.records");
        metrics.counter("normalize.fields.malformed", malformed);
        metrics.counter("normalize.fields.defaulted", defaulted);

        return new CanonicalRecord(
                (String) values.get(CanonicalField.PRODUCT_ID),
                (String) values.get(CanonicalField.PRODUCT_NAME),
                (String) values.get(CanonicalField.CATEGORY_NAME),
                (Integer) values.get(CanonicalField.PRICE_CENTS),
                (Integer) values.get(CanonicalField.SHIPPING_COST_CENTS),
                (LocalDate) values.get(CanonicalField.PURCHASE_DATE),
                (String) values.get(CanonicalField.SELLER_NAME),
                (String) values.get(CanonicalField.PURCHASE_LOCATION_CODE),
                (Integer) values.get(CanonicalField.PURCHASE_RATING),
                (String) values.get(CanonicalField.PAYMENT_TYPE),
                (Integer) values.get(CanonicalField.INSTALLMENTS_QUANTITY),
                (Double) values.get(CanonicalField.LATITUDE),
                (Double) values.get(CanonicalField.LONGITUDE),
                (Instant) values.get(CanonicalField.ETL_LOAD_TIMESTAMP));
    }

    /**
     * Parses every source-backed field without defaulting or stamping.
     * The result has one entry per canonical field except {@code etl_load_timestamp}.
     */
    public Map<CanonicalField, FieldOutcome<?>> inspect(Map<String, ?> raw) {
        final Map<String, ?> source = (raw == null) ? Collections.emptyMap() : raw;
        final Map<CanonicalField, FieldOutcome<?>> out = new EnumMap<>(CanonicalField.class);

        // 1. Selection & rename
        out.put(CanonicalField.PRODUCT_ID, FieldParsers.identifier(source.get(SourceField.ID.label())));

        // 2. Text
        text(out, source, SourceField.PRODUCT);
        text(out, source, SourceField.CATEGORY);
        text(out, source, SourceField.SELLER);
        text(out, source, SourceField.PURCHASE_LOCATION);
        text(out, source, SourceField.PAYMENT_TYPE);

        // 3. Numbers
        out.put(CanonicalField.PRICE_CENTS, FieldParsers.cents(source.get(SourceField.PRICE.label())));
        out.put(CanonicalField.SHIPPING_COST_CENTS, FieldParsers.embeddedCents(source.get(SourceField.SHIPPING.label())));
        out.put(CanonicalField.PURCHASE_RATING, FieldParsers.integer(source.get(SourceField.PURCHASE_RATING.label())));
        out.put(CanonicalField.INSTALLMENTS_QUANTITY, FieldParsers.integer(source.get(SourceField.INSTALLMENTS.label())));
        out.put(CanonicalField.LATITUDE, FieldParsers.decimal(source.get(SourceField.LATITUDE.label())));
        out.put(CanonicalField.LONGITUDE, FieldParsers.decimal(source.get(SourceField.LONGITUDE.label())));

        // 4. Dates
        out.put(CanonicalField.PURCHASE_DATE, FieldParsers.purchaseDate(source.get(SourceField.PURCHASE_DATE.label())));

        return out;
    }

    // --- Helpers ---

    private static void text(Map<CanonicalField, FieldOutcome<?>> out, Map<String, ?> source, SourceField field) {
        out.put(field.target(), FieldParsers.text(source.get(field.label())));
    }

    private static String describe(Map<CanonicalField, FieldOutcome<?>> outcomes, Map<String, ?> raw) {
        Object id = outcomes.get(CanonicalField.PRODUCT_ID).value();
        if (id != null) return id.toString();
        Object name = (raw == null) ? null : raw.get(SourceField.PRODUCT.label());
        return (name != null) ? String.valueOf(name) : UNKNOWN_RECORD;
    }

    private static String quoted(Object value) {
        return (value == null) ? "null" : "'" + value + "'";
    }
}
