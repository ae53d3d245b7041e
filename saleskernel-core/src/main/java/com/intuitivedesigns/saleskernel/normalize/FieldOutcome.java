/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.normalize;

import java.util.Objects;

/**
 * Tagged result of parsing one source field.
 *
 * <p>A field either parsed to a value, was absent from the source, or was present but
 * unusable. Parsers never throw; callers decide what a MISSING or MALFORMED field becomes.</p>
 *
 * @param value the parsed value; {@code null} unless {@code status == PARSED}
 * @param status how the field resolved
 * @param detail human readable reason for MALFORMED, otherwise {@code null}
 */
public record FieldOutcome<T>(T value, Status status, String detail) {

    public enum Status {
        PARSED,
        MISSING,
        MALFORMED
    }

    public FieldOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.PARSED) {
            Objects.requireNonNull(value, "parsed value");
        } else if (value != null) {
            throw new IllegalArgumentException(status + " outcome cannot carry a value");
        }
    }

    public static <T> FieldOutcome<T> parsed(T value) {
        return new FieldOutcome<>(value, Status.PARSED, null);
    }

    public static <T> FieldOutcome<T> missing() {
        return new FieldOutcome<>(null, Status.MISSING, null);
    }

    public static <T> FieldOutcome<T> malformed(String detail) {
        return new FieldOutcome<>(null, Status.MALFORMED, detail);
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isMalformed() {
        return status == Status.MALFORMED;
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }
}
