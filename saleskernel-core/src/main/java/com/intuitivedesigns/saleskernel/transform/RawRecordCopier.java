/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.transform;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Structural copy of decoded raw records (nested maps, lists and immutable scalars).
 *
 * Throws {@link IllegalArgumentException} for cyclic structures and for values whose
 * mutability it cannot reason about.
 */
final class RawRecordCopier {

    private RawRecordCopier() {}

    static List<Map<String, Object>> copyBatch(List<Map<String, Object>> batch) {
        final List<Map<String, Object>> out = new ArrayList<>(batch.size());
        for (Map<String, Object> item : batch) {
            out.add(copyRecord(item));
        }
        return out;
    }

    static Map<String, Object> copyRecord(Map<String, Object> item) {
        if (item == null) return null;
        return copyMap(item, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, Set<Object> path) {
        enter(source, path);
        final Map<String, Object> copy = new LinkedHashMap<>(Math.max(16, source.size() * 2));
        for (Map.Entry<?, ?> e : source.entrySet()) {
            if (!(e.getKey() instanceof String key)) {
                throw new IllegalArgumentException("Non-string key in raw record: " + e.getKey());
            }
            copy.put(key, copyValue(e.getValue(), path));
        }
        path.remove(source);
        return copy;
    }

    private static List<Object> copyList(List<?> source, Set<Object> path) {
        enter(source, path);
        final List<Object> copy = new ArrayList<>(source.size());
        for (Object v : source) {
            copy.add(copyValue(v, path));
        }
        path.remove(source);
        return copy;
    }

    private static Object copyValue(Object value, Set<Object> path) {
        if (value == null || isImmutableScalar(value)) return value;
        if (value instanceof Map<?, ?> m) return copyMap(m, path);
        if (value instanceof List<?> l) return copyList(l, path);
        throw new IllegalArgumentException("Cannot deep-copy value of type " + value.getClass().getName());
    }

    private static boolean isImmutableScalar(Object v) {
        return v instanceof String
                || v instanceof Boolean
                || v instanceof Character
                || v instanceof Integer
                || v instanceof Long
                || v instanceof Short
                || v instanceof Byte
                || v instanceof Double
                || v instanceof Float
                || v instanceof BigDecimal
                || v instanceof BigInteger
                || v instanceof UUID
                || v instanceof Enum<?>
                || v instanceof Temporal;
    }

    private static void enter(Object container, Set<Object> path) {
        if (!path.add(container)) {
            throw new IllegalArgumentException("Cyclic structure in raw record");
        }
    }
}
