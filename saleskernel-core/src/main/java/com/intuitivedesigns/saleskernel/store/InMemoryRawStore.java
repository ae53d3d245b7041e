/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

import com.intuitivedesigns.saleskernel.core.RawStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local raw buffer. Records are copied in and out, so callers cannot alter what is stored.
 */
public final class InMemoryRawStore implements RawStore<Map<String, Object>> {

    private final List<Map<String, Object>> records = new ArrayList<>();

    @Override
    public synchronized int replaceAll(List<Map<String, Object>> incoming) {
        records.clear();
        if (incoming == null) return 0;
        for (Map<String, Object> r : incoming) {
            if (r != null) records.add(new LinkedHashMap<>(r));
        }
        return records.size();
    }

    @Override
    public synchronized List<Map<String, Object>> readAll() {
        final List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (Map<String, Object> r : records) {
            out.add(new LinkedHashMap<>(r));
        }
        return out;
    }

    @Override
    public String id() {
        return InMemoryRawStorePlugin.ID;
    }
}
