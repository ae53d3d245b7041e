/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.List;

/**
 * Durable buffer for raw records between extraction and transformation.
 * It has no transformation responsibility: what goes in comes back out.
 *
 * @param <T> raw record type
 */
public interface RawStore<T> extends AutoCloseable {

    /**
     * Removes every stored record, then stores {@code records}.
     *
     * @return number of records stored
     */
    int replaceAll(List<T> records) throws Exception;

    /**
     * @return all stored records, never {@code null}
     */
    List<T> readAll() throws Exception;

    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
