/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.List;

/**
 * A batch transformation step in the pipeline.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li><b>Order:</b> output element {@code i} corresponds to input element {@code i}.</li>
 * <li><b>Isolation:</b> the caller's input is never mutated.</li>
 * <li><b>Failure:</b> per-record problems degrade inside the record; the batch call itself does not fail.</li>
 * </ul>
 *
 * @param <I> Input record type
 * @param <O> Output record type
 */
public interface Transformer<I, O> extends AutoCloseable {

    List<O> transform(List<I> batch);

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
