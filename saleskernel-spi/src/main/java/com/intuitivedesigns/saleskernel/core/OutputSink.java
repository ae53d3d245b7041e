/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.core;

import java.util.List;

/**
 * A pluggable destination for a transformed batch.
 *
 * <p><b>Lifecycle per run:</b> {@link #prepare()} once before any data moves,
 * {@link #write(List)} with the full batch, then {@link #complete()} for downstream work
 * that depends on the written batch.</p>
 *
 * <p><b>Failure Contract:</b> throw if anything could not be persisted. Do NOT swallow
 * exceptions; the orchestrator turns them into a failed run.</p>
 *
 * @param <T> The record type accepted by this sink.
 */
public interface OutputSink<T> extends AutoCloseable {

    /**
     * Makes the destination ready (e.g. create missing tables).
     */
    default void prepare() throws Exception {
        // no-op by default
    }

    /**
     * Replaces the destination contents with {@code batch}, atomically.
     *
     * @return number of records written
     */
    int write(List<T> batch) throws Exception;

    /**
     * Post-load step (e.g. populate derived tables).
     */
    default void complete() throws Exception {
        // no-op by default
    }

    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
