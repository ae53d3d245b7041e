/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.metrics;

/**
 * The vendor-agnostic contract for pipeline instrumentation.
 *
 * Components record through this facade so they run unchanged whether metrics are
 * backed by Micrometer or disabled ({@link NoopMetricsRuntime}).
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    // --- Standard Instrumentation Methods (with NOOP defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    @Override
    default void close() {
        // no-op by default
    }
}
