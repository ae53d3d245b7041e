/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.metrics;

public final class NoopMetricsRuntime implements MetricsRuntime {

    public static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

    // Sentinel object to prevent NPEs in "instanceof" checks downstream
    private final Object sentinelRegistry = new Object();

    private NoopMetricsRuntime() {}

    @Override
    public Object registry() {
        return sentinelRegistry;
    }
}
