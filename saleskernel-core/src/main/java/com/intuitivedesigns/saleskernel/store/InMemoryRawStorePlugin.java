/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.RawStore;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.RawStorePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Raw store kept in process memory. Nothing survives a restart.
 * <p>
 * ID: MEMORY
 */
public final class InMemoryRawStorePlugin implements RawStorePlugin {

    public static final String ID = "MEMORY";
    private static final Logger log = LoggerFactory.getLogger(InMemoryRawStorePlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RawStore<?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        log.warn("⚠ In-memory raw store active: raw records are not persisted.");
        return new InMemoryRawStore();
    }
}
