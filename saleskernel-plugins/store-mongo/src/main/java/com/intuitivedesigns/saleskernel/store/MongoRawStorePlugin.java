/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.RawStore;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.RawStorePlugin;

/**
 * ID: MONGO
 */
public final class MongoRawStorePlugin implements RawStorePlugin {

    public static final String ID = "MONGO";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RawStore<?> create(PipelineConfig config, MetricsRuntime metrics) {
        return MongoRawStore.fromConfig(config, metrics);
    }
}
